/**
 * Contains the retry queue abstraction, {@link com.sailfish.transport.repository.PendingCallQueue},
 * and its in-memory FIFO implementation. Retry state is never persisted.
 */
package com.sailfish.transport.repository;
