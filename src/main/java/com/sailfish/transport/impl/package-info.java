/**
 * Contains the retrying transport decorator, {@link com.sailfish.transport.impl.RetryTransport},
 * and the scheduler batching resends of failed calls.
 */
package com.sailfish.transport.impl;
