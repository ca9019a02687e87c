package com.sailfish.transport.model;

/**
 * Represents the lifecycle states of a managed transport call.
 */
public enum CallStatus {
    /**
     * The call has been handed to the underlying transport and awaits its response.
     */
    IN_FLIGHT,
    /**
     * The last attempt failed at connectivity level; the call waits in the retry queue.
     */
    PENDING_RETRY,
    /**
     * The caller's future completed with a response.
     */
    COMPLETED,
    /**
     * The caller's future completed with the final failure.
     */
    FAILED,
    /**
     * The retry transport was disposed before the call finished. The caller's future never completes.
     */
    ABANDONED
}
