package com.sailfish.transport.repository;

import com.sailfish.transport.model.PendingCall;

import java.util.List;

/**
 * Storage for calls waiting for the next batched resend.
 * Implementations need not be thread-safe; the retry scheduler serializes access.
 */
public interface PendingCallQueue {

    /**
     * Appends a call to the tail of the queue.
     *
     * @param call The call to enqueue.
     */
    void add(PendingCall call);

    /**
     * Removes every queued call.
     *
     * @return The removed calls in FIFO order. Empty if nothing was queued.
     */
    List<PendingCall> drainAll();

    int size();

    boolean isEmpty();
}
