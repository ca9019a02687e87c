package com.sailfish.transport.repository;

import com.sailfish.transport.model.PendingCall;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * FIFO {@link PendingCallQueue} held in memory. Not thread-safe.
 */
public class InMemoryPendingCallQueue implements PendingCallQueue {

    private final Deque<PendingCall> calls = new ArrayDeque<>();

    @Override
    public void add(PendingCall call) {
        calls.addLast(Objects.requireNonNull(call, "call cannot be null"));
    }

    @Override
    public List<PendingCall> drainAll() {
        if (calls.isEmpty()) {
            return Collections.emptyList();
        }
        List<PendingCall> drained = new ArrayList<>(calls);
        calls.clear();
        return drained;
    }

    @Override
    public int size() {
        return calls.size();
    }

    @Override
    public boolean isEmpty() {
        return calls.isEmpty();
    }
}
