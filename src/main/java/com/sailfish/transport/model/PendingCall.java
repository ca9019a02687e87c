package com.sailfish.transport.model;

import com.sailfish.transport.HttpMethod;
import com.sailfish.transport.TransportRequest;
import com.sailfish.transport.TransportResponse;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks one managed transport call across its attempts.
 *
 * The result future is the only channel back to the caller, so it completes at most once
 * no matter how many attempts report back.
 */
public class PendingCall {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final HttpMethod method;
    private final TransportRequest request;
    private final CompletableFuture<TransportResponse> result = new CompletableFuture<>();

    // Incremented by the retry scheduler only, under its lock.
    private volatile int retryCount = 0;

    private volatile CallStatus status = CallStatus.IN_FLIGHT;
    private volatile Throwable lastFailure;

    public PendingCall(HttpMethod method, TransportRequest request) {
        this.id = SEQUENCE.incrementAndGet();
        this.method = Objects.requireNonNull(method, "method cannot be null");
        this.request = request;
    }

    public long getId() {
        return id;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public TransportRequest getRequest() {
        return request;
    }

    /**
     * @return the future handed to the caller.
     */
    public CompletableFuture<TransportResponse> getResult() {
        return result;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public CallStatus getStatus() {
        return status;
    }

    public Throwable getLastFailure() {
        return lastFailure;
    }

    public void setLastFailure(Throwable lastFailure) {
        this.lastFailure = lastFailure;
    }

    /**
     * Increments the retry count and moves the call to {@link CallStatus#PENDING_RETRY}.
     *
     * @return the new retry count.
     */
    public int markPendingRetry() {
        retryCount = retryCount + 1;
        status = CallStatus.PENDING_RETRY;
        return retryCount;
    }

    public void markInFlight() {
        status = CallStatus.IN_FLIGHT;
    }

    /**
     * Completes the caller's future with the response.
     *
     * @return false if the future had already been completed.
     */
    public boolean complete(TransportResponse response) {
        boolean completed = result.complete(response);
        if (completed) {
            status = CallStatus.COMPLETED;
        }
        return completed;
    }

    /**
     * Completes the caller's future with the final failure.
     *
     * @return false if the future had already been completed.
     */
    public boolean fail(Throwable failure) {
        boolean failed = result.completeExceptionally(failure);
        if (failed) {
            status = CallStatus.FAILED;
        }
        return failed;
    }

    /**
     * Drops the call without completing its future.
     */
    public void abandon() {
        if (!result.isDone()) {
            status = CallStatus.ABANDONED;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PendingCall that = (PendingCall) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "PendingCall{" +
               "id=" + id +
               ", method=" + method +
               ", status=" + status +
               ", retryCount=" + retryCount +
               '}';
    }
}
