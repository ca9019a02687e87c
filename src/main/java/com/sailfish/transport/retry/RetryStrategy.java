package com.sailfish.transport.retry;

import com.sailfish.transport.model.PendingCall;

import java.time.Duration;

/**
 * Defines the strategy for handling retries of failed transport calls.
 */
public interface RetryStrategy {

    /**
     * Classifies a failure, independently of any retry budget.
     *
     * @param failure The failure reported by the underlying transport, already unwrapped.
     * @return true if the failure is a connectivity-level failure worth resending.
     */
    boolean isRetryable(Throwable failure);

    /**
     * Determines if a call should be queued for another attempt.
     *
     * @param call    The call whose attempt just failed. Its retry count has not been incremented yet.
     * @param failure The failure of that attempt.
     * @return true if the call should be resent, false if the failure goes to the caller.
     */
    boolean shouldRetry(PendingCall call, Throwable failure);

    /**
     * @return the delay between a failure being queued and the batch resend.
     */
    Duration getRetryDelay();
}
