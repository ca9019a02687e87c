package com.sailfish.transport.retry;

import com.sailfish.transport.error.HttpStatusException;
import com.sailfish.transport.model.PendingCall;

import java.time.Duration;
import java.util.Objects;

/**
 * A retry strategy resending connectivity-level failures after a fixed delay,
 * up to the retry limit configured for the call's verb.
 *
 * A failure carrying an HTTP status means the server was reached, so it is never retried.
 * Any other failure, including exceptions that are not {@link com.sailfish.transport.error.TransportException}s,
 * is treated as "never reached the server".
 */
public class FixedDelayRetryStrategy implements RetryStrategy {

    private final RetryConfiguration configuration;

    public FixedDelayRetryStrategy(RetryConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
    }

    @Override
    public boolean isRetryable(Throwable failure) {
        if (failure instanceof HttpStatusException) {
            return !((HttpStatusException) failure).hasStatus();
        }
        return true;
    }

    @Override
    public boolean shouldRetry(PendingCall call, Throwable failure) {
        return isRetryable(failure) && call.getRetryCount() < configuration.getRetryLimit(call.getMethod());
    }

    @Override
    public Duration getRetryDelay() {
        return configuration.getRetryTimeout();
    }
}
