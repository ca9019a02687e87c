package com.sailfish.transport.retry;

/**
 * Retry settings for a single HTTP verb.
 */
public final class MethodRetryPolicy {

    private final int retryLimit;

    private MethodRetryPolicy(int retryLimit) {
        if (retryLimit < 0) throw new IllegalArgumentException("retryLimit must be non-negative");
        this.retryLimit = retryLimit;
    }

    /**
     * @param retryLimit Maximum number of resends after the first attempt. Zero disables retries.
     */
    public static MethodRetryPolicy of(int retryLimit) {
        return new MethodRetryPolicy(retryLimit);
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    public boolean isEnabled() {
        return retryLimit > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return retryLimit == ((MethodRetryPolicy) o).retryLimit;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(retryLimit);
    }

    @Override
    public String toString() {
        return "MethodRetryPolicy{retryLimit=" + retryLimit + '}';
    }
}
