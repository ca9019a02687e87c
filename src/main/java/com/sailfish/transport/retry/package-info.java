/**
 * Contains the retry configuration and the strategy deciding which failed calls are resent,
 * such as {@link com.sailfish.transport.retry.RetryStrategy} and the default
 * {@link com.sailfish.transport.retry.FixedDelayRetryStrategy}.
 */
package com.sailfish.transport.retry;
