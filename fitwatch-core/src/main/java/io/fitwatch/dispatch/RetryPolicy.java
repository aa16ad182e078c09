package io.fitwatch.dispatch;

/**
 * Strategy for computing the delay before retrying a transiently failed conversion.
 *
 * @see LinearBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
