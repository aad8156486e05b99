package io.relay.retry;

/**
 * Strategy for bounding and spacing retries of a failing operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Maximum number of attempts, including the first one. {@code 0} means unbounded, which
     * only makes sense together with a {@link CancellationToken}.
     *
     * @return attempt budget
     */
    int maxAttempts();

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempts the number of attempts made so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
