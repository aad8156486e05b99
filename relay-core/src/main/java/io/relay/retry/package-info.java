/**
 * Bounded retries with exponential backoff and jitter.
 *
 * <p>{@link io.relay.retry.RetryExecutor} runs an operation until it succeeds, the attempt budget
 * of its {@link io.relay.retry.RetryPolicy} runs out, or a {@link io.relay.retry.CancellationToken}
 * is cancelled. Results come back as a {@link io.relay.retry.RetryOutcome} rather than exceptions.
 *
 * @see io.relay.retry.RetryExecutor
 * @see io.relay.retry.ExponentialBackoffRetryPolicy
 */
package io.relay.retry;
