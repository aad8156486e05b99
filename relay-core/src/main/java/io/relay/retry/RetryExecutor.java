package io.relay.retry;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an operation under a {@link RetryPolicy}, sleeping between attempts.
 *
 * <p>Waits are performed on the {@link CancellationToken}, so cancelling it ends a pending
 * backoff immediately. Thread interruption is treated as cancellation; the interrupt flag is
 * restored before returning.
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final String name;
  private final RetryPolicy policy;
  private final Predicate<Exception> retryable;

  public RetryExecutor(String name, RetryPolicy policy) {
    this(name, policy, e -> true);
  }

  /**
   * @param retryable decides whether an error is worth another attempt; errors it rejects end
   *                  the run with a {@link RetryOutcome.Failure}
   */
  public RetryExecutor(String name, RetryPolicy policy, Predicate<Exception> retryable) {
    this.name = Objects.requireNonNull(name, "name");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.retryable = Objects.requireNonNull(retryable, "retryable");
  }

  public RetryPolicy policy() {
    return policy;
  }

  public <T> RetryOutcome<T> execute(RetryableOperation<T> operation) {
    return execute(operation, CancellationToken.none());
  }

  public <T> RetryOutcome<T> execute(RetryableOperation<T> operation, CancellationToken token) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(token, "token");
    int maxAttempts = policy.maxAttempts();
    Exception lastError = null;
    int attempt = 0;
    while (true) {
      if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
        return new RetryOutcome.Cancelled<>(attempt, lastError);
      }
      attempt++;
      try {
        return new RetryOutcome.Success<>(operation.call(attempt), attempt);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new RetryOutcome.Cancelled<>(attempt, lastError);
      } catch (Exception e) {
        lastError = e;
      }
      if (token.isCancelled()) {
        return new RetryOutcome.Cancelled<>(attempt, lastError);
      }
      if (!retryable.test(lastError)) {
        logger.log(Level.FINE, "{0}: non-retryable error on attempt {1}: {2}",
            new Object[]{name, attempt, lastError.toString()});
        return new RetryOutcome.Failure<>(lastError, attempt);
      }
      if (maxAttempts > 0 && attempt >= maxAttempts) {
        logger.log(Level.FINE, "{0}: giving up after {1} attempts: {2}",
            new Object[]{name, attempt, lastError.toString()});
        return new RetryOutcome.Failure<>(lastError, attempt);
      }
      long delayMs = policy.computeDelayMs(attempt);
      logger.log(Level.FINE, "{0}: attempt {1} failed ({2}), retrying in {3}ms",
          new Object[]{name, attempt, lastError.toString(), delayMs});
      try {
        if (token.await(delayMs)) {
          return new RetryOutcome.Cancelled<>(attempt, lastError);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new RetryOutcome.Cancelled<>(attempt, lastError);
      }
    }
  }
}
