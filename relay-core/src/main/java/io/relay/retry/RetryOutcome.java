package io.relay.retry;

import java.util.Objects;

/**
 * Terminal result of {@link RetryExecutor#execute}. Failures are values, not exceptions, so
 * callers branch on the outcome instead of unwinding the stack.
 *
 * @param <T> type of the operation's result
 */
public sealed interface RetryOutcome<T> {

  /** Number of attempts that were started. */
  int attempts();

  /**
   * The operation returned a value.
   */
  record Success<T>(T value, int attempts) implements RetryOutcome<T> {
  }

  /**
   * The attempt budget ran out, or the error was not retryable.
   */
  record Failure<T>(Exception lastError, int attempts) implements RetryOutcome<T> {
    public Failure {
      Objects.requireNonNull(lastError, "lastError");
    }
  }

  /**
   * The token was cancelled or the thread interrupted before the operation succeeded.
   *
   * @param lastError the most recent operation error, or {@code null} if none was seen
   */
  record Cancelled<T>(int attempts, Exception lastError) implements RetryOutcome<T> {
  }
}
