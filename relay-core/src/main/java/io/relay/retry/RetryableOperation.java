package io.relay.retry;

/**
 * Unit of work run by {@link RetryExecutor}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RetryableOperation<T> {

  /**
   * @param attempt the 1-based attempt number
   */
  T call(int attempt) throws Exception;
}
