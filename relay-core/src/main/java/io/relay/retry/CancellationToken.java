package io.relay.retry;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared between the owner of a background activity and the
 * waits it performs. Cancelling wakes every thread blocked in {@link #await(long)}.
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken();

  private final CountDownLatch latch = new CountDownLatch(1);

  /** A token that is never cancelled by anyone holding only this reference. */
  public static CancellationToken none() {
    return NONE;
  }

  public void cancel() {
    if (this == NONE) {
      throw new UnsupportedOperationException("The shared none() token cannot be cancelled");
    }
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits up to {@code millis} or until cancelled.
   *
   * @return {@code true} if the token was cancelled
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(long millis) throws InterruptedException {
    if (millis <= 0) {
      return isCancelled();
    }
    return latch.await(millis, TimeUnit.MILLISECONDS);
  }
}
