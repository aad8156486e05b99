package io.relay.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryExecutorTest {
  private static final RetryPolicy NO_DELAY = new ExponentialBackoffRetryPolicy(3, 0, 1.0, 0, 0.0);

  @Test
  void returnsValueOnFirstSuccess() {
    RetryOutcome<String> outcome = new RetryExecutor("t", NO_DELAY).execute(attempt -> "ok");

    RetryOutcome.Success<String> success = assertInstanceOf(RetryOutcome.Success.class, outcome);
    assertEquals("ok", success.value());
    assertEquals(1, success.attempts());
  }

  @Test
  void retriesUntilSuccess() {
    AtomicInteger calls = new AtomicInteger();

    RetryOutcome<Integer> outcome = new RetryExecutor("t", NO_DELAY).execute(attempt -> {
      if (calls.incrementAndGet() < 3) {
        throw new IOException("flaky");
      }
      return attempt;
    });

    RetryOutcome.Success<Integer> success = assertInstanceOf(RetryOutcome.Success.class, outcome);
    assertEquals(3, success.value());
    assertEquals(3, success.attempts());
  }

  @Test
  void returnsLastErrorWhenAttemptsExhausted() {
    RetryOutcome<Object> outcome = new RetryExecutor("t", NO_DELAY).execute(attempt -> {
      throw new IOException("failure " + attempt);
    });

    RetryOutcome.Failure<Object> failure = assertInstanceOf(RetryOutcome.Failure.class, outcome);
    assertEquals(3, failure.attempts());
    assertEquals("failure 3", failure.lastError().getMessage());
  }

  @Test
  void nonRetryableErrorStopsImmediately() {
    AtomicInteger calls = new AtomicInteger();
    RetryExecutor executor = new RetryExecutor("t", NO_DELAY, e -> !(e instanceof IllegalStateException));

    RetryOutcome<Object> outcome = executor.execute(attempt -> {
      calls.incrementAndGet();
      throw new IllegalStateException("misconfigured");
    });

    assertInstanceOf(RetryOutcome.Failure.class, outcome);
    assertEquals(1, calls.get());
  }

  @Test
  void cancelInterruptsBackoffWait() throws Exception {
    RetryPolicy slow = new ExponentialBackoffRetryPolicy(0, 60_000, 1.0, 60_000, 0.0);
    CancellationToken token = new CancellationToken();
    CountDownLatch firstAttempt = new CountDownLatch(1);
    AtomicReference<RetryOutcome<Object>> result = new AtomicReference<>();

    Thread runner = new Thread(() -> result.set(new RetryExecutor("t", slow).execute(attempt -> {
      firstAttempt.countDown();
      throw new IOException("down");
    }, token)));
    runner.start();
    assertTrue(firstAttempt.await(5, TimeUnit.SECONDS));
    long start = System.nanoTime();
    token.cancel();
    runner.join(5_000);

    assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5_000);
    RetryOutcome.Cancelled<Object> cancelled = assertInstanceOf(RetryOutcome.Cancelled.class, result.get());
    assertEquals(1, cancelled.attempts());
    assertEquals("down", cancelled.lastError().getMessage());
  }

  @Test
  void alreadyCancelledTokenRunsNothing() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    AtomicInteger calls = new AtomicInteger();

    RetryOutcome<Object> outcome = new RetryExecutor("t", NO_DELAY).execute(attempt -> calls.incrementAndGet(), token);

    RetryOutcome.Cancelled<Object> cancelled = assertInstanceOf(RetryOutcome.Cancelled.class, outcome);
    assertEquals(0, cancelled.attempts());
    assertNull(cancelled.lastError());
    assertEquals(0, calls.get());
  }

  @Test
  void interruptionIsCancellationAndRestoresFlag() {
    RetryOutcome<Object> outcome = new RetryExecutor("t", NO_DELAY).execute(attempt -> {
      throw new InterruptedException();
    });

    try {
      assertInstanceOf(RetryOutcome.Cancelled.class, outcome);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void unboundedPolicyRetriesUntilCancelled() {
    RetryPolicy unbounded = new ExponentialBackoffRetryPolicy(0, 0, 1.0, 0, 0.0);
    CancellationToken token = new CancellationToken();
    AtomicInteger calls = new AtomicInteger();

    RetryOutcome<Object> outcome = new RetryExecutor("t", unbounded).execute(attempt -> {
      if (calls.incrementAndGet() == 50) {
        token.cancel();
      }
      throw new IOException("down");
    }, token);

    assertInstanceOf(RetryOutcome.Cancelled.class, outcome);
    assertEquals(50, calls.get());
  }

  @Test
  void noneTokenCannotBeCancelled() {
    assertSame(CancellationToken.none(), CancellationToken.none());
    assertThrows(UnsupportedOperationException.class, () -> CancellationToken.none().cancel());
  }
}
