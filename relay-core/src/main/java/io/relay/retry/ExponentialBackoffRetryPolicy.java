package io.relay.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with symmetric jitter.
 *
 * <p>Delay formula: {@code min(baseDelay * multiplier^(attempts-1), maxDelay) * U[1-jitter, 1+jitter]}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final long baseDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param maxAttempts attempt budget including the first call, {@code 0} for unbounded
   * @param baseDelayMs delay before the second attempt (milliseconds)
   * @param multiplier  growth factor per attempt (&gt;= 1)
   * @param maxDelayMs  cap applied before jitter (milliseconds)
   * @param jitter      jitter fraction in [0, 1)
   */
  public ExponentialBackoffRetryPolicy(int maxAttempts, long baseDelayMs, double multiplier,
      long maxDelayMs, double jitter) {
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
    }
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (!(jitter >= 0.0 && jitter < 1.0)) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMs = baseDelayMs;
    this.multiplier = multiplier;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  /** Small budget for device reads: 3 attempts, 500ms doubling up to 5s, 20% jitter. */
  public static ExponentialBackoffRetryPolicy devicePolls() {
    return new ExponentialBackoffRetryPolicy(3, 500L, 2.0, 5_000L, 0.2);
  }

  /** Sink (re)connects: 5 attempts, 1s doubling up to 30s, 20% jitter. */
  public static ExponentialBackoffRetryPolicy sinkConnects() {
    return new ExponentialBackoffRetryPolicy(5, 1_000L, 2.0, 30_000L, 0.2);
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public double multiplier() {
    return multiplier;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double jitter() {
    return jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0 || baseDelayMs == 0L) {
      return 0L;
    }
    double exp = baseDelayMs * Math.pow(multiplier, attempts - 1);
    // Math.pow overflows to Infinity rather than wrapping
    double capped = Math.min((double) maxDelayMs, exp);
    double factor = jitter == 0.0
        ? 1.0
        : ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    return Math.max(0L, Math.round(capped * factor));
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy{maxAttempts=" + maxAttempts
        + ", baseDelayMs=" + baseDelayMs
        + ", multiplier=" + multiplier
        + ", maxDelayMs=" + maxDelayMs
        + ", jitter=" + jitter + '}';
  }
}
