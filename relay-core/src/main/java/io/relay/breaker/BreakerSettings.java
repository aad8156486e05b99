package io.relay.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds of a {@link CircuitBreaker}.
 *
 * @param failureThreshold consecutive failures that open the breaker (&gt;= 1)
 * @param openDuration     how long the breaker stays open before a trial is allowed
 */
public record BreakerSettings(int failureThreshold, Duration openDuration) {

  /** Defaults used for device targets: 5 failures, 60 seconds open. */
  public static final BreakerSettings DEVICE_DEFAULTS = new BreakerSettings(5, Duration.ofSeconds(60));

  /** Defaults used for the sink: 5 failures, 30 seconds open. */
  public static final BreakerSettings SINK_DEFAULTS = new BreakerSettings(5, Duration.ofSeconds(30));

  public BreakerSettings {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
    }
    Objects.requireNonNull(openDuration, "openDuration");
    if (openDuration.isNegative() || openDuration.isZero()) {
      throw new IllegalArgumentException("openDuration must be positive, got: " + openDuration);
    }
  }
}
