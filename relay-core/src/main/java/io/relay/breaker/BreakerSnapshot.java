package io.relay.breaker;

import java.time.Instant;

/**
 * Point-in-time view of a breaker, safe to hand to health checks and metrics.
 *
 * @param name                breaker target name
 * @param state               state at the time of the snapshot
 * @param consecutiveFailures failures counted since the last success or state change
 * @param lastStateChange     when the breaker last changed state
 */
public record BreakerSnapshot(String name, BreakerState state, int consecutiveFailures,
    Instant lastStateChange) {
}
