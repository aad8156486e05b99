package io.relay.breaker;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum BreakerState {
  /** Calls flow; consecutive failures are counted. */
  CLOSED,
  /** Calls are refused until the open duration elapses. */
  OPEN,
  /** One trial call is in flight; its result decides between CLOSED and OPEN. */
  HALF_OPEN
}
