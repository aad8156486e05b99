package io.relay.breaker;

/**
 * Callback for breaker state changes. Invoked on the thread that caused the transition,
 * after the breaker's lock has been released.
 */
@FunctionalInterface
public interface BreakerListener {

  BreakerListener NOOP = (name, from, to) -> {
  };

  void onStateChange(String name, BreakerState from, BreakerState to);
}
