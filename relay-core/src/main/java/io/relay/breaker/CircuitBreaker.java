package io.relay.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-target failure isolation.
 *
 * <p>CLOSED opens after {@code failureThreshold} consecutive failures. OPEN refuses every call
 * until {@code openDuration} has passed; the first {@link #allow()} after that moves to
 * HALF_OPEN and is itself the single trial. While the trial is outstanding every other
 * {@code allow()} returns false. The trial's {@link #onSuccess()} closes the breaker, its
 * {@link #onFailure()} reopens it and restarts the cooldown.
 *
 * <p>There is no timer thread: the OPEN to HALF_OPEN transition is evaluated lazily against
 * the injected {@link Clock}. All state is guarded by one lock per breaker.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final String name;
  private final int failureThreshold;
  private final Duration openDuration;
  private final Clock clock;
  private final BreakerListener listener;
  private final ReentrantLock lock = new ReentrantLock();

  private BreakerState state = BreakerState.CLOSED;
  private int consecutiveFailures;
  private Instant lastStateChange;
  private Instant openedAt;

  public CircuitBreaker(String name, BreakerSettings settings, Clock clock) {
    this(name, settings, clock, BreakerListener.NOOP);
  }

  public CircuitBreaker(String name, BreakerSettings settings, Clock clock, BreakerListener listener) {
    this.name = Objects.requireNonNull(name, "name");
    Objects.requireNonNull(settings, "settings");
    this.failureThreshold = settings.failureThreshold();
    this.openDuration = settings.openDuration();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.lastStateChange = clock.instant();
  }

  public String name() {
    return name;
  }

  /**
   * Asks for permission to call the target.
   *
   * @return {@code true} if the call may proceed; when this moves the breaker to HALF_OPEN
   *     the caller holds the only trial and must report its result
   */
  public boolean allow() {
    BreakerState from;
    lock.lock();
    try {
      switch (state) {
        case CLOSED:
          return true;
        case HALF_OPEN:
          return false;
        default:
          break;
      }
      Instant now = clock.instant();
      if (now.isBefore(openedAt.plus(openDuration))) {
        return false;
      }
      from = state;
      transition(BreakerState.HALF_OPEN, now);
    } finally {
      lock.unlock();
    }
    notifyListener(from, BreakerState.HALF_OPEN);
    return true;
  }

  /**
   * Reports a successful call. Closes a HALF_OPEN breaker; resets the failure count when
   * CLOSED. Ignored while OPEN (a late result from before the breaker opened).
   */
  public void onSuccess() {
    BreakerState from;
    lock.lock();
    try {
      if (state == BreakerState.CLOSED) {
        consecutiveFailures = 0;
        return;
      }
      if (state == BreakerState.OPEN) {
        return;
      }
      from = state;
      consecutiveFailures = 0;
      transition(BreakerState.CLOSED, clock.instant());
    } finally {
      lock.unlock();
    }
    logger.log(Level.INFO, "Circuit breaker {0} closed after successful trial", name);
    notifyListener(from, BreakerState.CLOSED);
  }

  /**
   * Reports a failed call. Opens a CLOSED breaker once the threshold is reached and
   * reopens a HALF_OPEN one. Ignored while OPEN.
   */
  public void onFailure() {
    BreakerState from;
    int failures;
    lock.lock();
    try {
      if (state == BreakerState.OPEN) {
        return;
      }
      consecutiveFailures++;
      if (state == BreakerState.CLOSED && consecutiveFailures < failureThreshold) {
        return;
      }
      from = state;
      failures = consecutiveFailures;
      Instant now = clock.instant();
      openedAt = now;
      transition(BreakerState.OPEN, now);
    } finally {
      lock.unlock();
    }
    if (from == BreakerState.HALF_OPEN) {
      logger.log(Level.INFO, "Circuit breaker {0} trial failed; reopened for {1}",
          new Object[]{name, openDuration});
    } else {
      logger.log(Level.INFO, "Circuit breaker {0} opened after {1} consecutive failures",
          new Object[]{name, failures});
    }
    notifyListener(from, BreakerState.OPEN);
  }

  public BreakerState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public BreakerSnapshot snapshot() {
    lock.lock();
    try {
      return new BreakerSnapshot(name, state, consecutiveFailures, lastStateChange);
    } finally {
      lock.unlock();
    }
  }

  private void transition(BreakerState to, Instant now) {
    state = to;
    lastStateChange = now;
  }

  private void notifyListener(BreakerState from, BreakerState to) {
    try {
      listener.onStateChange(name, from, to);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Breaker listener failed for " + name, e);
    }
  }
}
