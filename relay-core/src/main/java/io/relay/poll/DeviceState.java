package io.relay.poll;

import io.relay.breaker.CircuitBreaker;
import io.relay.spi.Reading;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable runtime record of one device, owned by the coordinator.
 */
final class DeviceState {

  record PendingReading(Reading reading, Instant observedAt, LocalDate businessDate) {
  }

  final DeviceConfig config;
  final CircuitBreaker breaker;
  final AtomicBoolean inFlight = new AtomicBoolean();
  final AtomicLong polls = new AtomicLong();
  final AtomicLong errors = new AtomicLong();
  // per channel, oldest business date first; guarded by this
  private final Map<Integer, List<PendingReading>> pending = new TreeMap<>();

  private volatile Instant lastSuccess;
  private volatile String lastError;
  private volatile Instant lastErrorAt;

  DeviceState(DeviceConfig config, CircuitBreaker breaker) {
    this.config = config;
    this.breaker = breaker;
  }

  void recordSuccess(Instant at) {
    polls.incrementAndGet();
    lastSuccess = at;
  }

  void recordError(String message, Instant at) {
    polls.incrementAndGet();
    errors.incrementAndGet();
    lastError = message;
    lastErrorAt = at;
  }

  /**
   * Readings the ledger has not persisted yet, grouped by channel. Each channel's list holds
   * at most one reading per business date, oldest first, and must be applied in that order.
   */
  synchronized Map<Integer, List<PendingReading>> pendingByChannel() {
    Map<Integer, List<PendingReading>> copy = new LinkedHashMap<>();
    pending.forEach((channel, queue) -> copy.put(channel, List.copyOf(queue)));
    return copy;
  }

  synchronized boolean hasPending(int channelId) {
    return pending.containsKey(channelId);
  }

  /**
   * Queues a reading. A newer reading of the same business date replaces the queued one;
   * readings of earlier dates are never dropped.
   */
  synchronized void keepPending(PendingReading reading) {
    List<PendingReading> queue = pending.computeIfAbsent(reading.reading().channelId(), k -> new ArrayList<>());
    for (int i = 0; i < queue.size(); i++) {
      if (queue.get(i).businessDate().equals(reading.businessDate())) {
        queue.set(i, reading);
        return;
      }
    }
    queue.add(reading);
  }

  synchronized void clearPending(PendingReading reading) {
    int channelId = reading.reading().channelId();
    List<PendingReading> queue = pending.get(channelId);
    if (queue != null && queue.remove(reading) && queue.isEmpty()) {
      pending.remove(channelId);
    }
  }

  synchronized int pendingCount() {
    int count = 0;
    for (List<PendingReading> queue : pending.values()) {
      count += queue.size();
    }
    return count;
  }

  DeviceHealth health() {
    return new DeviceHealth(
        config.id(),
        breaker.snapshot(),
        lastSuccess,
        lastError,
        lastErrorAt,
        polls.get(),
        errors.get(),
        inFlight.get(),
        pendingCount());
  }
}
