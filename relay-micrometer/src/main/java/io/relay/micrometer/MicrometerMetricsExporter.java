package io.relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.relay.breaker.BreakerState;
import io.relay.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.poll.success}, {@code relay.poll.failure}, {@code relay.poll.skipped}
 *       tagged with {@code device}</li>
 *   <li>{@code relay.queue.enqueued}, {@code relay.queue.evicted}, {@code relay.queue.rejected}</li>
 *   <li>{@code relay.publish.sent}, {@code relay.publish.lost}, {@code relay.publish.failure}</li>
 *   <li>{@code relay.sink.connect.attempts}</li>
 *   <li>{@code relay.ledger.anomaly}, {@code relay.ledger.rollover}, {@code relay.ledger.failure}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code relay.queue.depth}: current outbound queue depth</li>
 *   <li>{@code relay.breaker.state} tagged with {@code breaker}: 0 closed, 1 open, 2 half-open</li>
 *   <li>{@code relay.poll.duration} tagged with {@code device}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final List<Meter> meters = new CopyOnWriteArrayList<>();

  private final Counter enqueued;
  private final Counter evicted;
  private final Counter rejected;
  private final Counter sent;
  private final Counter lost;
  private final Counter sendFailure;
  private final Counter connectAttempts;
  private final Counter ledgerAnomaly;
  private final Counter ledgerRollover;
  private final Counter ledgerFailure;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final Map<String, Counter> pollSuccess = new ConcurrentHashMap<>();
  private final Map<String, Counter> pollFailure = new ConcurrentHashMap<>();
  private final Map<String, Counter> pollSkipped = new ConcurrentHashMap<>();
  private final Map<String, Timer> pollDuration = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> breakerStates = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "site1.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;

    this.enqueued = counter(".queue.enqueued", "Envelopes accepted by the outbound queue");
    this.evicted = counter(".queue.evicted", "Normal envelopes evicted from a full queue");
    this.rejected = counter(".queue.rejected", "Envelopes rejected by a full or stopped queue");
    this.sent = counter(".publish.sent", "Envelopes delivered to the sink");
    this.lost = counter(".publish.lost", "Envelopes discarded after the send attempt limit");
    this.sendFailure = counter(".publish.failure", "Failed batch sends");
    this.connectAttempts = counter(".sink.connect.attempts", "Sink connect attempts");
    this.ledgerAnomaly = counter(".ledger.anomaly", "Readings whose lifetime total decreased");
    this.ledgerRollover = counter(".ledger.rollover", "Daily counter resets");
    this.ledgerFailure = counter(".ledger.failure", "Readings that could not be persisted");

    meters.add(Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Current outbound queue depth")
        .register(registry));
  }

  private Counter counter(String suffix, String description) {
    Counter counter = Counter.builder(namePrefix + suffix)
        .description(description)
        .register(registry);
    meters.add(counter);
    return counter;
  }

  private Counter deviceCounter(Map<String, Counter> byDevice, String suffix, String deviceId) {
    return byDevice.computeIfAbsent(deviceId, id -> {
      Counter counter = Counter.builder(namePrefix + suffix)
          .tag("device", id)
          .register(registry);
      meters.add(counter);
      return counter;
    });
  }

  @Override
  public void incrementPollSuccess(String deviceId) {
    if (closed) return;
    deviceCounter(pollSuccess, ".poll.success", deviceId).increment();
  }

  @Override
  public void incrementPollFailure(String deviceId) {
    if (closed) return;
    deviceCounter(pollFailure, ".poll.failure", deviceId).increment();
  }

  @Override
  public void incrementPollSkipped(String deviceId) {
    if (closed) return;
    deviceCounter(pollSkipped, ".poll.skipped", deviceId).increment();
  }

  @Override
  public void recordPollDurationMs(String deviceId, long durationMs) {
    if (closed) return;
    pollDuration.computeIfAbsent(deviceId, id -> {
      Timer timer = Timer.builder(namePrefix + ".poll.duration")
          .description("Device poll duration, retries included")
          .tag("device", id)
          .register(registry);
      meters.add(timer);
      return timer;
    }).record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordBreakerState(String breakerName, BreakerState state) {
    if (closed) return;
    breakerStates.computeIfAbsent(breakerName, name -> {
      AtomicInteger holder = new AtomicInteger();
      meters.add(Gauge.builder(namePrefix + ".breaker.state", holder, AtomicInteger::get)
          .description("Breaker state: 0 closed, 1 open, 2 half-open")
          .tag("breaker", name)
          .register(registry));
      return holder;
    }).set(state.ordinal());
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementEvicted() {
    if (closed) return;
    evicted.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementSent(int count) {
    if (closed) return;
    sent.increment(count);
  }

  @Override
  public void incrementLost() {
    if (closed) return;
    lost.increment();
  }

  @Override
  public void incrementSendFailure() {
    if (closed) return;
    sendFailure.increment();
  }

  @Override
  public void incrementConnectAttempt() {
    if (closed) return;
    connectAttempts.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void incrementLedgerAnomaly() {
    if (closed) return;
    ledgerAnomaly.increment();
  }

  @Override
  public void incrementLedgerRollover() {
    if (closed) return;
    ledgerRollover.increment();
  }

  @Override
  public void incrementLedgerFailure() {
    if (closed) return;
    ledgerFailure.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.relay.Relay#close()} calls this so stale gauges do not linger.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
