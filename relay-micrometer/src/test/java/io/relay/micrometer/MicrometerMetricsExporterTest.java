package io.relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.relay.breaker.BreakerState;
import io.relay.publish.PersistentPublisher;
import io.relay.spi.Sink;
import io.relay.spi.SinkConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void pollCountersAreTaggedByDevice() {
    exporter.incrementPollSuccess("dtu-1");
    exporter.incrementPollSuccess("dtu-1");
    exporter.incrementPollSuccess("dtu-2");
    exporter.incrementPollFailure("dtu-2");
    exporter.incrementPollSkipped("dtu-2");

    assertEquals(2.0, registry.get("relay.poll.success").tag("device", "dtu-1").counter().count());
    assertEquals(1.0, registry.get("relay.poll.success").tag("device", "dtu-2").counter().count());
    assertEquals(1.0, registry.get("relay.poll.failure").tag("device", "dtu-2").counter().count());
    assertEquals(1.0, registry.get("relay.poll.skipped").tag("device", "dtu-2").counter().count());
  }

  @Test
  void pollDuration() {
    exporter.recordPollDurationMs("dtu-1", 120);
    exporter.recordPollDurationMs("dtu-1", 80);

    Timer timer = registry.get("relay.poll.duration").tag("device", "dtu-1").timer();
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void queueAndPublishCounters() {
    exporter.incrementEnqueued();
    exporter.incrementEnqueued();
    exporter.incrementEvicted();
    exporter.incrementRejected();
    exporter.incrementSent(5);
    exporter.incrementLost();
    exporter.incrementSendFailure();
    exporter.incrementConnectAttempt();

    assertEquals(2.0, counter("relay.queue.enqueued").count());
    assertEquals(1.0, counter("relay.queue.evicted").count());
    assertEquals(1.0, counter("relay.queue.rejected").count());
    assertEquals(5.0, counter("relay.publish.sent").count());
    assertEquals(1.0, counter("relay.publish.lost").count());
    assertEquals(1.0, counter("relay.publish.failure").count());
    assertEquals(1.0, counter("relay.sink.connect.attempts").count());
  }

  @Test
  void ledgerCounters() {
    exporter.incrementLedgerAnomaly();
    exporter.incrementLedgerRollover();
    exporter.incrementLedgerRollover();
    exporter.incrementLedgerFailure();

    assertEquals(1.0, counter("relay.ledger.anomaly").count());
    assertEquals(2.0, counter("relay.ledger.rollover").count());
    assertEquals(1.0, counter("relay.ledger.failure").count());
  }

  @Test
  void queueDepthGauge() {
    exporter.recordQueueDepth(42);
    assertEquals(42.0, gauge("relay.queue.depth").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("relay.queue.depth").value());
  }

  @Test
  void breakerStateGaugePerBreaker() {
    exporter.recordBreakerState("device:dtu-1", BreakerState.OPEN);
    exporter.recordBreakerState("sink", BreakerState.HALF_OPEN);

    assertEquals(1.0, registry.get("relay.breaker.state").tag("breaker", "device:dtu-1").gauge().value());
    assertEquals(2.0, registry.get("relay.breaker.state").tag("breaker", "sink").gauge().value());

    exporter.recordBreakerState("device:dtu-1", BreakerState.CLOSED);
    assertEquals(0.0, registry.get("relay.breaker.state").tag("breaker", "device:dtu-1").gauge().value());
  }

  @Test
  void sinkBreakerIsVisibleBeforeAnyTransition() {
    Sink idle = new Sink() {
      @Override
      public SinkConnection connect() {
        throw new UnsupportedOperationException();
      }

      @Override
      public void send(SinkConnection connection, List<byte[]> payloads) {
        throw new UnsupportedOperationException();
      }

      @Override
      public void close(SinkConnection connection) {
      }
    };
    PersistentPublisher publisher = PersistentPublisher.builder().sink(idle).metrics(exporter).build();
    try {
      assertEquals(0.0, registry.get("relay.breaker.state").tag("breaker", "sink").gauge().value());
    } finally {
      publisher.close();
    }
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "site1.relay");
    prefixed.incrementSent(3);

    assertEquals(3.0, custom.get("site1.relay.publish.sent").counter().count());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "relay."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementPollSuccess("dtu-1");
    exporter.recordBreakerState("sink", BreakerState.OPEN);
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementPollSuccess("dtu-1");
    exporter.incrementSent(1);
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge gauge(String name) {
    return registry.get(name).gauge();
  }
}
