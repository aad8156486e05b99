package io.relay;

import io.relay.poll.DeviceConfig;
import io.relay.spi.Reading;
import io.relay.testing.InMemoryKeyValueStore;
import io.relay.testing.RecordingSink;
import io.relay.testing.StubDeviceClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayTest {

  @Test
  void pollsPersistsAndDeliversEndToEnd() throws Exception {
    StubDeviceClient client = new StubDeviceClient().returning("dtu", new Reading(1, 12.5, 3_000));
    RecordingSink sink = new RecordingSink();
    InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    RelayConfig config = RelayConfig.builder()
        .device(DeviceConfig.of("dtu", "192.168.1.50"))
        .pollPeriod(Duration.ofMillis(50))
        .build();

    try (Relay relay = Relay.builder()
        .config(config)
        .deviceClient(client)
        .sink(sink)
        .store(store)
        .build()) {
      relay.start();
      relay.start();

      long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
      while (sink.delivered().size() < 2 && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }

      assertTrue(sink.delivered().size() >= 2);
      assertTrue(sink.delivered().get(0).contains("\"deviceId\":\"dtu\""));
      assertEquals(3_000, relay.ledger().record("dtu", 1).orElseThrow().total());
      assertTrue(relay.coordinator().isHealthy(Duration.ofMinutes(5)));
    }
    assertTrue(store.data().containsKey("production/dtu/1"));
  }

  @Test
  void closeIsOrderedAndClosesAutoCloseableMetrics() {
    List<String> closed = new ArrayList<>();
    RecordingMetrics metrics = new RecordingMetrics(closed);
    Relay relay = Relay.builder()
        .config(RelayConfig.builder().device(DeviceConfig.of("dtu", "h")).build())
        .deviceClient(new StubDeviceClient())
        .sink(new RecordingSink())
        .store(new InMemoryKeyValueStore())
        .metrics(metrics)
        .rolloverListener((key, date, today) -> closed.add("rollover " + date))
        .build();

    relay.ledger().applyReading("dtu", 0, 1, 1, java.time.Instant.parse("2024-06-10T10:00:00Z"),
        LocalDate.of(2024, 6, 10));
    relay.ledger().applyReading("dtu", 0, 1, 2, java.time.Instant.parse("2024-06-11T10:00:00Z"),
        LocalDate.of(2024, 6, 11));
    relay.close();

    assertEquals(List.of("rollover 2024-06-10", "metrics"), closed);
  }

  @Test
  void requiresCollaborators() {
    RelayConfig config = RelayConfig.builder().device(DeviceConfig.of("dtu", "h")).build();

    assertThrows(NullPointerException.class, () -> Relay.builder().config(config).build());
  }

  private static final class RecordingMetrics extends io.relay.spi.MetricsExporter.Noop implements AutoCloseable {
    private final List<String> closed;

    private RecordingMetrics(List<String> closed) {
      this.closed = closed;
    }

    @Override
    public void close() {
      closed.add("metrics");
    }
  }
}
