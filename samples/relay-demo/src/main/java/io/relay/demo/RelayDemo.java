package io.relay.demo;

import io.relay.Relay;
import io.relay.RelayConfig;
import io.relay.jdbc.JdbcKeyValueStore;
import io.relay.ledger.ProductionRecord;
import io.relay.poll.DeviceConfig;
import io.relay.poll.DeviceHealth;
import io.relay.publish.PublisherStats;
import io.relay.spi.DeviceClient;
import io.relay.spi.DeviceReadException;
import io.relay.spi.ErrorKind;
import io.relay.spi.Reading;
import io.relay.spi.Sink;
import io.relay.spi.SinkConnection;
import io.relay.spi.SinkException;

import org.h2.jdbcx.JdbcDataSource;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simple demo running the relay against simulated inverters without Spring.
 *
 * Run with: mvn -pl samples/relay-demo exec:java -Dexec.mainClass=io.relay.demo.RelayDemo
 */
public final class RelayDemo {

  public static void main(String[] args) throws Exception {
    // 1. H2 in-memory database for the production ledger
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:relay_demo;DB_CLOSE_DELAY=-1");
    JdbcKeyValueStore store = JdbcKeyValueStore.create(dataSource);
    store.createTableIfMissing();

    // 2. Three devices: one healthy, one flaky, one that never answers
    RelayConfig config = RelayConfig.builder()
        .device(DeviceConfig.of("roof-east", "192.168.1.50"))
        .device(DeviceConfig.of("roof-west", "192.168.1.51"))
        .device(new DeviceConfig("carport", "192.168.1.52", 502, 1, Duration.ofSeconds(1)))
        .pollPeriod(Duration.ofSeconds(2))
        .deviceBreaker(3, Duration.ofSeconds(10))
        .queueCapacity(100)
        .batchSize(10)
        .build();

    ConsoleSink sink = new ConsoleSink();

    System.out.println("=== Telemetry Relay Demo ===\n");

    try (Relay relay = Relay.builder()
        .config(config)
        .deviceClient(new SimulatedInverters())
        .sink(sink)
        .store(store)
        .rolloverListener((key, date, today) ->
            System.out.println("[Rollover] " + key + " finished " + date + " with " + today + " kWh"))
        .build()) {
      relay.start();

      Thread.sleep(Duration.ofSeconds(12).toMillis());

      // 3. Report
      System.out.println("\n=== Device health ===");
      for (DeviceHealth health : relay.coordinator().deviceHealth()) {
        System.out.println(health.deviceId() + ": breaker=" + health.breaker().state()
            + ", polls=" + health.polls() + ", errors=" + health.errors()
            + ", lastError=" + health.lastError());
      }
      System.out.println("Healthy: " + relay.coordinator().isHealthy(Duration.ofMinutes(5)));

      System.out.println("\n=== Ledger ===");
      for (ProductionRecord record : relay.ledger().records()) {
        System.out.println(record.key() + ": today=" + record.today() + ", total=" + record.total()
            + ", since " + record.lastResetDate());
      }

      PublisherStats stats = relay.publisher().stats();
      System.out.println("\n=== Publisher ===");
      System.out.println("sent=" + stats.sent() + ", queued=" + stats.queued()
          + ", dropped=" + stats.dropped() + ", reconnects=" + stats.reconnectAttempts());
    }

    System.out.println("\nPersisted keys: " + store.keys("production/"));
    System.out.println("Delivered " + sink.delivered.get() + " envelopes");
    System.out.println("\n=== Demo Complete ===");
  }

  /** Inverters whose counters grow on every read. */
  private static final class SimulatedInverters implements DeviceClient {
    private final Map<String, Double> totals = new ConcurrentHashMap<>();

    @Override
    public List<Reading> read(DeviceConfig device, Duration timeout) throws InterruptedException {
      switch (device.id()) {
        case "carport" -> throw new DeviceReadException(ErrorKind.UNAVAILABLE,
            "no route to host " + device.host(), null);
        case "roof-west" -> {
          if (ThreadLocalRandom.current().nextInt(3) == 0) {
            throw new DeviceReadException("checksum mismatch");
          }
        }
        default -> {
        }
      }
      Thread.sleep(50);
      double today = totals.merge(device.id(), 0.25, Double::sum);
      return List.of(
          new Reading(1, today, 12_000 + today, Map.of("powerW", 850)),
          new Reading(2, today / 2, 9_500 + today / 2));
    }
  }

  /** Prints payloads and refuses every fifth batch to exercise redelivery. */
  private static final class ConsoleSink implements Sink {
    private final AtomicInteger batches = new AtomicInteger();
    private final AtomicInteger delivered = new AtomicInteger();

    @Override
    public SinkConnection connect() {
      System.out.println("[Sink] connected");
      return new SinkConnection() {
      };
    }

    @Override
    public void send(SinkConnection connection, List<byte[]> payloads) {
      if (batches.incrementAndGet() % 5 == 0) {
        throw new SinkException("broker busy");
      }
      for (byte[] payload : payloads) {
        System.out.println("[Sink] " + new String(payload, StandardCharsets.UTF_8));
        delivered.incrementAndGet();
      }
    }

    @Override
    public void close(SinkConnection connection) {
      System.out.println("[Sink] connection closed");
    }
  }

  private RelayDemo() {
  }
}
