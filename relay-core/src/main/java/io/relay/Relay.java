package io.relay;

import io.relay.ledger.ProductionLedger;
import io.relay.ledger.RolloverListener;
import io.relay.poll.DefaultEnvelopeComposer;
import io.relay.poll.EnvelopeComposer;
import io.relay.poll.PollingCoordinator;
import io.relay.publish.PersistentPublisher;
import io.relay.spi.DeviceClient;
import io.relay.spi.KeyValueStore;
import io.relay.spi.MetricsExporter;
import io.relay.spi.Sink;
import io.relay.util.JsonCodec;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The assembled pipeline: a {@link PollingCoordinator} feeding a {@link ProductionLedger} and a
 * {@link PersistentPublisher}, all built from one {@link RelayConfig}.
 *
 * <p>There is no global state; every component is constructed here and handed its
 * collaborators. {@link #close()} stops polling first, then drains and closes the publisher.
 */
public final class Relay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Relay.class.getName());

  private final RelayConfig config;
  private final ProductionLedger ledger;
  private final PersistentPublisher publisher;
  private final PollingCoordinator coordinator;
  private final MetricsExporter metrics;
  private boolean started;

  private Relay(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    DeviceClient deviceClient = Objects.requireNonNull(builder.deviceClient, "deviceClient");
    Sink sink = Objects.requireNonNull(builder.sink, "sink");
    KeyValueStore store = Objects.requireNonNull(builder.store, "store");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    JsonCodec json = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    EnvelopeComposer composer = builder.composer != null
        ? builder.composer : new DefaultEnvelopeComposer(config.destinationPrefix(), json);
    RolloverListener rolloverListener = builder.rolloverListener != null
        ? builder.rolloverListener : RolloverListener.NOOP;

    this.ledger = new ProductionLedger(store, json, metrics, rolloverListener);
    this.publisher = PersistentPublisher.builder()
        .sink(sink)
        .queueCapacity(config.queueCapacity())
        .batchSize(config.batchSize())
        .maxSendAttempts(config.maxSendAttempts())
        .breakerSettings(config.sinkBreaker())
        .connectRetryPolicy(config.connectRetry())
        .throttleInterval(config.throttleInterval())
        .drainTimeout(config.drainTimeout())
        .metrics(metrics)
        .clock(clock)
        .build();
    this.coordinator = PollingCoordinator.builder()
        .devices(config.devices())
        .deviceClient(deviceClient)
        .ledger(ledger)
        .publisher(publisher)
        .composer(composer)
        .calendar(config.calendar())
        .breakerSettings(config.deviceBreaker())
        .pollRetryPolicy(config.pollRetry())
        .workerCount(config.workerCount())
        .pollPeriod(config.pollPeriod())
        .cycleTimeout(config.cycleTimeout())
        .metrics(metrics)
        .clock(clock)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the publisher's dispatch loop, then periodic polling. Idempotent.
   */
  public synchronized void start() {
    if (started) {
      return;
    }
    publisher.start();
    coordinator.start();
    started = true;
    logger.info("Relay started with " + config.devices().size() + " device(s), reset at "
        + config.calendar().resetHour() + ":00 " + config.calendar().zone());
  }

  public RelayConfig config() {
    return config;
  }

  public PollingCoordinator coordinator() {
    return coordinator;
  }

  public PersistentPublisher publisher() {
    return publisher;
  }

  public ProductionLedger ledger() {
    return ledger;
  }

  @Override
  public void close() {
    RuntimeException first = null;
    try {
      coordinator.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      publisher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Relay}. */
  public static final class Builder {
    private RelayConfig config;
    private DeviceClient deviceClient;
    private Sink sink;
    private KeyValueStore store;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private EnvelopeComposer composer;
    private RolloverListener rolloverListener;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder config(RelayConfig config) {
      this.config = config;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deviceClient(DeviceClient deviceClient) {
      this.deviceClient = deviceClient;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sink(Sink sink) {
      this.sink = sink;
      return this;
    }

    /** <b>Required.</b> Backs the production ledger. */
    public Builder store(KeyValueStore store) {
      this.store = store;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder composer(EnvelopeComposer composer) {
      this.composer = composer;
      return this;
    }

    public Builder rolloverListener(RolloverListener rolloverListener) {
      this.rolloverListener = rolloverListener;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Relay build() {
      return new Relay(this);
    }
  }
}
