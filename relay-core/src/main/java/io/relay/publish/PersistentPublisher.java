package io.relay.publish;

import io.relay.breaker.BreakerSettings;
import io.relay.breaker.BreakerSnapshot;
import io.relay.breaker.CircuitBreaker;
import io.relay.retry.CancellationToken;
import io.relay.retry.ExponentialBackoffRetryPolicy;
import io.relay.retry.RetryExecutor;
import io.relay.retry.RetryOutcome;
import io.relay.retry.RetryPolicy;
import io.relay.spi.MetricsExporter;
import io.relay.spi.Sink;
import io.relay.spi.SinkConnection;
import io.relay.spi.SinkException;
import io.relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reconnecting, queue-backed publisher with at-least-once delivery to a {@link Sink}.
 *
 * <p>{@link #publish(Envelope)} never blocks: envelopes go onto a bounded {@link OutboundQueue}
 * and a single daemon dispatch thread owns the sink connection. The loop is gated by the
 * sink's {@link CircuitBreaker}; while it is open the loop sleeps for the throttle interval.
 * Connections are (re)established through a {@link RetryExecutor}. Batches are removed from
 * the queue only after the sink acknowledged them, so a failed send leaves the unacknowledged
 * remainder queued with its attempt counter incremented. Envelopes that reach
 * {@code maxSendAttempts} are discarded and logged as lost.
 *
 * <p>Create instances via {@link #builder()}. Call {@link #start()} to begin dispatching and
 * {@link #close()} to drain and shut down.
 */
public final class PersistentPublisher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PersistentPublisher.class.getName());

  private static final long IDLE_WAIT_MS = 200;
  private static final String BREAKER_NAME = "sink";

  private final Sink sink;
  private final OutboundQueue queue;
  private final CircuitBreaker breaker;
  private final RetryExecutor connectExecutor;
  private final int batchSize;
  private final int maxSendAttempts;
  private final long throttleIntervalMs;
  private final Duration drainTimeout;
  private final MetricsExporter metrics;

  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final CancellationToken stopToken = new CancellationToken();
  private ExecutorService dispatcher;
  private boolean stopped;
  private volatile SinkConnection connection;

  private final AtomicLong enqueued = new AtomicLong();
  private final AtomicLong sent = new AtomicLong();
  private final AtomicLong evicted = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong lost = new AtomicLong();
  private final AtomicLong reconnectAttempts = new AtomicLong();
  private final AtomicLong batchesSent = new AtomicLong();
  private final AtomicLong sendFailures = new AtomicLong();

  private PersistentPublisher(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    BreakerSettings breakerSettings = builder.breakerSettings != null
        ? builder.breakerSettings : BreakerSettings.SINK_DEFAULTS;
    RetryPolicy connectPolicy = builder.connectRetryPolicy != null
        ? builder.connectRetryPolicy : ExponentialBackoffRetryPolicy.sinkConnects();
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    Objects.requireNonNull(builder.throttleInterval, "throttleInterval");

    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.maxSendAttempts < 1) {
      throw new IllegalArgumentException("maxSendAttempts must be >= 1");
    }
    if (builder.throttleInterval.isNegative() || builder.throttleInterval.isZero()) {
      throw new IllegalArgumentException("throttleInterval must be positive");
    }
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.queue = new OutboundQueue(builder.queueCapacity);
    this.batchSize = builder.batchSize;
    this.maxSendAttempts = builder.maxSendAttempts;
    this.throttleIntervalMs = builder.throttleInterval.toMillis();
    this.breaker = new CircuitBreaker(BREAKER_NAME, breakerSettings, clock,
        (name, from, to) -> metrics.recordBreakerState(name, to));
    metrics.recordBreakerState(BREAKER_NAME, breaker.state());
    this.connectExecutor = new RetryExecutor("sink-connect", connectPolicy);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the dispatch thread. Calling it again is a no-op.
   *
   * @throws IllegalStateException if the publisher was already stopped
   */
  public synchronized void start() {
    if (stopped) {
      throw new IllegalStateException("Publisher has been stopped");
    }
    if (dispatcher != null) {
      return;
    }
    dispatcher = Executors.newSingleThreadExecutor(new DaemonThreadFactory("relay-publisher-"));
    dispatcher.execute(this::dispatchLoop);
  }

  /**
   * Queues an envelope for delivery. Never blocks.
   *
   * @param envelope the envelope to deliver
   * @return {@code false} if the queue is full of HIGH envelopes or the publisher is stopping
   */
  public boolean publish(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    if (!accepting.get()) {
      rejected.incrementAndGet();
      metrics.incrementRejected();
      return false;
    }
    OutboundQueue.Offer offer = queue.offer(envelope);
    if (offer.evicted() != null) {
      evicted.incrementAndGet();
      metrics.incrementEvicted();
      logger.log(Level.FINE, "Queue full; evicted oldest normal envelope {0}",
          offer.evicted().envelopeId());
    }
    if (offer.accepted()) {
      enqueued.incrementAndGet();
      metrics.incrementEnqueued();
    } else {
      rejected.incrementAndGet();
      metrics.incrementRejected();
    }
    metrics.recordQueueDepth(queue.size());
    return offer.accepted();
  }

  /**
   * Blocks until the queue is empty or the timeout elapses.
   *
   * @return {@code true} if everything queued was delivered or dropped
   */
  public boolean flush(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    try {
      return queue.awaitEmpty(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Stops accepting envelopes, drains the queue within the drain timeout, then stops the
   * dispatch thread and closes the sink connection. Idempotent.
   */
  public synchronized void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    accepting.set(false);
    if (dispatcher != null) {
      if (!queue.isEmpty() && !flush(drainTimeout)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; {0} envelopes left undelivered",
            queue.size());
      }
      stopToken.cancel();
      dispatcher.shutdownNow();
      try {
        if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.warning("Publisher dispatch thread did not terminate within 5s");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    closeConnection();
  }

  @Override
  public void close() {
    stop();
  }

  public PublisherStats stats() {
    return new PublisherStats(
        queue.size(),
        enqueued.get(),
        sent.get(),
        evicted.get(),
        rejected.get(),
        lost.get(),
        reconnectAttempts.get(),
        batchesSent.get(),
        sendFailures.get());
  }

  public BreakerSnapshot breakerSnapshot() {
    return breaker.snapshot();
  }

  /**
   * Envelopes currently queued, in send order.
   */
  public List<Envelope> pending() {
    return queue.snapshot();
  }

  public boolean isConnected() {
    SinkConnection current = connection;
    return current != null && current.isOpen();
  }

  private void dispatchLoop() {
    while (!stopToken.isCancelled() && !Thread.currentThread().isInterrupted()) {
      try {
        if (!queue.awaitNotEmpty(IDLE_WAIT_MS, TimeUnit.MILLISECONDS)) {
          continue;
        }
        if (!breaker.allow()) {
          stopToken.await(throttleIntervalMs);
          continue;
        }
        if (ensureConnected()) {
          sendNextBatch();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Publisher dispatch loop error", e);
        closeConnection();
        breaker.onFailure();
      }
    }
  }

  private boolean ensureConnected() {
    SinkConnection current = connection;
    if (current != null) {
      if (current.isOpen()) {
        return true;
      }
      logger.info("Sink connection reported closed; reconnecting");
      closeConnection();
    }
    RetryOutcome<SinkConnection> outcome = connectExecutor.execute(attempt -> {
      reconnectAttempts.incrementAndGet();
      metrics.incrementConnectAttempt();
      return sink.connect();
    }, stopToken);
    if (outcome instanceof RetryOutcome.Success<SinkConnection> success) {
      connection = Objects.requireNonNull(success.value(), "Sink.connect() returned null");
      logger.log(Level.INFO, "Connected to sink after {0} attempt(s)", success.attempts());
      return true;
    }
    if (outcome instanceof RetryOutcome.Failure<SinkConnection> failure) {
      logger.log(Level.WARNING, "Sink connect failed after " + failure.attempts() + " attempt(s)",
          failure.lastError());
      breaker.onFailure();
    }
    return false;
  }

  private void sendNextBatch() {
    List<Envelope> batch = queue.peekBatch(batchSize);
    if (batch.isEmpty()) {
      // everything was evicted between the wait and the peek; the connection is still good
      breaker.onSuccess();
      return;
    }
    List<byte[]> payloads = new ArrayList<>(batch.size());
    for (Envelope envelope : batch) {
      payloads.add(envelope.payloadUnsafe());
    }
    try {
      sink.send(connection, payloads);
    } catch (RuntimeException e) {
      handleSendFailure(batch, e);
      return;
    }
    queue.remove(batch);
    sent.addAndGet(batch.size());
    batchesSent.incrementAndGet();
    metrics.incrementSent(batch.size());
    metrics.recordQueueDepth(queue.size());
    breaker.onSuccess();
  }

  private void handleSendFailure(List<Envelope> batch, RuntimeException error) {
    int accepted = 0;
    if (error instanceof SinkException sinkError) {
      accepted = Math.min(sinkError.acceptedCount(), batch.size());
    }
    if (accepted > 0) {
      List<Envelope> delivered = batch.subList(0, accepted);
      queue.remove(delivered);
      sent.addAndGet(accepted);
      metrics.incrementSent(accepted);
    }
    List<Envelope> exhausted = queue.recordFailedAttempt(batch.subList(accepted, batch.size()),
        maxSendAttempts);
    for (Envelope envelope : exhausted) {
      lost.incrementAndGet();
      metrics.incrementLost();
      logger.log(Level.SEVERE, "Envelope lost after {0} send attempts: {1}",
          new Object[]{envelope.attempts(), envelope});
    }
    sendFailures.incrementAndGet();
    metrics.incrementSendFailure();
    metrics.recordQueueDepth(queue.size());
    logger.log(Level.WARNING, "Sink send failed; " + accepted + " of " + batch.size()
        + " envelopes acknowledged, reconnecting", error);
    closeConnection();
    breaker.onFailure();
  }

  private void closeConnection() {
    SinkConnection current = connection;
    connection = null;
    if (current == null) {
      return;
    }
    try {
      sink.close(current);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close sink connection", e);
    }
  }

  /** Builder for {@link PersistentPublisher}. */
  public static final class Builder {
    private Sink sink;
    private int queueCapacity = 1000;
    private int batchSize = 50;
    private int maxSendAttempts = 10;
    private BreakerSettings breakerSettings;
    private RetryPolicy connectRetryPolicy;
    private Duration throttleInterval = Duration.ofMillis(100);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the downstream transport.
     *
     * <p><b>Required.</b>
     *
     * @param sink the sink
     * @return this builder
     */
    public Builder sink(Sink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the outbound queue capacity.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum queued envelopes
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the maximum number of envelopes sent in one batch.
     *
     * <p>Optional. Defaults to {@code 50}.
     *
     * @param batchSize batch size
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how many failed sends an envelope survives before it is discarded.
     *
     * <p>Optional. Defaults to {@code 10}.
     *
     * @param maxSendAttempts attempt limit per envelope
     * @return this builder
     */
    public Builder maxSendAttempts(int maxSendAttempts) {
      this.maxSendAttempts = maxSendAttempts;
      return this;
    }

    /**
     * Sets the sink breaker thresholds.
     *
     * <p>Optional. Defaults to {@link BreakerSettings#SINK_DEFAULTS}.
     *
     * @param breakerSettings breaker settings
     * @return this builder
     */
    public Builder breakerSettings(BreakerSettings breakerSettings) {
      this.breakerSettings = breakerSettings;
      return this;
    }

    /**
     * Sets the retry policy for sink (re)connects.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy#sinkConnects()}.
     *
     * @param connectRetryPolicy retry policy
     * @return this builder
     */
    public Builder connectRetryPolicy(RetryPolicy connectRetryPolicy) {
      this.connectRetryPolicy = connectRetryPolicy;
      return this;
    }

    /**
     * Sets how long the dispatch loop sleeps while the sink breaker is open.
     *
     * <p>Optional. Defaults to 100ms.
     *
     * @param throttleInterval sleep interval
     * @return this builder
     */
    public Builder throttleInterval(Duration throttleInterval) {
      this.throttleInterval = throttleInterval;
      return this;
    }

    /**
     * Sets how long {@link PersistentPublisher#stop()} waits for the queue to drain.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PersistentPublisher build() {
      return new PersistentPublisher(this);
    }
  }
}
