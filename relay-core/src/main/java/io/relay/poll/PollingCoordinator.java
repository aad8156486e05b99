package io.relay.poll;

import io.relay.breaker.BreakerSettings;
import io.relay.breaker.CircuitBreaker;
import io.relay.ledger.DailyResetCalendar;
import io.relay.ledger.LedgerException;
import io.relay.ledger.LedgerUpdate;
import io.relay.ledger.ProductionLedger;
import io.relay.publish.Envelope;
import io.relay.publish.PersistentPublisher;
import io.relay.retry.CancellationToken;
import io.relay.retry.ExponentialBackoffRetryPolicy;
import io.relay.retry.RetryExecutor;
import io.relay.retry.RetryOutcome;
import io.relay.retry.RetryPolicy;
import io.relay.spi.DeviceClient;
import io.relay.spi.DeviceReadException;
import io.relay.spi.ErrorKind;
import io.relay.spi.MetricsExporter;
import io.relay.spi.Reading;
import io.relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls every configured device concurrently, once per cycle.
 *
 * <p>Each device has its own {@link CircuitBreaker}; a device whose breaker is open, or whose
 * previous read is still running, is skipped without touching the others. Reads run under a
 * {@link RetryExecutor}. Successful readings are applied to the {@link ProductionLedger} and
 * handed to the {@link PersistentPublisher} as envelopes. Readings the ledger failed to
 * persist are kept and applied again on the device's next successful cycle.
 *
 * <p>A cycle ends when all device tasks have finished or the cycle timeout has elapsed; tasks
 * still running at that point are cancelled and reported as {@code TIMED_OUT}. There is no
 * cycle-level retry.
 *
 * <p>Create instances via {@link #builder()}. {@link #runCycle(Instant)} may be called directly;
 * {@link #start()} runs it at the configured period on a scheduler thread.
 */
public final class PollingCoordinator implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PollingCoordinator.class.getName());

    private final DeviceClient deviceClient;
    private final ProductionLedger ledger;
    private final PersistentPublisher publisher;
    private final EnvelopeComposer composer;
    private final DailyResetCalendar calendar;
    private final RetryExecutor pollExecutor;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration pollPeriod;
    private final Duration cycleTimeout;
    private final Map<String, DeviceState> devices;
    private final ExecutorService workers;
    private final CancellationToken stopToken = new CancellationToken();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> cycleTask;
    private volatile boolean closed;

    private PollingCoordinator(Builder builder) {
        this.deviceClient = Objects.requireNonNull(builder.deviceClient, "deviceClient");
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.composer = builder.composer != null ? builder.composer : new DefaultEnvelopeComposer();
        this.calendar = builder.calendar != null
            ? builder.calendar : new DailyResetCalendar(23, ZoneOffset.UTC);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.pollPeriod = Objects.requireNonNull(builder.pollPeriod, "pollPeriod");
        this.cycleTimeout = builder.cycleTimeout != null ? builder.cycleTimeout : pollPeriod;
        BreakerSettings breakerSettings = builder.breakerSettings != null
            ? builder.breakerSettings : BreakerSettings.DEVICE_DEFAULTS;
        RetryPolicy pollPolicy = builder.pollRetryPolicy != null
            ? builder.pollRetryPolicy : ExponentialBackoffRetryPolicy.devicePolls();

        if (builder.devices.isEmpty()) {
            throw new IllegalArgumentException("at least one device must be configured");
        }
        if (pollPeriod.isNegative() || pollPeriod.isZero()) {
            throw new IllegalArgumentException("pollPeriod must be positive");
        }
        if (cycleTimeout.isNegative() || cycleTimeout.isZero()) {
            throw new IllegalArgumentException("cycleTimeout must be positive");
        }
        if (builder.workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }

        Map<String, DeviceState> states = new LinkedHashMap<>();
        for (DeviceConfig device : builder.devices) {
            CircuitBreaker breaker = new CircuitBreaker("device:" + device.id(), breakerSettings, clock,
                (name, from, to) -> metrics.recordBreakerState(name, to));
            if (states.putIfAbsent(device.id(), new DeviceState(device, breaker)) != null) {
                throw new IllegalArgumentException("duplicate device id: " + device.id());
            }
            metrics.recordBreakerState(breaker.name(), breaker.state());
        }
        this.devices = Collections.unmodifiableMap(states);
        this.pollExecutor = new RetryExecutor("device-poll", pollPolicy, PollingCoordinator::isRetryable);

        int workerCount = builder.workerCount > 0 ? builder.workerCount : devices.size();
        this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("relay-poll-worker-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts polling at the configured period, first cycle immediately. Subsequent calls are
     * no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("PollingCoordinator has been closed");
        }
        if (cycleTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-poll-scheduler-"));
        cycleTask = scheduler.scheduleAtFixedRate(this::scheduledCycle, 0L, pollPeriod.toMillis(),
            TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Polling {0} device(s) every {1}", new Object[]{devices.size(), pollPeriod});
    }

    /**
     * Polls every device once and waits for the results, at most the cycle timeout.
     *
     * @param now the instant the cycle runs for; determines the business date of its readings
     * @return per-device outcomes
     * @throws IllegalStateException if the coordinator has been closed
     */
    public CycleResult runCycle(Instant now) {
        Objects.requireNonNull(now, "now");
        if (closed) {
            throw new IllegalStateException("PollingCoordinator has been closed");
        }
        long startNanos = System.nanoTime();
        List<DeviceState> states = new ArrayList<>(devices.values());
        List<Future<DeviceOutcome>> futures = new ArrayList<>(states.size());
        for (DeviceState state : states) {
            futures.add(workers.submit(() -> pollDevice(state, now)));
        }

        long deadline = startNanos + cycleTimeout.toNanos();
        List<DeviceOutcome> outcomes = new ArrayList<>(states.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<DeviceOutcome> future = futures.get(i);
            String deviceId = states.get(i).config.id();
            if (interrupted) {
                future.cancel(true);
                outcomes.add(new DeviceOutcome.Failed(deviceId, DeviceOutcome.FailureKind.CANCELLED,
                    "cycle interrupted", 0));
                continue;
            }
            try {
                outcomes.add(future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.log(Level.WARNING, "Poll of device {0} exceeded the cycle timeout of {1}",
                    new Object[]{deviceId, cycleTimeout});
                outcomes.add(new DeviceOutcome.Failed(deviceId, DeviceOutcome.FailureKind.TIMED_OUT,
                    "cycle timeout of " + cycleTimeout + " exceeded", 0));
            } catch (CancellationException e) {
                outcomes.add(new DeviceOutcome.Failed(deviceId, DeviceOutcome.FailureKind.CANCELLED,
                    "poll cancelled", 0));
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Unexpected error polling device " + deviceId, e.getCause());
                outcomes.add(new DeviceOutcome.Failed(deviceId, DeviceOutcome.FailureKind.READ_FAILED,
                    String.valueOf(e.getCause()), 0));
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                outcomes.add(new DeviceOutcome.Failed(deviceId, DeviceOutcome.FailureKind.CANCELLED,
                    "cycle interrupted", 0));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new CycleResult(now, Duration.ofNanos(System.nanoTime() - startNanos), outcomes);
    }

    public Optional<DeviceHealth> deviceHealth(String deviceId) {
        DeviceState state = devices.get(deviceId);
        return state == null ? Optional.empty() : Optional.of(state.health());
    }

    public List<DeviceHealth> deviceHealth() {
        List<DeviceHealth> health = new ArrayList<>(devices.size());
        for (DeviceState state : devices.values()) {
            health.add(state.health());
        }
        return health;
    }

    /**
     * Healthy means at least one device was read successfully within {@code offlineThreshold}.
     */
    public boolean isHealthy(Duration offlineThreshold) {
        return isHealthy(offlineThreshold, clock.instant());
    }

    public boolean isHealthy(Duration offlineThreshold, Instant now) {
        Objects.requireNonNull(offlineThreshold, "offlineThreshold");
        for (DeviceState state : devices.values()) {
            if (state.health().isOnline(offlineThreshold, now)) {
                return true;
            }
        }
        return false;
    }

    public List<DeviceConfig> devices() {
        List<DeviceConfig> configs = new ArrayList<>(devices.size());
        for (DeviceState state : devices.values()) {
            configs.add(state.config);
        }
        return configs;
    }

    /**
     * Stops issuing cycles, waits for a running cycle to finish or time out, then shuts the
     * worker pool down.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (cycleTask != null) {
            cycleTask.cancel(false);
            cycleTask = null;
        }
        try {
            if (scheduler != null) {
                scheduler.shutdown();
                if (!scheduler.awaitTermination(cycleTimeout.toMillis() + 1_000L, TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            }
            stopToken.cancel();
            workers.shutdown();
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Device reads still running after 5s; interrupting");
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            stopToken.cancel();
            workers.shutdownNow();
            if (scheduler != null) {
                scheduler.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }

    private void scheduledCycle() {
        if (closed) {
            return;
        }
        try {
            CycleResult result = runCycle(clock.instant());
            logger.log(Level.FINE, "Poll cycle finished: {0}", result);
        } catch (RuntimeException e) {
            // a thrown exception would cancel the periodic task
            logger.log(Level.SEVERE, "Poll cycle failed", e);
        }
    }

    private DeviceOutcome pollDevice(DeviceState state, Instant now) {
        DeviceConfig device = state.config;
        if (!state.inFlight.compareAndSet(false, true)) {
            metrics.incrementPollSkipped(device.id());
            logger.log(Level.FINE, "Previous read of {0} not finished; skipping", device.id());
            return new DeviceOutcome.Skipped(device.id(), DeviceOutcome.SkipReason.IN_FLIGHT);
        }
        try {
            if (!state.breaker.allow()) {
                metrics.incrementPollSkipped(device.id());
                return new DeviceOutcome.Skipped(device.id(), DeviceOutcome.SkipReason.BREAKER_OPEN);
            }
            long startNanos = System.nanoTime();
            RetryOutcome<List<Reading>> outcome = pollExecutor.execute(
                attempt -> deviceClient.read(device, device.timeout()), stopToken);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordPollDurationMs(device.id(), elapsed.toMillis());

            if (outcome instanceof RetryOutcome.Success<List<Reading>> success) {
                state.breaker.onSuccess();
                state.recordSuccess(clock.instant());
                metrics.incrementPollSuccess(device.id());
                List<Reading> readings = success.value() == null ? List.of() : success.value();
                return applyAndPublish(state, readings, now, success.attempts(), elapsed);
            }
            if (outcome instanceof RetryOutcome.Failure<List<Reading>> failure) {
                state.breaker.onFailure();
                String message = describe(failure.lastError());
                state.recordError(message, clock.instant());
                metrics.incrementPollFailure(device.id());
                logger.log(Level.WARNING, "Reading device " + device.id() + " failed after "
                    + failure.attempts() + " attempt(s)", failure.lastError());
                return new DeviceOutcome.Failed(device.id(), DeviceOutcome.FailureKind.READ_FAILED,
                    message, failure.attempts());
            }
            if (!stopToken.isCancelled()) {
                // interrupted by the cycle timeout
                state.breaker.onFailure();
            }
            state.recordError("read cancelled", clock.instant());
            metrics.incrementPollFailure(device.id());
            return new DeviceOutcome.Failed(device.id(), DeviceOutcome.FailureKind.CANCELLED,
                "read cancelled", outcome.attempts());
        } finally {
            state.inFlight.set(false);
        }
    }

    private DeviceOutcome applyAndPublish(DeviceState state, List<Reading> readings, Instant now,
                                          int attempts, Duration elapsed) {
        DeviceConfig device = state.config;
        LocalDate businessDate = calendar.businessDate(now);
        int ledgerFailures = 0;
        int published = 0;
        int rejected = 0;
        List<Envelope> summaries = new ArrayList<>();

        for (List<DeviceState.PendingReading> queue : state.pendingByChannel().values()) {
            for (DeviceState.PendingReading pending : queue) {
                try {
                    LedgerUpdate update = apply(device.id(), pending);
                    state.clearPending(pending);
                    collectSummary(update, summaries);
                    logger.log(Level.INFO, "Re-applied pending reading of {0} channel {1} for {2}",
                        new Object[]{device.id(), pending.reading().channelId(), pending.businessDate()});
                } catch (LedgerException e) {
                    logger.log(Level.FINE, "Pending reading of " + device.id() + " still not persisted", e);
                    // later readings of this channel must wait for this one
                    break;
                }
            }
        }

        for (Reading reading : readings) {
            DeviceState.PendingReading current = new DeviceState.PendingReading(reading, now, businessDate);
            if (state.hasPending(reading.channelId())) {
                ledgerFailures++;
                state.keepPending(current);
                logger.log(Level.WARNING, "Earlier reading of {0} channel {1} not yet persisted; deferring",
                    new Object[]{device.id(), reading.channelId()});
                continue;
            }
            try {
                LedgerUpdate update = apply(device.id(), current);
                collectSummary(update, summaries);
            } catch (LedgerException e) {
                ledgerFailures++;
                state.keepPending(current);
                logger.log(Level.WARNING, "Ledger update failed for " + device.id() + " channel "
                    + reading.channelId() + "; will retry next cycle", e);
            }
        }

        List<Envelope> envelopes = new ArrayList<>(summaries);
        envelopes.addAll(composer.compose(device, readings, now));
        for (Envelope envelope : envelopes) {
            if (publisher.publish(envelope)) {
                published++;
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            logger.log(Level.WARNING, "Publisher rejected {0} envelope(s) from {1}",
                new Object[]{rejected, device.id()});
        }
        return new DeviceOutcome.Succeeded(device.id(), readings.size(), published, ledgerFailures,
            rejected, attempts, elapsed);
    }

    private LedgerUpdate apply(String deviceId, DeviceState.PendingReading pending) {
        Reading reading = pending.reading();
        return ledger.applyReading(deviceId, reading.channelId(), reading.today(), reading.total(),
            pending.observedAt(), pending.businessDate());
    }

    private void collectSummary(LedgerUpdate update, List<Envelope> summaries) {
        if (update.rolledOver()) {
            summaries.add(composer.daySummary(update.finalizedDate(), update.finalizedToday(), update.record()));
        }
    }

    private static boolean isRetryable(Exception e) {
        return !(e instanceof DeviceReadException dre) || dre.kind() == ErrorKind.TRANSIENT;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }

    /**
     * Builder for {@link PollingCoordinator}.
     */
    public static final class Builder {
        private final List<DeviceConfig> devices = new ArrayList<>();
        private DeviceClient deviceClient;
        private ProductionLedger ledger;
        private PersistentPublisher publisher;
        private EnvelopeComposer composer;
        private DailyResetCalendar calendar;
        private BreakerSettings breakerSettings;
        private RetryPolicy pollRetryPolicy;
        private int workerCount;
        private Duration pollPeriod = Duration.ofSeconds(60);
        private Duration cycleTimeout;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Adds a device to poll. <b>At least one is required.</b>
         */
        public Builder device(DeviceConfig device) {
            this.devices.add(Objects.requireNonNull(device, "device"));
            return this;
        }

        public Builder devices(List<DeviceConfig> devices) {
            for (DeviceConfig device : devices) {
                device(device);
            }
            return this;
        }

        /** <b>Required.</b> */
        public Builder deviceClient(DeviceClient deviceClient) {
            this.deviceClient = deviceClient;
            return this;
        }

        /** <b>Required.</b> */
        public Builder ledger(ProductionLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        /** <b>Required.</b> */
        public Builder publisher(PersistentPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /** Optional. Defaults to {@link DefaultEnvelopeComposer}. */
        public Builder composer(EnvelopeComposer composer) {
            this.composer = composer;
            return this;
        }

        /** Optional. Defaults to a reset at 23:00 UTC. */
        public Builder calendar(DailyResetCalendar calendar) {
            this.calendar = calendar;
            return this;
        }

        /** Optional. Defaults to {@link BreakerSettings#DEVICE_DEFAULTS}. */
        public Builder breakerSettings(BreakerSettings breakerSettings) {
            this.breakerSettings = breakerSettings;
            return this;
        }

        /** Optional. Defaults to {@link ExponentialBackoffRetryPolicy#devicePolls()}. */
        public Builder pollRetryPolicy(RetryPolicy pollRetryPolicy) {
            this.pollRetryPolicy = pollRetryPolicy;
            return this;
        }

        /** Optional. {@code 0} (the default) sizes the pool to the device count. */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /** Optional. Defaults to 60 seconds. */
        public Builder pollPeriod(Duration pollPeriod) {
            this.pollPeriod = pollPeriod;
            return this;
        }

        /** Optional. Defaults to the poll period. */
        public Builder cycleTimeout(Duration cycleTimeout) {
            this.cycleTimeout = cycleTimeout;
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

        public PollingCoordinator build() {
            return new PollingCoordinator(this);
        }
    }
}
