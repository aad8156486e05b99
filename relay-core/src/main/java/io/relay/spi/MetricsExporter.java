package io.relay.spi;

import io.relay.breaker.BreakerState;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. The relay-micrometer module bridges this
 * interface into a Micrometer registry.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of successful device reads.
     *
     * @param deviceId device identifier
     */
    void incrementPollSuccess(String deviceId);

    /**
     * Increments the count of device reads that failed after retries, timed out or were cancelled.
     *
     * @param deviceId device identifier
     */
    void incrementPollFailure(String deviceId);

    /**
     * Increments the count of polls skipped because the breaker was open or a read was in flight.
     *
     * @param deviceId device identifier
     */
    void incrementPollSkipped(String deviceId);

    /**
     * Records the wall time of one device poll, retries included.
     *
     * @param deviceId   device identifier
     * @param durationMs duration in milliseconds
     */
    default void recordPollDurationMs(String deviceId, long durationMs) {
    }

    /**
     * Records a breaker state change.
     *
     * @param breakerName breaker target name ({@code device:<id>} or {@code sink})
     * @param state       the new state
     */
    default void recordBreakerState(String breakerName, BreakerState state) {
    }

    /**
     * Increments the count of envelopes accepted by the outbound queue.
     */
    void incrementEnqueued();

    /**
     * Increments the count of queued NORMAL envelopes evicted to make room.
     */
    void incrementEvicted();

    /**
     * Increments the count of envelopes rejected because the queue was full of HIGH envelopes
     * or the publisher was stopped.
     */
    void incrementRejected();

    /**
     * Increments the count of envelopes delivered to the sink.
     *
     * @param count number of envelopes in the acknowledged batch
     */
    void incrementSent(int count);

    /**
     * Increments the count of envelopes discarded after reaching the send attempt limit.
     */
    void incrementLost();

    /**
     * Increments the count of failed batch sends.
     */
    void incrementSendFailure();

    /**
     * Increments the count of sink connect attempts.
     */
    void incrementConnectAttempt();

    /**
     * Records the current depth of the outbound queue.
     *
     * @param depth number of queued envelopes
     */
    void recordQueueDepth(int depth);

    /**
     * Increments the count of readings whose total went down.
     */
    default void incrementLedgerAnomaly() {
    }

    /**
     * Increments the count of daily resets.
     */
    default void incrementLedgerRollover() {
    }

    /**
     * Increments the count of readings that could not be persisted.
     */
    default void incrementLedgerFailure() {
    }

    /**
     * Default no-op implementation that discards all metrics. Extend it to observe selected callbacks.
     */
    class Noop implements MetricsExporter {
        @Override
        public void incrementPollSuccess(String deviceId) {
        }

        @Override
        public void incrementPollFailure(String deviceId) {
        }

        @Override
        public void incrementPollSkipped(String deviceId) {
        }

        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementEvicted() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void incrementSent(int count) {
        }

        @Override
        public void incrementLost() {
        }

        @Override
        public void incrementSendFailure() {
        }

        @Override
        public void incrementConnectAttempt() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
