package io.relay.publish;

import io.relay.breaker.BreakerSettings;
import io.relay.breaker.BreakerState;
import io.relay.retry.ExponentialBackoffRetryPolicy;
import io.relay.testing.MutableClock;
import io.relay.testing.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersistentPublisherTest {
    private static final Duration OPEN = Duration.ofMinutes(1);

    private final RecordingSink sink = new RecordingSink();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
    private PersistentPublisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.close();
        }
    }

    private PersistentPublisher.Builder builder(int breakerThreshold) {
        return PersistentPublisher.builder()
                .sink(sink)
                .breakerSettings(new BreakerSettings(breakerThreshold, OPEN))
                .connectRetryPolicy(new ExponentialBackoffRetryPolicy(2, 0, 1.0, 0, 0.0))
                .throttleInterval(Duration.ofMillis(10))
                .drainTimeout(Duration.ofSeconds(5))
                .clock(clock);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private static List<String> payloads(List<Envelope> envelopes) {
        List<String> result = new ArrayList<>();
        for (Envelope envelope : envelopes) {
            result.add(envelope.payloadText());
        }
        return result;
    }

    // ── Delivery ────────────────────────────────────────────────────

    @Test
    void deliversInPublishOrder() {
        publisher = builder(5).batchSize(2).build();
        publisher.start();

        for (int i = 1; i <= 5; i++) {
            assertTrue(publisher.publish(Envelope.ofText("d", "m" + i)));
        }

        assertTrue(publisher.flush(Duration.ofSeconds(5)));
        assertEquals(List.of("m1", "m2", "m3", "m4", "m5"), sink.delivered());
        PublisherStats stats = publisher.stats();
        assertEquals(5, stats.enqueued());
        assertEquals(5, stats.sent());
        assertEquals(0, stats.queued());
        assertEquals(0, stats.dropped());
        assertEquals(1, sink.connects(), "one connection is reused");
    }

    @Test
    void highPriorityOvertakesQueuedNormals() {
        publisher = builder(5).batchSize(10).build();
        publisher.publish(Envelope.ofText("d", "n1"));
        publisher.publish(Envelope.ofText("d", "n2"));
        publisher.publish(Envelope.builder("d").payload("h1".getBytes()).priority(Priority.HIGH).build());

        publisher.start();

        assertTrue(publisher.flush(Duration.ofSeconds(5)));
        assertEquals(List.of("h1", "n1", "n2"), sink.delivered());
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void sendFailureKeepsEnvelopesQueuedAndReconnects() throws Exception {
        sink.failNextSends(0);
        publisher = builder(1).build();
        publisher.publish(Envelope.ofText("d", "a"));
        publisher.publish(Envelope.ofText("d", "b"));
        publisher.publish(Envelope.ofText("d", "c"));

        publisher.start();
        awaitCondition(() -> publisher.breakerSnapshot().state() == BreakerState.OPEN);

        List<Envelope> pending = publisher.pending();
        assertEquals(List.of("a", "b", "c"), payloads(pending));
        for (Envelope envelope : pending) {
            assertEquals(1, envelope.attempts());
        }
        assertEquals(1, sink.connects());
        assertEquals(1, sink.closes(), "broken connection is torn down");
        assertFalse(publisher.isConnected());

        clock.advance(OPEN);

        assertTrue(publisher.flush(Duration.ofSeconds(5)));
        assertEquals(2, sink.connects(), "connection recreated on the next eligible cycle");
        assertEquals(List.of("a", "b", "c"), sink.delivered());
        assertEquals(BreakerState.CLOSED, publisher.breakerSnapshot().state());
        assertEquals(1, publisher.stats().sendFailures());
    }

    @Test
    void acknowledgedPrefixIsNotResent() throws Exception {
        sink.failNextSends(2);
        publisher = builder(1).build();
        publisher.publish(Envelope.ofText("d", "a"));
        publisher.publish(Envelope.ofText("d", "b"));
        publisher.publish(Envelope.ofText("d", "c"));

        publisher.start();
        awaitCondition(() -> publisher.breakerSnapshot().state() == BreakerState.OPEN);

        assertEquals(List.of("c"), payloads(publisher.pending()));
        assertEquals(1, publisher.pending().get(0).attempts());
        clock.advance(OPEN);
        assertTrue(publisher.flush(Duration.ofSeconds(5)));
        assertEquals(List.of("a", "b", "c"), sink.delivered());
        assertEquals(3, publisher.stats().sent());
    }

    @Test
    void envelopesAreLostAfterMaxSendAttempts() throws Exception {
        sink.failNextSends(0, 0);
        publisher = builder(10).maxSendAttempts(2).build();
        publisher.publish(Envelope.ofText("d", "a"));
        publisher.publish(Envelope.ofText("d", "b"));

        publisher.start();
        awaitCondition(() -> publisher.stats().lost() == 2);

        assertTrue(publisher.pending().isEmpty());
        assertTrue(sink.delivered().isEmpty());
        assertEquals(2, publisher.stats().dropped());
        assertEquals(2, publisher.stats().sendFailures());
    }

    @Test
    void connectFailuresOpenTheBreakerUntilCooldown() throws Exception {
        sink.refuseConnects(true);
        publisher = builder(1).build();
        publisher.publish(Envelope.ofText("d", "a"));

        publisher.start();
        awaitCondition(() -> publisher.breakerSnapshot().state() == BreakerState.OPEN);
        Thread.sleep(100);

        assertEquals(2, sink.connects(), "one retry run, then the breaker holds further attempts");
        assertEquals(2, publisher.stats().reconnectAttempts());

        sink.refuseConnects(false);
        clock.advance(OPEN);

        assertTrue(publisher.flush(Duration.ofSeconds(5)));
        assertEquals(List.of("a"), sink.delivered());
    }

    // ── Backpressure and lifecycle ──────────────────────────────────

    @Test
    void publishNeverBlocksAndEvictsOldestNormal() {
        publisher = builder(5).queueCapacity(3).build();

        for (int i = 1; i <= 4; i++) {
            assertTrue(publisher.publish(Envelope.ofText("d", String.valueOf(i))));
        }

        assertEquals(List.of("2", "3", "4"), payloads(publisher.pending()));
        PublisherStats stats = publisher.stats();
        assertEquals(3, stats.queued());
        assertEquals(4, stats.enqueued());
        assertEquals(1, stats.evicted());
        assertEquals(1, stats.dropped());
    }

    @Test
    void flushTimesOutWhileNothingIsDispatched() {
        publisher = builder(5).build();
        publisher.publish(Envelope.ofText("d", "a"));

        assertFalse(publisher.flush(Duration.ofMillis(50)));
    }

    @Test
    void stopDrainsThenRejects() {
        publisher = builder(5).build();
        publisher.start();
        publisher.start();
        publisher.publish(Envelope.ofText("d", "a"));

        publisher.stop();

        assertEquals(List.of("a"), sink.delivered());
        assertEquals(1, sink.closes());
        assertFalse(publisher.publish(Envelope.ofText("d", "late")));
        assertEquals(1, publisher.stats().rejected());
        assertThrows(IllegalStateException.class, publisher::start);
        publisher.stop();
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> PersistentPublisher.builder().build());
        assertThrows(IllegalArgumentException.class, () -> builder(1).queueCapacity(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(1).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(1).maxSendAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(1).throttleInterval(Duration.ZERO).build());
    }
}
