package io.relay.publish;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One unit of outbound payload plus its delivery metadata.
 *
 * <p>Each envelope is assigned a ULID-based {@code envelopeId} so the receiving side can apply
 * messages idempotently under at-least-once delivery. Everything except the send attempt
 * counter is immutable. Equality is identity: two envelopes with the same payload are still
 * two deliveries.
 *
 * @see OutboundQueue
 */
public final class Envelope {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    private final String envelopeId;
    private final String destination;
    private final byte[] payload;
    private final Instant createdAt;
    private final Priority priority;
    private final AtomicInteger attempts = new AtomicInteger();

    private Envelope(Builder builder) {
        this.envelopeId = builder.envelopeId == null
                ? UlidCreator.getMonotonicUlid().toString() : builder.envelopeId;
        this.destination = Objects.requireNonNull(builder.destination, "destination");
        if (destination.isEmpty()) {
            throw new IllegalArgumentException("destination cannot be empty");
        }
        Objects.requireNonNull(builder.payload, "payload");
        if (builder.payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
        this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
    }

    /**
     * Creates a builder for the given destination (topic, channel, ...).
     *
     * @param destination where the sink should route the payload
     * @return a new builder
     */
    public static Builder builder(String destination) {
        return new Builder(destination);
    }

    /**
     * Creates a NORMAL priority envelope with a UTF-8 text payload.
     *
     * @param destination where the sink should route the payload
     * @param payload     text payload, usually JSON
     * @return a new envelope
     */
    public static Envelope ofText(String destination, String payload) {
        Objects.requireNonNull(payload, "payload");
        return builder(destination).payload(payload.getBytes(StandardCharsets.UTF_8)).build();
    }

    public String envelopeId() {
        return envelopeId;
    }

    public String destination() {
        return destination;
    }

    /**
     * Returns a copy of the payload.
     */
    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public String payloadText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Priority priority() {
        return priority;
    }

    /**
     * Number of failed send attempts so far.
     */
    public int attempts() {
        return attempts.get();
    }

    int incrementAttempts() {
        return attempts.incrementAndGet();
    }

    byte[] payloadUnsafe() {
        return payload;
    }

    @Override
    public String toString() {
        return "Envelope{id=" + envelopeId
                + ", destination=" + destination
                + ", priority=" + priority
                + ", attempts=" + attempts.get()
                + ", bytes=" + payload.length + '}';
    }

    /** Builder for {@link Envelope}. */
    public static final class Builder {
        private final String destination;
        private String envelopeId;
        private byte[] payload;
        private Instant createdAt;
        private Priority priority;

        private Builder(String destination) {
            this.destination = destination;
        }

        /**
         * Overrides the generated ULID, e.g. to derive a stable id from the data.
         */
        public Builder envelopeId(String envelopeId) {
            this.envelopeId = envelopeId;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Envelope build() {
            return new Envelope(this);
        }
    }
}
