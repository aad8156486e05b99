package io.relay.poll;

import io.relay.ledger.ProductionRecord;
import io.relay.publish.Envelope;
import io.relay.spi.Reading;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Turns device readings and finalized days into outbound envelopes.
 *
 * @see DefaultEnvelopeComposer
 */
public interface EnvelopeComposer {

    /**
     * Builds the telemetry envelopes for one successful read.
     *
     * @param device     the device that was read
     * @param readings   its readings
     * @param observedAt when the read happened
     * @return envelopes to publish (may be empty)
     */
    List<Envelope> compose(DeviceConfig device, List<Reading> readings, Instant observedAt);

    /**
     * Builds the HIGH priority summary published when a business day is finalized.
     *
     * @param finalizedDate  the business date that ended
     * @param finalizedToday that day's production
     * @param record         the channel's record after the rollover
     * @return the summary envelope
     */
    Envelope daySummary(LocalDate finalizedDate, double finalizedToday, ProductionRecord record);
}
