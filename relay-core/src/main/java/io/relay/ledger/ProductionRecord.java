package io.relay.ledger;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Persisted production counters of one device channel.
 *
 * @param deviceId      device identifier
 * @param channelId     channel on the device
 * @param total         lifetime cumulative energy as last reported
 * @param today         energy of the current business day
 * @param lastResetDate business date {@code today} belongs to
 * @param lastUpdated   observation time of the last applied reading, {@code null} if none yet
 * @param anomalies     readings accepted although their total went down
 */
public record ProductionRecord(
    String deviceId,
    int channelId,
    double total,
    double today,
    LocalDate lastResetDate,
    Instant lastUpdated,
    long anomalies) {

  public ProductionRecord {
    Objects.requireNonNull(deviceId, "deviceId");
    Objects.requireNonNull(lastResetDate, "lastResetDate");
  }

  static ProductionRecord initial(LedgerKey key, LocalDate businessDate) {
    return new ProductionRecord(key.deviceId(), key.channelId(), 0.0, 0.0, businessDate, null, 0L);
  }

  public LedgerKey key() {
    return new LedgerKey(deviceId, channelId);
  }
}
