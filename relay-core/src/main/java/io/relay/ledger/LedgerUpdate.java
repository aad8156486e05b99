package io.relay.ledger;

import java.time.LocalDate;

/**
 * Result of {@link ProductionLedger#applyReading}.
 *
 * @param record         the record after the call
 * @param rolledOver     whether the day was finalized and {@code today} reset by this call
 * @param finalizedToday the finalized day's {@code today} value when rolled over
 * @param finalizedDate  the finalized business date when rolled over, otherwise {@code null}
 * @param anomaly        whether the reading's total was lower than the stored total
 * @param stale          whether the reading belonged to an earlier business date and was ignored
 */
public record LedgerUpdate(
    ProductionRecord record,
    boolean rolledOver,
    double finalizedToday,
    LocalDate finalizedDate,
    boolean anomaly,
    boolean stale) {

  static LedgerUpdate stale(ProductionRecord current) {
    return new LedgerUpdate(current, false, 0.0, null, false, true);
  }
}
