package io.relay.ledger;

import java.time.LocalDate;

/**
 * Notified after a day has been finalized and the new state persisted.
 */
@FunctionalInterface
public interface RolloverListener {

  RolloverListener NOOP = (key, date, today) -> {
  };

  void onRollover(LedgerKey key, LocalDate finalizedDate, double finalizedToday);
}
