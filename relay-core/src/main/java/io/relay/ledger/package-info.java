/**
 * Durable per-channel production counters with a daily reset boundary.
 *
 * <p>{@link io.relay.ledger.ProductionLedger} persists every update through a
 * {@link io.relay.spi.KeyValueStore}, finalizes the day when a reading crosses the reset hour
 * of its {@link io.relay.ledger.DailyResetCalendar}, and flags totals that go backwards.
 *
 * @see io.relay.ledger.ProductionLedger
 * @see io.relay.ledger.DailyResetCalendar
 */
package io.relay.ledger;
