package io.relay.ledger;

import io.relay.spi.KeyValueStore;
import io.relay.spi.KeyValueStoreException;
import io.relay.spi.MetricsExporter;
import io.relay.util.JsonCodec;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cumulative production counters per device channel, persisted through a {@link KeyValueStore}.
 *
 * <p>Each reading is applied atomically per {@link LedgerKey}: load, roll over if the business
 * date advanced, apply, persist, then publish the new record to readers. If the store rejects
 * the write a {@link LedgerException} is thrown and readers keep seeing the previous record.
 *
 * <p>The daily reset happens at most once per business date. A reading for an earlier date
 * than the stored one is treated as stale (a retried or duplicated delivery) and ignored, so
 * it can neither move the date back nor cause a second reset.
 */
public final class ProductionLedger {
  private static final Logger logger = Logger.getLogger(ProductionLedger.class.getName());

  private final KeyValueStore store;
  private final RecordCodec codec;
  private final MetricsExporter metrics;
  private final RolloverListener rolloverListener;
  private final Map<LedgerKey, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Map<LedgerKey, ProductionRecord> records = new ConcurrentHashMap<>();

  public ProductionLedger(KeyValueStore store) {
    this(store, JsonCodec.getDefault(), MetricsExporter.NOOP, RolloverListener.NOOP);
  }

  public ProductionLedger(KeyValueStore store, JsonCodec jsonCodec, MetricsExporter metrics,
      RolloverListener rolloverListener) {
    this.store = Objects.requireNonNull(store, "store");
    this.codec = new RecordCodec(Objects.requireNonNull(jsonCodec, "jsonCodec"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.rolloverListener = Objects.requireNonNull(rolloverListener, "rolloverListener");
  }

  /**
   * Applies one reading.
   *
   * @param deviceId     device identifier
   * @param channelId    channel on the device
   * @param today        the device's production for the current day
   * @param total        the device's lifetime production
   * @param observedAt   when the reading was taken
   * @param businessDate business date of {@code observedAt}, see {@link DailyResetCalendar}
   * @return what changed
   * @throws LedgerException if the record could not be loaded or persisted
   */
  public LedgerUpdate applyReading(String deviceId, int channelId, double today, double total,
      Instant observedAt, LocalDate businessDate) {
    LedgerKey key = new LedgerKey(deviceId, channelId);
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(businessDate, "businessDate");

    ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
    LedgerUpdate update;
    lock.lock();
    try {
      ProductionRecord current = loadLocked(key, businessDate);
      if (businessDate.isBefore(current.lastResetDate())) {
        logger.log(Level.FINE, "Ignoring stale reading for {0} dated {1}; ledger is at {2}",
            new Object[]{key.storageKey(), businessDate, current.lastResetDate()});
        return LedgerUpdate.stale(current);
      }

      boolean rolledOver = businessDate.isAfter(current.lastResetDate());
      double finalizedToday = rolledOver ? current.today() : 0.0;
      LocalDate finalizedDate = rolledOver ? current.lastResetDate() : null;

      boolean anomaly = current.lastUpdated() != null && total < current.total();
      ProductionRecord next = new ProductionRecord(
          deviceId,
          channelId,
          total,
          today,
          rolledOver ? businessDate : current.lastResetDate(),
          observedAt,
          anomaly ? current.anomalies() + 1 : current.anomalies());

      try {
        store.put(key.storageKey(), codec.encode(next));
      } catch (KeyValueStoreException e) {
        metrics.incrementLedgerFailure();
        throw new LedgerException("Failed to persist " + key.storageKey(), e);
      }
      records.put(key, next);
      update = new LedgerUpdate(next, rolledOver, finalizedToday, finalizedDate, anomaly, false);
    } finally {
      lock.unlock();
    }

    if (update.anomaly()) {
      metrics.incrementLedgerAnomaly();
      logger.log(Level.WARNING, "Total decreased for {0}: reading {1} is below stored value",
          new Object[]{key.storageKey(), total});
    }
    if (update.rolledOver()) {
      metrics.incrementLedgerRollover();
      logger.log(Level.INFO, "Finalized {0} for {1}: today={2}",
          new Object[]{update.finalizedDate(), key.storageKey(), update.finalizedToday()});
      try {
        rolloverListener.onRollover(key, update.finalizedDate(), update.finalizedToday());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Rollover listener failed for " + key.storageKey(), e);
      }
    }
    return update;
  }

  /**
   * Returns the current record of a channel, loading it from the store if needed.
   *
   * @throws LedgerException if the store fails
   */
  public Optional<ProductionRecord> record(String deviceId, int channelId) {
    LedgerKey key = new LedgerKey(deviceId, channelId);
    ProductionRecord cached = records.get(key);
    if (cached != null) {
      return Optional.of(cached);
    }
    ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
    lock.lock();
    try {
      return Optional.ofNullable(loadStoredLocked(key));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Snapshot of every record touched since this ledger was created, ordered by key.
   */
  public List<ProductionRecord> records() {
    List<LedgerKey> keys = new ArrayList<>(records.keySet());
    Collections.sort(keys);
    List<ProductionRecord> result = new ArrayList<>(keys.size());
    for (LedgerKey key : keys) {
      result.add(records.get(key));
    }
    return result;
  }

  private ProductionRecord loadLocked(LedgerKey key, LocalDate businessDate) {
    ProductionRecord stored = loadStoredLocked(key);
    return stored != null ? stored : ProductionRecord.initial(key, businessDate);
  }

  private ProductionRecord loadStoredLocked(LedgerKey key) {
    ProductionRecord cached = records.get(key);
    if (cached != null) {
      return cached;
    }
    Optional<String> raw;
    try {
      raw = store.get(key.storageKey());
    } catch (KeyValueStoreException e) {
      metrics.incrementLedgerFailure();
      throw new LedgerException("Failed to load " + key.storageKey(), e);
    }
    if (raw.isEmpty()) {
      return null;
    }
    ProductionRecord loaded;
    try {
      loaded = codec.decode(raw.get());
    } catch (RuntimeException e) {
      metrics.incrementLedgerFailure();
      throw new LedgerException("Corrupt ledger record " + key.storageKey(), e);
    }
    records.put(key, loaded);
    return loaded;
  }
}
