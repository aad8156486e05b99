package io.relay.poll;

import io.relay.breaker.BreakerSnapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only health view of one device.
 *
 * @param deviceId        device identifier
 * @param breaker         the device breaker's state
 * @param lastSuccess     time of the last successful read, {@code null} if none yet
 * @param lastError       message of the last failure, {@code null} if none yet
 * @param lastErrorAt     time of the last failure
 * @param polls           reads attempted (skips excluded)
 * @param errors          reads that failed
 * @param inFlight        whether a read is running right now
 * @param pendingReadings readings waiting to be re-applied to the ledger
 */
public record DeviceHealth(
    String deviceId,
    BreakerSnapshot breaker,
    Instant lastSuccess,
    String lastError,
    Instant lastErrorAt,
    long polls,
    long errors,
    boolean inFlight,
    int pendingReadings) {

  /**
   * @return whether the device was read successfully within {@code threshold} of {@code now}
   */
  public boolean isOnline(Duration threshold, Instant now) {
    return lastSuccess != null && !lastSuccess.isBefore(now.minus(threshold));
  }
}
