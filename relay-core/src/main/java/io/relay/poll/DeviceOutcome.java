package io.relay.poll;

import java.time.Duration;

/**
 * What happened to one device during a cycle.
 */
public sealed interface DeviceOutcome {

  String deviceId();

  enum SkipReason {
    /** The device breaker refused the call. */
    BREAKER_OPEN,
    /** The previous read of this device had not finished. */
    IN_FLIGHT
  }

  enum FailureKind {
    /** The read failed after all retries, or with a non-retryable error. */
    READ_FAILED,
    /** The cycle timeout elapsed before the read finished. */
    TIMED_OUT,
    /** The read was interrupted or the coordinator shut down. */
    CANCELLED
  }

  /**
   * @param readings          readings returned by the device
   * @param published         envelopes accepted by the publisher
   * @param ledgerFailures    readings that could not be persisted and were kept for the next cycle
   * @param rejectedEnvelopes envelopes the publisher refused
   * @param attempts          read attempts used
   * @param elapsed           wall time of the poll, retries included
   */
  record Succeeded(String deviceId, int readings, int published, int ledgerFailures,
      int rejectedEnvelopes, int attempts, Duration elapsed) implements DeviceOutcome {
  }

  record Skipped(String deviceId, SkipReason reason) implements DeviceOutcome {
  }

  record Failed(String deviceId, FailureKind kind, String message, int attempts)
      implements DeviceOutcome {
  }
}
