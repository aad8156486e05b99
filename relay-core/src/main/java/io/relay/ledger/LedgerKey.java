package io.relay.ledger;

import java.util.Objects;

/**
 * Identity of a ledger entry: one channel of one device.
 */
public record LedgerKey(String deviceId, int channelId) implements Comparable<LedgerKey> {

  public LedgerKey {
    Objects.requireNonNull(deviceId, "deviceId");
    if (deviceId.isEmpty()) {
      throw new IllegalArgumentException("deviceId cannot be empty");
    }
    if (channelId < 0) {
      throw new IllegalArgumentException("channelId must be >= 0, got: " + channelId);
    }
  }

  /**
   * Key under which the record is persisted in the {@link io.relay.spi.KeyValueStore}.
   */
  public String storageKey() {
    return "production/" + deviceId + "/" + channelId;
  }

  @Override
  public int compareTo(LedgerKey other) {
    int byDevice = deviceId.compareTo(other.deviceId);
    return byDevice != 0 ? byDevice : Integer.compare(channelId, other.channelId);
  }
}
