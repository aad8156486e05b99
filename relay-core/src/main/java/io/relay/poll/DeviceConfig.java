package io.relay.poll;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection parameters of one polled device.
 *
 * @param id      unique device identifier, used in ledger keys and metrics tags
 * @param host    host name or address
 * @param port    TCP port
 * @param unitId  protocol unit (slave) id
 * @param timeout per-read timeout handed to the {@link io.relay.spi.DeviceClient}
 */
public record DeviceConfig(String id, String host, int port, int unitId, Duration timeout) {

  public static final int DEFAULT_PORT = 502;
  public static final int DEFAULT_UNIT_ID = 1;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public DeviceConfig {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(timeout, "timeout");
    if (id.isBlank()) {
      throw new IllegalArgumentException("device id cannot be blank");
    }
    if (host.isBlank()) {
      throw new IllegalArgumentException("host cannot be blank for device " + id);
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be in [1, 65535], got: " + port);
    }
    if (unitId < 0 || unitId > 255) {
      throw new IllegalArgumentException("unitId must be in [0, 255], got: " + unitId);
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive for device " + id);
    }
  }

  public static DeviceConfig of(String id, String host) {
    return new DeviceConfig(id, host, DEFAULT_PORT, DEFAULT_UNIT_ID, DEFAULT_TIMEOUT);
  }
}
