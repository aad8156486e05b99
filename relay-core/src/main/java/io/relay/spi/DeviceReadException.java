package io.relay.spi;

import java.util.Objects;

/**
 * Thrown by {@link DeviceClient#read} when a device could not be read.
 */
public class DeviceReadException extends RuntimeException {
  private final ErrorKind kind;

  public DeviceReadException(String message) {
    this(ErrorKind.TRANSIENT, message, null);
  }

  public DeviceReadException(String message, Throwable cause) {
    this(ErrorKind.TRANSIENT, message, cause);
  }

  public DeviceReadException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }
}
