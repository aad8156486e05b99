package io.relay.spi;

/**
 * Thrown by {@link Sink} on connect or send failure.
 *
 * <p>For sends, {@link #acceptedCount()} tells how many leading messages of the batch the
 * sink acknowledged before failing; those are not resent.
 */
public class SinkException extends RuntimeException {
  private final int acceptedCount;

  public SinkException(String message) {
    this(message, null, 0);
  }

  public SinkException(String message, Throwable cause) {
    this(message, cause, 0);
  }

  public SinkException(String message, Throwable cause, int acceptedCount) {
    super(message, cause);
    if (acceptedCount < 0) {
      throw new IllegalArgumentException("acceptedCount must be >= 0, got: " + acceptedCount);
    }
    this.acceptedCount = acceptedCount;
  }

  public int acceptedCount() {
    return acceptedCount;
  }
}
