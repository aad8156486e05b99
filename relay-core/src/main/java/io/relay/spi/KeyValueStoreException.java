package io.relay.spi;

/**
 * Thrown when the key-value persistence engine fails.
 */
public class KeyValueStoreException extends RuntimeException {

  public KeyValueStoreException(String message) {
    super(message);
  }

  public KeyValueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
