package io.relay.jdbc;

import io.relay.spi.KeyValueStoreException;

/**
 * Unchecked exception wrapping JDBC errors raised by {@link JdbcKeyValueStore}.
 */
public final class JdbcStoreException extends KeyValueStoreException {
  public JdbcStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
