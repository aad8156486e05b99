package io.relay.spi;

import java.util.Optional;

/**
 * Durable string key-value storage backing the production ledger.
 *
 * <p>{@code put} must be durable when it returns; the ledger only advances its in-memory
 * record after a successful {@code put}.
 */
public interface KeyValueStore {

  Optional<String> get(String key) throws KeyValueStoreException;

  void put(String key, String value) throws KeyValueStoreException;
}
