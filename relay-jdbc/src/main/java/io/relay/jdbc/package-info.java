/**
 * JDBC-backed persistence for the production ledger.
 *
 * <p>{@link io.relay.jdbc.JdbcKeyValueStore} implements {@link io.relay.spi.KeyValueStore} on a
 * single table, using a {@link io.relay.jdbc.spi.Dialect} for database-specific upserts.
 *
 * @see io.relay.jdbc.JdbcKeyValueStore
 * @see io.relay.jdbc.dialect.Dialects
 */
package io.relay.jdbc;
