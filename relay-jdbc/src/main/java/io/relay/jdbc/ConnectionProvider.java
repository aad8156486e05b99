package io.relay.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of connections for {@link JdbcKeyValueStore}. The store closes every connection it
 * obtains. A {@code DataSource} adapts as {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
