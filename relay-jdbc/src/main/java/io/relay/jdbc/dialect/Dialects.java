package io.relay.jdbc.dialect;

import io.relay.jdbc.JdbcStoreException;
import io.relay.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Picks the {@link Dialect} for a database, from those registered through {@link ServiceLoader}.
 *
 * <p>Detection asks the database for its product name, so it works for any URL form or
 * connection pool wrapper.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.named("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> REGISTERED = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private Dialects() {
  }

  public static List<String> names() {
    return REGISTERED.stream().map(Dialect::name).toList();
  }

  /**
   * @throws IllegalArgumentException if no registered dialect has that name (case-insensitive)
   */
  public static Dialect named(String name) {
    for (Dialect dialect : REGISTERED) {
      if (dialect.name().equalsIgnoreCase(name)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + names());
  }

  /**
   * @throws IllegalArgumentException if no registered dialect supports the product
   */
  public static Dialect forProduct(String databaseProductName) {
    for (Dialect dialect : REGISTERED) {
      if (dialect.supportsProduct(databaseProductName)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("No dialect for database product " + databaseProductName
        + ". Available: " + names());
  }

  public static Dialect detect(Connection connection) throws SQLException {
    return forProduct(connection.getMetaData().getDatabaseProductName());
  }

  /**
   * Opens one connection to read the database product name.
   *
   * @throws JdbcStoreException if the connection or its metadata cannot be obtained
   * @throws IllegalArgumentException if no registered dialect supports the database
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection connection = dataSource.getConnection()) {
      return detect(connection);
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to detect the database product", e);
    }
  }
}
