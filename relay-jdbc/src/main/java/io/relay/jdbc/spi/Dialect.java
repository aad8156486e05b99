package io.relay.jdbc.spi;

/**
 * Database-specific SQL for the key-value table ({@code store_key}, {@code store_value},
 * {@code updated_at}).
 *
 * <p>Register custom dialects via {@code META-INF/services/io.relay.jdbc.spi.Dialect}.
 * Built in: H2, PostgreSQL, MySQL (also used for MariaDB).
 *
 * @see io.relay.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Short identifier, e.g. "h2" or "postgresql".
   */
  String name();

  /**
   * Whether this dialect speaks to a database reporting {@code databaseProductName} from
   * {@link java.sql.DatabaseMetaData#getDatabaseProductName()}.
   */
  boolean supportsProduct(String databaseProductName);

  /**
   * DDL creating the table if it does not exist yet.
   */
  String createTableSql(String table);

  /**
   * Reads one value. Parameter: store_key. Column: store_value.
   */
  String selectSql(String table);

  /**
   * Inserts or replaces one value in a single statement.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>store_key (String)</li>
   *   <li>store_value (String)</li>
   *   <li>updated_at (Timestamp)</li>
   * </ol>
   */
  String upsertSql(String table);

  /**
   * Lists keys matching a LIKE pattern that escapes with backslash, in key order.
   * Column: store_key.
   */
  default String keysLikeSql(String table) {
    return "SELECT store_key FROM " + table + " WHERE store_key LIKE ? ORDER BY store_key";
  }
}
