package io.relay.jdbc.dialect;

/**
 * MySQL dialect, also used for MariaDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public boolean supportsProduct(String databaseProductName) {
    return "MySQL".equalsIgnoreCase(databaseProductName) || "MariaDB".equalsIgnoreCase(databaseProductName);
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " (" +
        "store_key VARCHAR(255) NOT NULL PRIMARY KEY, " +
        "store_value TEXT NOT NULL, " +
        "updated_at TIMESTAMP(3) NOT NULL) ENGINE=InnoDB";
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (store_key, store_value, updated_at) VALUES (?,?,?) " +
        "ON DUPLICATE KEY UPDATE store_value=VALUES(store_value), updated_at=VALUES(updated_at)";
  }
}
