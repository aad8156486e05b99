package io.relay.jdbc.dialect;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public boolean supportsProduct(String databaseProductName) {
    return "PostgreSQL".equalsIgnoreCase(databaseProductName);
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (store_key, store_value, updated_at) VALUES (?,?,?) " +
        "ON CONFLICT (store_key) DO UPDATE SET store_value=EXCLUDED.store_value, updated_at=EXCLUDED.updated_at";
  }
}
