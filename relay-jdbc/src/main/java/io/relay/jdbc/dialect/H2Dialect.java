package io.relay.jdbc.dialect;

/**
 * H2 dialect. Primarily for testing and the demo.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public boolean supportsProduct(String databaseProductName) {
    return "H2".equalsIgnoreCase(databaseProductName);
  }

  @Override
  protected String valueColumnType() {
    return "CHARACTER VARYING";
  }

  @Override
  public String upsertSql(String table) {
    return "MERGE INTO " + table + " (store_key, store_value, updated_at) KEY (store_key) VALUES (?,?,?)";
  }
}
