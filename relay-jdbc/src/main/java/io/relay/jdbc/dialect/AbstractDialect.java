package io.relay.jdbc.dialect;

import io.relay.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL. Subclasses supply the upsert form and may change column types.
 */
public abstract class AbstractDialect implements Dialect {

  /** Column type for values; ledger records are small JSON documents. */
  protected String valueColumnType() {
    return "TEXT";
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " (" +
        "store_key VARCHAR(255) NOT NULL PRIMARY KEY, " +
        "store_value " + valueColumnType() + " NOT NULL, " +
        "updated_at TIMESTAMP NOT NULL)";
  }

  @Override
  public String selectSql(String table) {
    return "SELECT store_value FROM " + table + " WHERE store_key=?";
  }
}
