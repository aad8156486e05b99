package io.relay.jdbc.dialect;

import io.relay.jdbc.spi.Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectsTest {

  @Test
  void builtInDialectsAreRegistered() {
    assertTrue(Dialects.names().containsAll(List.of("h2", "postgresql", "mysql")));
  }

  @Test
  void namedIsCaseInsensitive() {
    assertInstanceOf(PostgresDialect.class, Dialects.named("PostgreSQL"));
    assertInstanceOf(H2Dialect.class, Dialects.named("H2"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Dialects.named("oracle"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void productNamesMapToDialects() {
    assertEquals("postgresql", Dialects.forProduct("PostgreSQL").name());
    assertEquals("mysql", Dialects.forProduct("MySQL").name());
    assertEquals("mysql", Dialects.forProduct("MariaDB").name());
    assertEquals("h2", Dialects.forProduct("H2").name());
    assertThrows(IllegalArgumentException.class, () -> Dialects.forProduct("Oracle"));
  }

  @Test
  void detectsFromLiveDatabase() throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:dialects;DB_CLOSE_DELAY=-1");

    assertInstanceOf(H2Dialect.class, Dialects.detect(dataSource));
    try (Connection conn = dataSource.getConnection()) {
      assertInstanceOf(H2Dialect.class, Dialects.detect(conn));
    }
  }

  @Test
  void upsertStatementsTakeKeyValueAndTimestamp() {
    for (String name : Dialects.names()) {
      Dialect dialect = Dialects.named(name);
      String sql = dialect.upsertSql("relay_kv");
      assertEquals(3, sql.chars().filter(c -> c == '?').count(), name);
      assertTrue(sql.contains("relay_kv"), name);
    }
    assertTrue(new PostgresDialect().upsertSql("t").contains("ON CONFLICT (store_key)"));
    assertTrue(new MySqlDialect().upsertSql("t").contains("ON DUPLICATE KEY UPDATE"));
  }
}
