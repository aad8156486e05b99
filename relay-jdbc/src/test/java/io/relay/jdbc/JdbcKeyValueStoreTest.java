package io.relay.jdbc;

import io.relay.jdbc.dialect.H2Dialect;
import io.relay.ledger.ProductionLedger;
import io.relay.ledger.ProductionRecord;
import io.relay.spi.KeyValueStoreException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcKeyValueStoreTest {
  private JdbcDataSource dataSource;
  private JdbcKeyValueStore store;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:kv_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    store = JdbcKeyValueStore.create(dataSource);
    store.createTableIfMissing();
  }

  @Test
  void detectsH2AndUsesDefaultTable() {
    assertEquals("h2", store.dialect().name());
    assertEquals("relay_kv", store.tableName());
  }

  @Test
  void missingKeyIsEmpty() {
    assertEquals(Optional.empty(), store.get("production/none/0"));
  }

  @Test
  void putThenOverwrite() throws Exception {
    store.put("production/dtu/1", "{\"total\":1.0}");
    store.put("production/dtu/1", "{\"total\":2.0}");

    assertEquals(Optional.of("{\"total\":2.0}"), store.get("production/dtu/1"));
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM relay_kv")) {
      rs.next();
      assertEquals(1, rs.getInt(1));
    }
  }

  @Test
  void createTableIsIdempotent() {
    store.put("k", "v");
    store.createTableIfMissing();

    assertEquals(Optional.of("v"), store.get("k"));
  }

  @Test
  void keysByPrefixAreOrderedAndLiteral() {
    store.put("production/dtu-b/1", "{}");
    store.put("production/dtu-a/2", "{}");
    store.put("production/dtu-a/1", "{}");
    store.put("productionXdtu/1", "{}");
    store.put("other/1", "{}");

    assertEquals(List.of("production/dtu-a/1", "production/dtu-a/2", "production/dtu-b/1"),
        store.keys("production/"));
    assertEquals(List.of("production/dtu-a/1", "production/dtu-a/2"), store.keys("production/dtu-a/"));
  }

  @Test
  void customTableAndClock() throws Exception {
    Clock clock = Clock.fixed(Instant.parse("2024-06-10T12:00:00Z"), ZoneOffset.UTC);
    JdbcKeyValueStore custom = new JdbcKeyValueStore(dataSource::getConnection,
        new H2Dialect(), "ledger_state", clock);
    custom.createTableIfMissing();
    custom.put("a", "1");

    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT updated_at FROM ledger_state WHERE store_key='a'")) {
      assertTrue(rs.next());
      assertEquals(Instant.parse("2024-06-10T12:00:00Z"), rs.getTimestamp(1).toInstant());
    }
  }

  @Test
  void rejectsUnsafeTableName() {
    assertThrows(IllegalArgumentException.class, () ->
        new JdbcKeyValueStore(dataSource::getConnection, new H2Dialect(),
            "kv; DROP TABLE x", Clock.systemUTC()));
  }

  @Test
  void sqlErrorsSurfaceAsStoreExceptions() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("DROP TABLE relay_kv");
    }

    JdbcStoreException ex = assertThrows(JdbcStoreException.class, () -> store.put("k", "v"));
    assertInstanceOf(KeyValueStoreException.class, ex);
    assertThrows(KeyValueStoreException.class, () -> store.get("k"));
  }

  @Test
  void putsCommitOnConnectionsWithoutAutoCommit() throws Exception {
    List<Connection> handedOut = new ArrayList<>();
    JdbcKeyValueStore manual = new JdbcKeyValueStore(() -> {
      Connection conn = dataSource.getConnection();
      conn.setAutoCommit(false);
      handedOut.add(conn);
      return conn;
    }, new H2Dialect());

    manual.put("production/dtu/1", "{\"today\":3.0}");

    assertEquals(Optional.of("{\"today\":3.0}"), store.get("production/dtu/1"));
    assertEquals(1, handedOut.size());
    assertTrue(handedOut.get(0).isClosed());
  }

  @Test
  void ledgerStateSurvivesRestart() {
    LocalDate day = LocalDate.of(2024, 6, 10);
    new ProductionLedger(store).applyReading("dtu", 1, 4.5, 1_204.5,
        Instant.parse("2024-06-10T10:00:00Z"), day);

    ProductionLedger restarted = new ProductionLedger(JdbcKeyValueStore.create(dataSource));
    ProductionRecord record = restarted.record("dtu", 1).orElseThrow();

    assertEquals(1_204.5, record.total());
    assertEquals(4.5, record.today());
    assertEquals(day, record.lastResetDate());
  }
}
