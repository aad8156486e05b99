package io.relay.jdbc;

import io.relay.jdbc.dialect.Dialects;
import io.relay.jdbc.spi.Dialect;
import io.relay.spi.KeyValueStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * {@link KeyValueStore} over a single JDBC table. Each {@code put} is one upsert statement,
 * committed before it returns.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcKeyValueStore store = JdbcKeyValueStore.create(dataSource);
 * store.createTableIfMissing();
 * }</pre>
 */
public final class JdbcKeyValueStore implements KeyValueStore {
  private static final Logger logger = Logger.getLogger(JdbcKeyValueStore.class.getName());

  public static final String DEFAULT_TABLE = "relay_kv";

  // the table name is concatenated into SQL
  private static final Pattern TABLE_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String tableName;
  private final Clock clock;

  public JdbcKeyValueStore(ConnectionProvider connectionProvider, Dialect dialect) {
    this(connectionProvider, dialect, DEFAULT_TABLE, Clock.systemUTC());
  }

  public JdbcKeyValueStore(ConnectionProvider connectionProvider, Dialect dialect,
      String tableName, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(tableName, "tableName");
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a store on the default table, detecting the dialect from the database.
   */
  public static JdbcKeyValueStore create(DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE);
  }

  public static JdbcKeyValueStore create(DataSource dataSource, String tableName) {
    Objects.requireNonNull(dataSource, "dataSource");
    return new JdbcKeyValueStore(dataSource::getConnection, Dialects.detect(dataSource), tableName,
        Clock.systemUTC());
  }

  /**
   * Creates the backing table if it does not exist.
   */
  public void createTableIfMissing() {
    try (Connection conn = connectionProvider.getConnection();
         Statement st = conn.createStatement()) {
      st.execute(dialect.createTableSql(tableName));
      commitIfNeeded(conn);
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to create table " + tableName, e);
    }
    logger.fine("Key-value table " + tableName + " ready (" + dialect.name() + ")");
  }

  @Override
  public Optional<String> get(String key) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection();
         PreparedStatement ps = conn.prepareStatement(dialect.selectSql(tableName))) {
      ps.setString(1, key);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.ofNullable(rs.getString("store_value")) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to read key " + key, e);
    }
  }

  @Override
  public void put(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    try (Connection conn = connectionProvider.getConnection();
         PreparedStatement ps = conn.prepareStatement(dialect.upsertSql(tableName))) {
      ps.setString(1, key);
      ps.setString(2, value);
      ps.setTimestamp(3, Timestamp.from(clock.instant()));
      ps.executeUpdate();
      commitIfNeeded(conn);
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to write key " + key, e);
    }
  }

  /**
   * Lists stored keys starting with {@code prefix}, in key order. LIKE wildcards in the
   * prefix match literally.
   */
  public List<String> keys(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    String pattern = prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
    try (Connection conn = connectionProvider.getConnection();
         PreparedStatement ps = conn.prepareStatement(dialect.keysLikeSql(tableName))) {
      ps.setString(1, pattern);
      List<String> keys = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          keys.add(rs.getString("store_key"));
        }
      }
      return keys;
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to list keys with prefix " + prefix, e);
    }
  }

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return tableName;
  }

  private static void commitIfNeeded(Connection conn) throws SQLException {
    if (!conn.getAutoCommit()) {
      conn.commit();
    }
  }
}
