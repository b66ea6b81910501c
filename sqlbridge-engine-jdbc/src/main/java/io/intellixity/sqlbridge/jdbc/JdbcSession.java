package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.result.Column;
import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.Row;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.spi.backend.BackendSession;
import io.intellixity.sqlbridge.value.ColumnType;
import io.intellixity.sqlbridge.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link BackendSession} over one JDBC {@link Connection}.\n
 *
 * The connection runs in auto-commit mode outside transactions; {@link #begin()} switches it off
 * until the matching commit or rollback.\n
 */
public class JdbcSession implements BackendSession {
  private static final Logger log = LoggerFactory.getLogger(JdbcSession.class);

  private final String id;
  private final Connection conn;
  private final JdbcValueCodec codec;
  private volatile Statement current;

  public JdbcSession(String id, Connection conn, JdbcValueCodec codec) {
    this.id = Objects.requireNonNull(id, "id");
    this.conn = Objects.requireNonNull(conn, "conn");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String id() { return id; }

  protected Connection connection() { return conn; }

  @Override
  public WriteResult execute(String sql, List<Value> params) throws SQLException {
    long start = System.nanoTime();
    boolean keys = wantsGeneratedKeys(sql);
    try (PreparedStatement ps = prepareWrite(sql, keys)) {
      bindAll(ps, params);
      current = ps;
      long affected;
      try {
        affected = ps.executeUpdate();
      } finally {
        current = null;
      }
      OptionalLong lastId = keys && affected > 0 ? lastInsertId(ps) : OptionalLong.empty();
      if (log.isDebugEnabled()) {
        log.debug("sqlbridge.jdbc op=execute session={} params={} durationMs={} affected={}",
            id, params.size(), (System.nanoTime() - start) / 1_000_000.0, affected);
      }
      return new WriteResult(Math.max(affected, 0), lastId);
    }
  }

  @Override
  public QueryResult query(String sql, List<Value> params) throws SQLException {
    long start = System.nanoTime();
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindAll(ps, params);
      current = ps;
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        List<Column> columns = new ArrayList<>(n);
        ColumnType[] hints = new ColumnType[n];
        for (int i = 1; i <= n; i++) {
          hints[i - 1] = codec.columnType(md, i);
          columns.add(new Column(md.getColumnLabel(i), hints[i - 1]));
        }
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
          List<Value> cells = new ArrayList<>(n);
          for (int i = 1; i <= n; i++) cells.add(codec.decode(rs.getObject(i), hints[i - 1], i - 1));
          rows.add(new Row(cells));
        }
        if (log.isDebugEnabled()) {
          log.debug("sqlbridge.jdbc op=query session={} params={} durationMs={} rows={}",
              id, params.size(), (System.nanoTime() - start) / 1_000_000.0, rows.size());
        }
        return new QueryResult(columns, rows);
      } finally {
        current = null;
      }
    }
  }

  protected PreparedStatement prepareWrite(String sql, boolean generatedKeys) throws SQLException {
    return generatedKeys ? conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS) : conn.prepareStatement(sql);
  }

  /** Only INSERT and REPLACE statements ask the driver for generated keys. */
  protected boolean wantsGeneratedKeys(String sql) {
    String head = sql.stripLeading();
    int end = 0;
    while (end < head.length() && Character.isLetter(head.charAt(end))) end++;
    String verb = head.substring(0, end).toUpperCase(Locale.ROOT);
    return verb.equals("INSERT") || verb.equals("REPLACE");
  }

  /** Called after an INSERT or REPLACE that changed at least one row. */
  protected OptionalLong lastInsertId(PreparedStatement ps) throws SQLException {
    try (ResultSet rs = ps.getGeneratedKeys()) {
      if (rs == null || !rs.next()) return OptionalLong.empty();
      Object k = rs.getObject(1);
      return (k instanceof Number n) ? OptionalLong.of(n.longValue()) : OptionalLong.empty();
    }
  }

  private void bindAll(PreparedStatement ps, List<Value> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) codec.bind(ps, i + 1, params.get(i));
  }

  @Override
  public void begin() throws SQLException {
    conn.setAutoCommit(false);
    log.debug("sqlbridge.jdbc op=begin session={}", id);
  }

  @Override
  public void commit() throws SQLException {
    conn.commit();
    conn.setAutoCommit(true);
    log.debug("sqlbridge.jdbc op=commit session={}", id);
  }

  @Override
  public void rollback() throws SQLException {
    conn.rollback();
    conn.setAutoCommit(true);
    log.debug("sqlbridge.jdbc op=rollback session={}", id);
  }

  @Override
  public boolean isValid(Duration timeout) {
    int seconds = (int) Math.max(1, Math.min(timeout.toSeconds(), Integer.MAX_VALUE));
    try {
      return conn.isValid(seconds);
    } catch (SQLException e) {
      log.debug("sqlbridge.jdbc op=validate session={} error={}", id, e.toString());
      return false;
    }
  }

  @Override
  public void cancel() {
    Statement s = current;
    if (s == null) return;
    try {
      s.cancel();
      log.debug("sqlbridge.jdbc op=cancel session={}", id);
    } catch (SQLException e) {
      log.debug("sqlbridge.jdbc op=cancel session={} error={}", id, e.toString());
    }
  }

  @Override
  public void close() {
    try {
      conn.close();
    } catch (SQLException e) {
      log.debug("sqlbridge.jdbc op=close session={} error={}", id, e.toString());
    }
  }

  @Override
  public String toString() {
    return "JdbcSession[" + id + "]";
  }
}
