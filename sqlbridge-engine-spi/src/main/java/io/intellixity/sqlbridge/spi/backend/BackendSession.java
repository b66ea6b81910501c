package io.intellixity.sqlbridge.spi.backend;

import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.value.Value;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * One physical connection to a backend.\n
 *
 * All methods except {@link #cancel()} are blocking and are only ever called from the owning
 * backend's executor, by one thread at a time. Parameter counts are validated before a session
 * sees a statement.\n
 */
public interface BackendSession extends AutoCloseable {
  /** Identifier for logs (e.g. {@code mysql-3}). */
  String id();

  WriteResult execute(String sql, List<Value> params) throws SQLException;

  QueryResult query(String sql, List<Value> params) throws SQLException;

  void begin() throws SQLException;

  void commit() throws SQLException;

  void rollback() throws SQLException;

  /** Cheap liveness probe; must not throw. */
  boolean isValid(Duration timeout);

  /**
   * Abort the statement currently running on this session, if any.\n
   * May be called from any thread; must not throw.\n
   */
  void cancel();

  @Override
  void close();
}
