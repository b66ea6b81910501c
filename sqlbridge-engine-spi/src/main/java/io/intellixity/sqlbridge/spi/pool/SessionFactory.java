package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.spi.backend.BackendSession;

import java.sql.SQLException;

/** Opens a fresh, ready-to-use physical session. Blocking; called on the backend executor. */
@FunctionalInterface
public interface SessionFactory {
  BackendSession open() throws SQLException;
}
