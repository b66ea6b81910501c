package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.spi.backend.BackendSession;

import java.sql.SQLException;

/** One blocking unit of work against a session. */
@FunctionalInterface
interface SessionCall<R> {
  R call(BackendSession session) throws SQLException;
}
