package io.intellixity.sqlbridge.spi.backend;

import io.intellixity.sqlbridge.config.BackendTarget;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.spi.sql.StatementSyntax;

import java.sql.SQLException;
import java.util.concurrent.Executor;

/**
 * A configured backend engine: opens sessions and owns the threads they run on.\n
 *
 * NETWORKED backends run each session call on a bounded worker pool; EMBEDDED backends run every
 * call on a single dedicated thread.\n
 */
public interface SqlBackend extends AutoCloseable {
  /** Provider id, e.g. {@code mysql}. */
  String id();

  BackendKind kind();

  StatementSyntax syntax();

  ErrorClassifier errorClassifier();

  /** Open a new physical session. Blocking; called on {@link #executor()}. */
  BackendSession open(BackendTarget target) throws SQLException;

  /** Where all blocking session work for this backend runs. */
  Executor executor();

  /** Stops the backend's threads. Sessions must already be closed. */
  @Override
  void close();
}
