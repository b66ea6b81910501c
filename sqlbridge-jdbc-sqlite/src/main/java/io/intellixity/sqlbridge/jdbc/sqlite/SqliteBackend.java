package io.intellixity.sqlbridge.jdbc.sqlite;

import io.intellixity.sqlbridge.config.BackendTarget;
import io.intellixity.sqlbridge.config.FileTarget;
import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.jdbc.JdbcBackend;
import io.intellixity.sqlbridge.jdbc.JdbcSession;
import io.intellixity.sqlbridge.spi.backend.BackendThreads;
import io.intellixity.sqlbridge.spi.sql.StatementSyntax;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Embedded SQLite backend on the xerial driver.\n
 *
 * Every call runs on one dedicated thread, so blocking file I/O never lands on a caller's or a
 * shared pool's thread. In-memory targets live as long as their handle is open.\n
 */
public final class SqliteBackend extends JdbcBackend {
  public static final String ID = "sqlite";
  static final int BUSY_TIMEOUT_MILLIS = 5000;

  public SqliteBackend(SqlConfig config) {
    super(ID, BackendKind.EMBEDDED, StatementSyntax.SQLITE, new SqliteErrorClassifier(), new SqliteValueCodec(),
        BackendThreads.dedicated("sqlbridge-" + config.name() + "-embedded"));
  }

  static String url(FileTarget t) {
    if (t.isInMemory()) return "jdbc:sqlite:file:" + t.memoryName() + "?mode=memory&cache=shared";
    return "jdbc:sqlite:" + t.path().toAbsolutePath();
  }

  /** Connection pragmas, read by the driver from the connection properties. */
  static Properties pragmas(FileTarget t) {
    Properties p = new Properties();
    p.setProperty("foreign_keys", "true");
    p.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MILLIS));
    if (!t.isInMemory()) p.setProperty("journal_mode", "WAL");
    return p;
  }

  @Override
  protected Connection connect(BackendTarget target) throws SQLException {
    if (!(target instanceof FileTarget t)) {
      throw new IllegalArgumentException("sqlite backend requires a file target, got " + target.describe());
    }
    return DriverManager.getConnection(url(t), pragmas(t));
  }

  @Override
  protected JdbcSession newSession(String sessionId, Connection c) {
    return new SqliteSession(sessionId, c, codec());
  }
}
