package io.intellixity.sqlbridge.jdbc.mysql;

import io.intellixity.sqlbridge.config.BackendTarget;
import io.intellixity.sqlbridge.config.NetworkTarget;
import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.jdbc.JdbcBackend;
import io.intellixity.sqlbridge.spi.backend.BackendThreads;
import io.intellixity.sqlbridge.spi.sql.StatementSyntax;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Networked MySQL backend on MySQL Connector/J.\n
 *
 * Session calls run on a fixed pool sized to the connections the database may hold at once, so a
 * leased session never waits for a thread.\n
 */
public final class MysqlBackend extends JdbcBackend {
  public static final String ID = "mysql";

  /** Driver properties applied unless the target overrides them. */
  static final Map<String, String> DEFAULT_PROPERTIES = defaults();

  public MysqlBackend(SqlConfig config) {
    super(ID, BackendKind.NETWORKED, StatementSyntax.MYSQL, new MysqlErrorClassifier(), new MysqlValueCodec(),
        BackendThreads.workers("sqlbridge-" + config.name() + "-io", workerCount(config)));
  }

  static int workerCount(SqlConfig config) {
    return config.pool().maxConnections() * (config.hasReplica() ? 2 : 1);
  }

  private static Map<String, String> defaults() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("characterEncoding", "UTF-8");
    m.put("connectionTimeZone", "UTC");
    m.put("tcpKeepAlive", "true");
    m.put("tinyInt1isBit", "false");
    m.put("yearIsDateType", "false");
    m.put("zeroDateTimeBehavior", "CONVERT_TO_NULL");
    return Map.copyOf(m);
  }

  static String url(NetworkTarget t) {
    StringBuilder sb = new StringBuilder("jdbc:mysql://").append(t.host()).append(':').append(t.port()).append('/');
    if (t.database() != null) sb.append(t.database());
    return sb.toString();
  }

  static Properties properties(NetworkTarget t) {
    Properties p = new Properties();
    p.putAll(DEFAULT_PROPERTIES);
    p.putAll(t.properties());
    if (t.user() != null) p.setProperty("user", t.user());
    if (t.password() != null) p.setProperty("password", t.password());
    return p;
  }

  @Override
  protected Connection connect(BackendTarget target) throws SQLException {
    if (!(target instanceof NetworkTarget t)) {
      throw new IllegalArgumentException("mysql backend requires a network target, got " + target.describe());
    }
    return DriverManager.getConnection(url(t), properties(t));
  }
}
