package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.config.SqlConfigLoader;
import io.intellixity.sqlbridge.exec.ShardedSqlDatabase;
import io.intellixity.sqlbridge.exec.SqlDatabase;
import io.intellixity.sqlbridge.instrument.QueryInstrumentation;
import io.intellixity.sqlbridge.spi.backend.BackendProvider;
import io.intellixity.sqlbridge.spi.backend.SqlBackend;
import io.intellixity.sqlbridge.util.SqlFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Opens databases from configuration.\n
 *
 * The backend provider is looked up by {@link SqlConfig#backend()} among the
 * {@link BackendProvider}s registered in {@code META-INF/sqlbridge.factories}.\n
 */
public final class SqlDatabases {
  private static final Logger log = LoggerFactory.getLogger(SqlDatabases.class);

  private SqlDatabases() {}

  public static SqlDatabase open(SqlConfig config) {
    return open(config, QueryInstrumentation.NOOP);
  }

  public static SqlDatabase open(SqlConfig config, QueryInstrumentation instrumentation) {
    Objects.requireNonNull(config, "config");
    SqlBackend backend = provider(config.backend()).create(config);
    try {
      return new PooledSqlDatabase(config, backend, instrumentation);
    } catch (RuntimeException e) {
      backend.close();
      throw e;
    }
  }

  /** Load a YAML/JSON config file and open it. */
  public static SqlDatabase open(Path configFile, QueryInstrumentation instrumentation) {
    return open(new SqlConfigLoader().load(configFile), instrumentation);
  }

  /** Open one database per config, in order; shard {@code i} is {@code configs.get(i)}. */
  public static ShardedSqlDatabase openSharded(List<SqlConfig> configs, QueryInstrumentation instrumentation) {
    Objects.requireNonNull(configs, "configs");
    List<SqlDatabase> opened = new ArrayList<>(configs.size());
    try {
      for (SqlConfig c : configs) opened.add(open(c, instrumentation));
      return new ShardedSqlDatabase(opened);
    } catch (RuntimeException e) {
      for (SqlDatabase db : opened) {
        try {
          db.close();
        } catch (RuntimeException suppressed) {
          e.addSuppressed(suppressed);
        }
      }
      throw e;
    }
  }

  static BackendProvider provider(String id) {
    Map<String, BackendProvider> providers = SqlFactoriesLoader.loadById(BackendProvider.class, BackendProvider::id);
    BackendProvider p = providers.get(id.trim().toLowerCase(Locale.ROOT));
    if (p == null) {
      throw new IllegalArgumentException("No backend provider registered for '" + id + "'; available: "
          + providers.keySet());
    }
    log.debug("sqlbridge.db op=provider backend={} provider={}", id, p.getClass().getName());
    return p;
  }
}
