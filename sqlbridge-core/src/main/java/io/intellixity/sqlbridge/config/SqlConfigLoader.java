package io.intellixity.sqlbridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads {@link SqlConfig} from YAML or JSON.\n
 *
 * <pre>
 * name: orders
 * backend: mysql
 * primary: { host: db1, port: 3306, database: orders, user: app, passwordEnv: ORDERS_DB_PASSWORD }
 * replica: { host: db2, port: 3306, database: orders, user: app, passwordEnv: ORDERS_DB_PASSWORD }
 * pool: { maxConnections: 8, acquisitionTimeoutMillis: 5000, healthCheckIntervalMillis: 30000 }
 * retry: { maxAttempts: 3, baseBackoffMillis: 50, maxBackoffMillis: 2000 }
 * </pre>
 *
 * Embedded targets use {@code path: /var/lib/app/db.sqlite} or {@code memory: name}.\n
 * Unknown keys are rejected.\n
 */
public final class SqlConfigLoader {
  private final ObjectMapper yaml;
  private final ObjectMapper json;
  private final Function<String, String> env;

  public SqlConfigLoader() {
    this(System::getenv);
  }

  /** {@code env} resolves {@code passwordEnv} references; injectable for tests. */
  public SqlConfigLoader(Function<String, String> env) {
    this.yaml = configure(new ObjectMapper(new YAMLFactory()));
    this.json = configure(new ObjectMapper());
    this.env = env;
  }

  private static ObjectMapper configure(ObjectMapper m) {
    return m.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public SqlConfig load(Path file) {
    String fn = file.getFileName().toString().toLowerCase(Locale.ROOT);
    ObjectMapper m = fn.endsWith(".json") ? json : yaml;
    try (InputStream in = Files.newInputStream(file)) {
      return toConfig(m.readValue(in, ConfigDoc.class), file.toString());
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read SQL config from " + file + ": " + e.getMessage(), e);
    }
  }

  /** Parse YAML (a superset of JSON) from a string. */
  public SqlConfig parse(String text) {
    try {
      return toConfig(yaml.readValue(text, ConfigDoc.class), "<string>");
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to parse SQL config: " + e.getMessage(), e);
    }
  }

  private SqlConfig toConfig(ConfigDoc doc, String origin) {
    if (doc == null) throw new IllegalArgumentException("Empty SQL config: " + origin);
    if (doc.backend() == null) throw new IllegalArgumentException("Missing 'backend' in SQL config: " + origin);
    if (doc.primary() == null) throw new IllegalArgumentException("Missing 'primary' in SQL config: " + origin);
    return new SqlConfig(
        doc.name() == null ? doc.backend() : doc.name(),
        doc.backend(),
        toTarget(doc.primary(), "primary"),
        doc.replica() == null ? null : toTarget(doc.replica(), "replica"),
        doc.pool() == null ? null : toPool(doc.pool()),
        doc.retry() == null ? null : toRetry(doc.retry()),
        doc.initStatements()
    );
  }

  private BackendTarget toTarget(TargetDoc t, String role) {
    boolean file = t.path() != null || t.memory() != null;
    boolean net = t.host() != null;
    if (file == net) {
      throw new IllegalArgumentException("'" + role + "' must set either host (networked) or path/memory (embedded)");
    }
    if (file) {
      if (t.path() != null && t.memory() != null) {
        throw new IllegalArgumentException("'" + role + "' must not set both path and memory");
      }
      return t.path() != null ? FileTarget.of(Path.of(t.path())) : FileTarget.inMemory(t.memory());
    }
    String password = t.password();
    if (password == null && t.passwordEnv() != null) {
      password = env.apply(t.passwordEnv());
      if (password == null) {
        throw new IllegalArgumentException("Environment variable '" + t.passwordEnv() + "' for " + role + " password is not set");
      }
    }
    int port = (t.port() == null) ? 3306 : t.port();
    return new NetworkTarget(t.host(), port, t.database(), t.user(), password, t.properties());
  }

  private static PoolConfig toPool(PoolDoc p) {
    PoolConfig.Builder b = PoolConfig.builder();
    if (p.maxConnections() != null) b.maxConnections(p.maxConnections());
    if (p.acquisitionTimeoutMillis() != null) b.acquisitionTimeout(Duration.ofMillis(p.acquisitionTimeoutMillis()));
    if (p.healthCheckIntervalMillis() != null) b.healthCheckInterval(Duration.ofMillis(p.healthCheckIntervalMillis()));
    if (p.statementTimeoutMillis() != null) b.statementTimeout(Duration.ofMillis(p.statementTimeoutMillis()));
    return b.build();
  }

  private static RetryPolicy toRetry(RetryDoc r) {
    RetryPolicy d = RetryPolicy.defaults();
    return new RetryPolicy(
        r.maxAttempts() == null ? d.maxAttempts() : r.maxAttempts(),
        r.baseBackoffMillis() == null ? d.baseBackoff() : Duration.ofMillis(r.baseBackoffMillis()),
        r.maxBackoffMillis() == null ? d.maxBackoff() : Duration.ofMillis(r.maxBackoffMillis())
    );
  }

  record ConfigDoc(String name, String backend, TargetDoc primary, TargetDoc replica, PoolDoc pool, RetryDoc retry,
                   List<String> initStatements) {}

  record TargetDoc(String host, Integer port, String database, String user, String password, String passwordEnv,
                   Map<String, String> properties, String path, String memory) {}

  record PoolDoc(Integer maxConnections, Long acquisitionTimeoutMillis, Long healthCheckIntervalMillis,
                 Long statementTimeoutMillis) {}

  record RetryDoc(Integer maxAttempts, Long baseBackoffMillis, Long maxBackoffMillis) {}
}
