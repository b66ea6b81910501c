package io.intellixity.sqlbridge.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Complete, immutable description of one database.\n
 *
 * {@code backend} names the provider (e.g. {@code mysql}, {@code sqlite}); {@code replica} is optional;
 * {@code initStatements} run on every freshly opened primary connection.\n
 */
public record SqlConfig(String name,
                        String backend,
                        BackendTarget primary,
                        BackendTarget replica,
                        PoolConfig pool,
                        RetryPolicy retry,
                        List<String> initStatements) {
  public SqlConfig {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(primary, "primary");
    if (name.isBlank()) throw new IllegalArgumentException("name is blank");
    backend = backend.trim().toLowerCase(Locale.ROOT);
    if (backend.isEmpty()) throw new IllegalArgumentException("backend is blank");
    if (replica != null && replica.getClass() != primary.getClass()) {
      throw new IllegalArgumentException("replica target kind must match primary target kind");
    }
    pool = (pool == null) ? PoolConfig.defaults() : pool;
    retry = (retry == null) ? RetryPolicy.defaults() : retry;
    initStatements = (initStatements == null) ? List.of() : List.copyOf(initStatements);
  }

  public static SqlConfig of(String name, String backend, BackendTarget primary) {
    return new SqlConfig(name, backend, primary, null, null, null, null);
  }

  public SqlConfig withReplica(BackendTarget replica) {
    return new SqlConfig(name, backend, primary, replica, pool, retry, initStatements);
  }

  public SqlConfig withPool(PoolConfig pool) {
    return new SqlConfig(name, backend, primary, replica, pool, retry, initStatements);
  }

  public SqlConfig withRetry(RetryPolicy retry) {
    return new SqlConfig(name, backend, primary, replica, pool, retry, initStatements);
  }

  public SqlConfig withInitStatements(List<String> initStatements) {
    return new SqlConfig(name, backend, primary, replica, pool, retry, initStatements);
  }

  public boolean hasReplica() {
    return replica != null;
  }
}
