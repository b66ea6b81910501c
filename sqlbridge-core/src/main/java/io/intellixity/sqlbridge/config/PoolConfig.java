package io.intellixity.sqlbridge.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection pool settings, fixed at construction.\n
 *
 * - maxConnections: upper bound of live connections (embedded backends always use one)\n
 * - acquisitionTimeout: how long {@code acquire()} may wait before failing\n
 * - healthCheckInterval: idle connections older than this are validated before reuse ({@code ZERO} = always)\n
 * - statementTimeout: per-statement deadline; an expired statement is cancelled ({@code ZERO} = none)\n
 */
public record PoolConfig(int maxConnections,
                         Duration acquisitionTimeout,
                         Duration healthCheckInterval,
                         Duration statementTimeout) {
  public static final int DEFAULT_MAX_CONNECTIONS = 10;
  public static final Duration DEFAULT_ACQUISITION_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);

  public PoolConfig {
    if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
    Objects.requireNonNull(acquisitionTimeout, "acquisitionTimeout");
    Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
    statementTimeout = (statementTimeout == null) ? Duration.ZERO : statementTimeout;
    if (acquisitionTimeout.isNegative() || acquisitionTimeout.isZero()) {
      throw new IllegalArgumentException("acquisitionTimeout must be > 0");
    }
    if (healthCheckInterval.isNegative()) throw new IllegalArgumentException("healthCheckInterval must be >= 0");
    if (statementTimeout.isNegative()) throw new IllegalArgumentException("statementTimeout must be >= 0");
  }

  public static PoolConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasStatementTimeout() {
    return !statementTimeout.isZero();
  }

  public static final class Builder {
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private Duration acquisitionTimeout = DEFAULT_ACQUISITION_TIMEOUT;
    private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;
    private Duration statementTimeout = Duration.ZERO;

    private Builder() {}

    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public Builder acquisitionTimeout(Duration acquisitionTimeout) {
      this.acquisitionTimeout = acquisitionTimeout;
      return this;
    }

    public Builder healthCheckInterval(Duration healthCheckInterval) {
      this.healthCheckInterval = healthCheckInterval;
      return this;
    }

    public Builder statementTimeout(Duration statementTimeout) {
      this.statementTimeout = statementTimeout;
      return this;
    }

    public PoolConfig build() {
      return new PoolConfig(maxConnections, acquisitionTimeout, healthCheckInterval, statementTimeout);
    }
  }
}
