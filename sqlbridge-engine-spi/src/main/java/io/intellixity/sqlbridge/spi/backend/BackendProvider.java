package io.intellixity.sqlbridge.spi.backend;

import io.intellixity.sqlbridge.config.SqlConfig;

/**
 * Discovered via {@code META-INF/sqlbridge.factories}; creates a {@link SqlBackend} for configs
 * whose {@code backend} equals {@link #id()}.
 */
public interface BackendProvider {
  String id();

  SqlBackend create(SqlConfig config);
}
