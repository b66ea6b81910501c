package io.intellixity.sqlbridge.jdbc.sqlite;

import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.spi.backend.BackendProvider;
import io.intellixity.sqlbridge.spi.backend.SqlBackend;

public final class SqliteBackendProvider implements BackendProvider {
  @Override
  public String id() { return SqliteBackend.ID; }

  @Override
  public SqlBackend create(SqlConfig config) {
    return new SqliteBackend(config);
  }
}
