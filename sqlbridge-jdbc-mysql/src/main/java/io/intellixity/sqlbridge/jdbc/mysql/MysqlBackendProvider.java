package io.intellixity.sqlbridge.jdbc.mysql;

import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.spi.backend.BackendProvider;
import io.intellixity.sqlbridge.spi.backend.SqlBackend;

public final class MysqlBackendProvider implements BackendProvider {
  @Override
  public String id() { return MysqlBackend.ID; }

  @Override
  public SqlBackend create(SqlConfig config) {
    return new MysqlBackend(config);
  }
}
