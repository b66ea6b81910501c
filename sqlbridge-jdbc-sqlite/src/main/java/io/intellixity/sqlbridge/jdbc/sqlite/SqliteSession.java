package io.intellixity.sqlbridge.jdbc.sqlite;

import io.intellixity.sqlbridge.jdbc.JdbcSession;
import io.intellixity.sqlbridge.jdbc.JdbcValueCodec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.OptionalLong;

/** Reads the inserted rowid with {@code last_insert_rowid()} instead of driver generated keys. */
final class SqliteSession extends JdbcSession {

  SqliteSession(String id, Connection conn, JdbcValueCodec codec) {
    super(id, conn, codec);
  }

  @Override
  protected PreparedStatement prepareWrite(String sql, boolean generatedKeys) throws SQLException {
    return connection().prepareStatement(sql);
  }

  @Override
  protected OptionalLong lastInsertId(PreparedStatement ps) throws SQLException {
    try (Statement s = connection().createStatement();
         ResultSet rs = s.executeQuery("SELECT last_insert_rowid()")) {
      return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
    }
  }
}
