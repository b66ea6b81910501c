package io.intellixity.sqlbridge.jdbc.sqlite;

import io.intellixity.sqlbridge.jdbc.JdbcValueCodec;
import io.intellixity.sqlbridge.value.ColumnType;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Column hints follow SQLite's type affinity rules on the declared type.\n
 *
 * A column declared with no type, or an expression the driver reports as NULL, maps to
 * {@link ColumnType#NULL}; NUMERIC affinity reports
 * {@link ColumnType#UNKNOWN}.\n
 */
public final class SqliteValueCodec extends JdbcValueCodec {

  @Override
  public ColumnType columnType(ResultSetMetaData md, int column) throws SQLException {
    return affinity(md.getColumnTypeName(column));
  }

  static ColumnType affinity(String declared) {
    if (declared == null || declared.isBlank()) return ColumnType.NULL;
    String t = declared.toUpperCase(Locale.ROOT);
    if (t.equals("NULL")) return ColumnType.NULL;
    if (t.contains("INT")) return ColumnType.INTEGER;
    if (t.contains("CHAR") || t.contains("CLOB") || t.contains("TEXT")) return ColumnType.TEXT;
    if (t.contains("BLOB")) return ColumnType.BLOB;
    if (t.contains("REAL") || t.contains("FLOA") || t.contains("DOUB")) return ColumnType.REAL;
    return ColumnType.UNKNOWN;
  }
}
