package io.intellixity.sqlbridge.jdbc.mysql;

import io.intellixity.sqlbridge.jdbc.JdbcValueCodec;
import io.intellixity.sqlbridge.value.ColumnType;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Connector/J specifics.\n
 *
 * JSON, ENUM and SET columns are text; BIT columns are raw bytes unless declared BIT(1); YEAR is an
 * integer. Unsigned BIGINT values arrive as {@link java.math.BigInteger} and are range-checked.\n
 */
public final class MysqlValueCodec extends JdbcValueCodec {

  @Override
  public ColumnType columnType(ResultSetMetaData md, int column) throws SQLException {
    String name = md.getColumnTypeName(column);
    ColumnType specific = (name == null) ? null : switch (name.toUpperCase(Locale.ROOT)) {
      case "JSON", "ENUM", "SET" -> ColumnType.TEXT;
      case "YEAR" -> ColumnType.INTEGER;
      case "BIT" -> md.getPrecision(column) == 1 ? ColumnType.INTEGER : ColumnType.BLOB;
      default -> null;
    };
    if (specific != null) return specific;
    return super.columnType(md, column);
  }
}
