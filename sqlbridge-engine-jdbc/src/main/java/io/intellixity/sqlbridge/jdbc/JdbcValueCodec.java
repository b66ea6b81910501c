package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.error.CodecException;
import io.intellixity.sqlbridge.spi.backend.ValueCodec;
import io.intellixity.sqlbridge.value.ColumnType;
import io.intellixity.sqlbridge.value.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.temporal.TemporalAccessor;
import java.util.UUID;

/**
 * {@link ValueCodec} over the objects JDBC drivers return from {@code ResultSet.getObject}.\n
 *
 * Decoding rules:\n
 * - integral types widen to {@link Value.Int}; values outside the signed 64-bit range fail\n
 * - {@code float} widens to {@link Value.Real}\n
 * - DECIMAL with scale 0 that fits becomes {@link Value.Int}, anything else its plain text form\n
 * - booleans become 0/1, temporal values ISO-8601 text\n
 * - {@code byte[]} in a TEXT column must be valid UTF-8\n
 *
 * Backends override {@link #columnType} and {@link #decodeOther} for driver-specific types.\n
 */
public class JdbcValueCodec implements ValueCodec<Object> {

  @Override
  public Object encode(Value value) {
    if (value == null || value instanceof Value.Null) return null;
    if (value instanceof Value.Int i) return i.value();
    if (value instanceof Value.Real r) return r.value();
    if (value instanceof Value.Text t) return t.value();
    return ((Value.Blob) value).value();
  }

  /** Bind {@code value} at the 1-based {@code index}. */
  public void bind(PreparedStatement ps, int index, Value value) throws SQLException {
    if (value == null || value instanceof Value.Null) {
      ps.setNull(index, nullType());
    } else if (value instanceof Value.Int i) {
      ps.setLong(index, i.value());
    } else if (value instanceof Value.Real r) {
      ps.setDouble(index, r.value());
    } else if (value instanceof Value.Text t) {
      ps.setString(index, t.value());
    } else {
      ps.setBytes(index, ((Value.Blob) value).value());
    }
  }

  /** SQL type passed to {@code setNull}. */
  protected int nullType() {
    return Types.NULL;
  }

  @Override
  public Value decode(Object cell, int columnIndex) {
    return decode(cell, ColumnType.UNKNOWN, columnIndex);
  }

  public Value decode(Object cell, ColumnType hint, int columnIndex) {
    if (cell == null) return Value.NULL;
    if (cell instanceof Long l) return Value.of(l);
    if (cell instanceof Integer i) return Value.of(i.longValue());
    if (cell instanceof Short s) return Value.of(s.longValue());
    if (cell instanceof Byte b) return Value.of(b.longValue());
    if (cell instanceof Double d) return Value.of(d);
    if (cell instanceof Float f) return Value.of(f.doubleValue());
    if (cell instanceof Boolean b) return Value.of(b ? 1L : 0L);
    if (cell instanceof String s) return Value.of(s);
    if (cell instanceof BigInteger bi) return integral(bi, columnIndex);
    if (cell instanceof BigDecimal bd) return decimal(bd);
    if (cell instanceof byte[] bytes) {
      return (hint == ColumnType.TEXT) ? Value.of(utf8(bytes, columnIndex)) : Value.of(bytes);
    }
    try {
      if (cell instanceof Clob c) return Value.of(c.getSubString(1, lengthOf(c.length(), columnIndex)));
      if (cell instanceof Blob b) return Value.of(b.getBytes(1, lengthOf(b.length(), columnIndex)));
    } catch (SQLException e) {
      throw new CodecException(columnIndex, "failed to read LOB: " + e.getMessage(), e);
    }
    if (cell instanceof Timestamp ts) return Value.of(ts.toLocalDateTime().toString());
    if (cell instanceof java.sql.Date d) return Value.of(d.toLocalDate().toString());
    if (cell instanceof Time t) return Value.of(t.toLocalTime().toString());
    if (cell instanceof TemporalAccessor ta) return Value.of(ta.toString());
    if (cell instanceof UUID u) return Value.of(u.toString());
    return decodeOther(cell, hint, columnIndex);
  }

  /** Called for cell classes the generic rules do not cover. */
  protected Value decodeOther(Object cell, ColumnType hint, int columnIndex) {
    throw new CodecException(columnIndex, "unsupported cell type " + cell.getClass().getName());
  }

  /** Declared-type hint for the 1-based {@code column}. */
  public ColumnType columnType(ResultSetMetaData md, int column) throws SQLException {
    return switch (md.getColumnType(column)) {
      case Types.BIGINT, Types.INTEGER, Types.SMALLINT, Types.TINYINT, Types.BOOLEAN, Types.BIT -> ColumnType.INTEGER;
      case Types.REAL, Types.FLOAT, Types.DOUBLE -> ColumnType.REAL;
      case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR,
          Types.CLOB, Types.NCLOB, Types.DATE, Types.TIME, Types.TIMESTAMP, Types.TIME_WITH_TIMEZONE,
          Types.TIMESTAMP_WITH_TIMEZONE -> ColumnType.TEXT;
      case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> ColumnType.BLOB;
      case Types.NULL -> ColumnType.NULL;
      default -> ColumnType.UNKNOWN;
    };
  }

  protected static Value integral(BigInteger bi, int columnIndex) {
    if (bi.bitLength() > 63) {
      throw new CodecException(columnIndex, "integer " + bi + " does not fit in 64 bits");
    }
    return Value.of(bi.longValue());
  }

  private static Value decimal(BigDecimal bd) {
    if (bd.scale() <= 0) {
      BigInteger bi = bd.toBigInteger();
      if (bi.bitLength() <= 63) return Value.of(bi.longValue());
    }
    return Value.of(bd.toPlainString());
  }

  protected static String utf8(byte[] bytes, int columnIndex) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new CodecException(columnIndex, "text column holds invalid UTF-8", e);
    }
  }

  private static int lengthOf(long length, int columnIndex) {
    if (length > Integer.MAX_VALUE) throw new CodecException(columnIndex, "LOB too large: " + length + " bytes");
    return (int) length;
  }
}
