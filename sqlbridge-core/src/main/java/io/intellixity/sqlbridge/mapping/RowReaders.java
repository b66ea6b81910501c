package io.intellixity.sqlbridge.mapping;

import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.result.Row;
import io.intellixity.sqlbridge.value.Value;

import java.util.List;

/** Small stock readers for scalar and raw results. */
public final class RowReaders {
  private RowReaders() {}

  /** Read the only column of a single-column row as {@code type}. */
  public static <T> RowReader<T> single(Class<T> type) {
    return row -> {
      if (row.arity() != 1) throw new MappingException(Math.min(row.arity(), 1), "expected 1 column but row has " + row.arity());
      return ValueConversions.convert(row.get(0), type, 0);
    };
  }

  /** Read column {@code index} as {@code type}, ignoring other columns. */
  public static <T> RowReader<T> column(int index, Class<T> type) {
    if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    return row -> {
      if (index >= row.arity()) throw new MappingException(index, "row has only " + row.arity() + " columns");
      return ValueConversions.convert(row.get(index), type, index);
    };
  }

  /** Identity reader: the row's cells as-is. */
  public static RowReader<List<Value>> values() {
    return Row::values;
  }

  /** Strict arity check, then delegate. */
  public static <T> RowReader<T> withArity(int arity, RowReader<T> delegate) {
    return (Row row) -> {
      if (row.arity() != arity) {
        throw new MappingException(Math.min(row.arity(), arity), "expected " + arity + " columns but row has " + row.arity());
      }
      return delegate.read(row);
    };
  }
}
