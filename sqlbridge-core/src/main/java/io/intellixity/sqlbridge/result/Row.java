package io.intellixity.sqlbridge.result;

import io.intellixity.sqlbridge.value.Value;

import java.util.List;
import java.util.Objects;

/** Ordered cells of one result row, aligned positionally with {@link QueryResult#columns()}. */
public record Row(List<Value> values) {
  public Row {
    Objects.requireNonNull(values, "values");
    for (Value v : values) Objects.requireNonNull(v, "row cell (use Value.NULL)");
    values = List.copyOf(values);
  }

  public static Row of(Value... values) {
    return new Row(List.of(values));
  }

  public int arity() { return values.size(); }

  public Value get(int index) {
    if (index < 0 || index >= values.size()) {
      throw new IndexOutOfBoundsException("Column index " + index + " out of range for arity " + values.size());
    }
    return values.get(index);
  }
}
