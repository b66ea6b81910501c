package io.intellixity.sqlbridge.result;

import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.mapping.RowReader;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Fully materialized rows of a query together with the column schema.\n
 *
 * Every row has exactly {@code columns().size()} cells; construction rejects anything else.\n
 */
public final class QueryResult implements Iterable<Row> {
  private static final QueryResult EMPTY = new QueryResult(List.of(), List.of());

  private final List<Column> columns;
  private final List<Row> rows;

  public QueryResult(List<Column> columns, List<Row> rows) {
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    int arity = this.columns.size();
    for (int i = 0; i < this.rows.size(); i++) {
      int got = this.rows.get(i).arity();
      if (got != arity) {
        throw new IllegalArgumentException("Row " + i + " has arity " + got + " but result has " + arity + " columns");
      }
    }
  }

  public static QueryResult empty() { return EMPTY; }

  public List<Column> columns() { return columns; }
  public List<Row> rows() { return rows; }
  public int columnCount() { return columns.size(); }
  public int size() { return rows.size(); }
  public boolean isEmpty() { return rows.isEmpty(); }

  public Row row(int index) { return rows.get(index); }

  /** Ordinal of the first column labelled {@code name} (case-insensitive), or -1. */
  public int columnIndex(String name) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).name().equalsIgnoreCase(name)) return i;
    }
    return -1;
  }

  /**
   * Map every row with {@code reader}. A failure on any row fails the whole call; no partial list
   * is ever returned.
   */
  public <T> List<T> map(RowReader<T> reader) {
    Objects.requireNonNull(reader, "reader");
    List<T> out = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      try {
        out.add(reader.read(rows.get(i)));
      } catch (MappingException e) {
        throw e.atRow(i);
      }
    }
    return out;
  }

  @Override
  public Iterator<Row> iterator() { return rows.iterator(); }

  @Override
  public String toString() {
    return "QueryResult[columns=" + columns.size() + ", rows=" + rows.size() + "]";
  }
}
