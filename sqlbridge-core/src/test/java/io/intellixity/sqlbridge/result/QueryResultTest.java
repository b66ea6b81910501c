package io.intellixity.sqlbridge.result;

import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.mapping.RowReaders;
import io.intellixity.sqlbridge.value.ColumnType;
import io.intellixity.sqlbridge.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryResultTest {
  private static final List<Column> COLUMNS = List.of(
      new Column("id", ColumnType.INTEGER), new Column("Name", ColumnType.TEXT));

  @Test
  void rejectsRowsOfTheWrongArity() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> new QueryResult(COLUMNS, List.of(Row.of(Value.of(1), Value.of("a")), Row.of(Value.of(2)))));
    assertTrue(e.getMessage().contains("Row 1"));
  }

  @Test
  void emptyResultStillCarriesColumns() {
    QueryResult r = new QueryResult(COLUMNS, List.of());
    assertTrue(r.isEmpty());
    assertEquals(2, r.columnCount());
    assertEquals(List.of(), r.map(RowReaders.values()));
  }

  @Test
  void columnLookupIgnoresCase() {
    QueryResult r = new QueryResult(COLUMNS, List.of());
    assertEquals(1, r.columnIndex("name"));
    assertEquals(-1, r.columnIndex("missing"));
  }

  @Test
  void mappingFailureNamesTheRow() {
    QueryResult r = new QueryResult(COLUMNS, List.of(
        Row.of(Value.of(1), Value.of("a")),
        Row.of(Value.of("two"), Value.of("b")),
        Row.of(Value.of(3), Value.of("c"))));

    MappingException e = assertThrows(MappingException.class, () -> r.map(RowReaders.column(0, Long.class)));
    assertEquals(0, e.index());
    assertEquals(1, e.rowIndex());
    assertTrue(e.getMessage().contains("row 1"));
  }

  @Test
  void mapsEveryRowInOrder() {
    QueryResult r = new QueryResult(COLUMNS, List.of(
        Row.of(Value.of(1), Value.of("a")), Row.of(Value.of(2), Value.of("b"))));
    assertEquals(List.of("a", "b"), r.map(RowReaders.column(1, String.class)));
  }

  @Test
  void writeResultRejectsNegativeCounts() {
    assertThrows(IllegalArgumentException.class, () -> WriteResult.of(-1));
    assertTrue(WriteResult.of(3).lastInsertId().isEmpty());
    assertEquals(9, WriteResult.of(1, 9).lastInsertId().getAsLong());
  }
}
