package io.intellixity.sqlbridge.mapping;

import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.result.Row;
import io.intellixity.sqlbridge.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RowReadersTest {

  @Test
  void singleRequiresExactlyOneColumn() {
    assertEquals(3L, RowReaders.single(Long.class).read(Row.of(Value.of(3))));
    assertThrows(MappingException.class, () -> RowReaders.single(Long.class).read(Row.of(Value.of(3), Value.of(4))));
  }

  @Test
  void realsWidenIntegersButNotTheOtherWay() {
    assertEquals(3.0, RowReaders.single(Double.class).read(Row.of(Value.of(3))));
    assertThrows(MappingException.class, () -> RowReaders.single(Long.class).read(Row.of(Value.of(3.0))));
  }

  @Test
  void columnIgnoresOtherCells() {
    RowReader<String> second = RowReaders.column(1, String.class);
    assertEquals("b", second.read(Row.of(Value.of("a"), Value.of("b"), Value.of("c"))));

    MappingException e = assertThrows(MappingException.class, () -> second.read(Row.of(Value.of("a"))));
    assertEquals(1, e.index());
  }

  @Test
  void valueTargetPassesCellsThrough() {
    assertEquals(Value.NULL, RowReaders.single(Value.class).read(Row.of(Value.NULL)));
    assertEquals(List.of(Value.of(1), Value.NULL), RowReaders.values().read(Row.of(Value.of(1), Value.NULL)));
  }

  @Test
  void withArityChecksBeforeDelegating() {
    RowReader<Long> r = RowReaders.withArity(2, row -> row.get(0).asLong());
    assertEquals(1L, r.read(Row.of(Value.of(1), Value.NULL)));
    assertThrows(MappingException.class, () -> r.read(Row.of(Value.of(1))));
  }

  @Test
  void unsupportedTargetFails() {
    assertThrows(MappingException.class, () -> RowReaders.single(java.util.Date.class).read(Row.of(Value.of(1))));
  }
}
