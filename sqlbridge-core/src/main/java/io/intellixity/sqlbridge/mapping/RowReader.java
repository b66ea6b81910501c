package io.intellixity.sqlbridge.mapping;

import io.intellixity.sqlbridge.result.Row;

/**
 * Positional row-to-object binding.\n
 *
 * Implementations (hand-written, generated, or {@link RecordRowReader}) must either return a fully
 * built object or throw {@link io.intellixity.sqlbridge.error.MappingException}; never a partial one.\n
 */
@FunctionalInterface
public interface RowReader<T> {
  T read(Row row);
}
