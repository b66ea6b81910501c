package io.intellixity.sqlbridge.result;

import io.intellixity.sqlbridge.value.ColumnType;

import java.util.Objects;

/** Result column schema entry: label plus the declared type hint reported by the backend. */
public record Column(String name, ColumnType declaredType) {
  public Column {
    Objects.requireNonNull(name, "name");
    declaredType = (declaredType == null) ? ColumnType.UNKNOWN : declaredType;
  }
}
