package io.intellixity.sqlbridge.value;

/** Declared column type hint, as far as the backend reports one. */
public enum ColumnType {
  INTEGER,
  REAL,
  TEXT,
  BLOB,
  /** Column declared with no type, or an expression whose value was NULL. */
  NULL,
  UNKNOWN
}
