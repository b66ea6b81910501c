package io.intellixity.sqlbridge.exec;

/** Where a read outside a transaction may be served from. */
public enum ReadMode {
  /** A read replica if one is configured, otherwise the primary. */
  REPLICA,
  /** Always the primary (read-your-writes). */
  PRIMARY
}
