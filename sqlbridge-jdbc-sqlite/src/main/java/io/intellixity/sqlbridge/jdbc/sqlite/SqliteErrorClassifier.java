package io.intellixity.sqlbridge.jdbc.sqlite;

import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.jdbc.SqlStateErrorClassifier;

/**
 * SQLite primary result codes.\n
 *
 * The driver reports the primary code as the vendor code; extended codes are reduced to their low
 * byte first.\n
 */
public final class SqliteErrorClassifier extends SqlStateErrorClassifier {

  @Override
  protected FailureClass classifyVendorCode(int code) {
    return switch (code & 0xff) {
      case 5, 6 -> FailureClass.LOCK_TIMEOUT;            // BUSY, LOCKED
      case 19 -> FailureClass.CONSTRAINT_VIOLATION;
      case 1 -> FailureClass.SYNTAX_ERROR;
      case 20 -> FailureClass.TYPE_ERROR;                // MISMATCH
      case 10, 14, 26 -> FailureClass.CONNECTION_RESET;  // IOERR, CANTOPEN, NOTADB
      default -> null;
    };
  }
}
