package io.intellixity.sqlbridge.jdbc.mysql;

import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.jdbc.SqlStateErrorClassifier;

/** MySQL server and client error numbers, falling back to SQLState. */
public final class MysqlErrorClassifier extends SqlStateErrorClassifier {

  @Override
  protected FailureClass classifyVendorCode(int code) {
    return switch (code) {
      // server gone away, lost connection, lost connection during handshake, shutdown in progress, connection killed
      case 2006, 2013, 2055, 1053, 1927 -> FailureClass.CONNECTION_RESET;
      case 1205 -> FailureClass.LOCK_TIMEOUT;
      case 1213 -> FailureClass.DEADLOCK;
      case 1062, 1451, 1452, 1048, 1364, 1557, 1586, 3819 -> FailureClass.CONSTRAINT_VIOLATION;
      case 1064, 1054, 1146, 1149 -> FailureClass.SYNTAX_ERROR;
      case 1366, 1264, 1292, 1406 -> FailureClass.TYPE_ERROR;
      default -> null;
    };
  }
}
