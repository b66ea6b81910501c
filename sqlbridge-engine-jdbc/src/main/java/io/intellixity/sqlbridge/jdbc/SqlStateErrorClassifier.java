package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.spi.backend.ErrorClassifier;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

/**
 * Classifies JDBC failures by vendor code first, then by SQLState.\n
 *
 * Generic SQLState rules:\n
 * - class 08 and connection exceptions: CONNECTION_RESET\n
 * - 40001, 40P01: DEADLOCK\n
 * - HYT00, 55P03: LOCK_TIMEOUT\n
 * - class 23: CONSTRAINT_VIOLATION, class 42: SYNTAX_ERROR, class 22: TYPE_ERROR\n
 *
 * Subclasses add vendor codes via {@link #classifyVendorCode(int)}.\n
 */
public class SqlStateErrorClassifier implements ErrorClassifier {

  @Override
  public FailureClass classify(SQLException e) {
    FailureClass byCode = classifyVendorCode(e.getErrorCode());
    if (byCode != null) return byCode;
    FailureClass byState = classifySqlState(e.getSQLState());
    if (byState != null) return byState;
    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
      return FailureClass.CONNECTION_RESET;
    }
    // Drivers sometimes wrap the interesting failure.
    Throwable cause = e.getCause();
    if (cause instanceof SQLException inner && inner != e) return classify(inner);
    return FailureClass.OTHER;
  }

  /** {@code null} when the code carries no specific meaning for this backend. */
  protected FailureClass classifyVendorCode(int code) {
    return null;
  }

  protected FailureClass classifySqlState(String state) {
    if (state == null || state.length() < 2) return null;
    if (state.equals("40001") || state.equals("40P01")) return FailureClass.DEADLOCK;
    if (state.equals("HYT00") || state.equals("55P03")) return FailureClass.LOCK_TIMEOUT;
    return switch (state.substring(0, 2)) {
      case "08" -> FailureClass.CONNECTION_RESET;
      case "23" -> FailureClass.CONSTRAINT_VIOLATION;
      case "42" -> FailureClass.SYNTAX_ERROR;
      case "22" -> FailureClass.TYPE_ERROR;
      default -> null;
    };
  }
}
