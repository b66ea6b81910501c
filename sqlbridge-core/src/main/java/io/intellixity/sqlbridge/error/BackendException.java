package io.intellixity.sqlbridge.error;

import java.util.Objects;

/**
 * Failure reported by the backend engine, classified as retryable or terminal.\n
 *
 * {@link #attempts()} is the number of attempts made before the failure was surfaced.\n
 */
public final class BackendException extends SqlBridgeException {
  private final FailureClass failureClass;
  private final String statement;
  private final int attempts;
  private final int vendorCode;
  private final String sqlState;

  public BackendException(FailureClass failureClass, String statement, int vendorCode, String sqlState, Throwable cause) {
    this(failureClass, statement, 1, vendorCode, sqlState, cause);
  }

  private BackendException(FailureClass failureClass, String statement, int attempts, int vendorCode, String sqlState,
                           Throwable cause) {
    super(message(failureClass, statement, attempts, vendorCode, sqlState, cause), cause);
    this.failureClass = Objects.requireNonNull(failureClass, "failureClass");
    this.statement = statement;
    this.attempts = attempts;
    this.vendorCode = vendorCode;
    this.sqlState = sqlState;
  }

  public FailureClass failureClass() { return failureClass; }
  public boolean isRetryable() { return failureClass.isRetryable(); }
  public boolean isConnectionLevel() { return failureClass.isConnectionLevel(); }
  public String statement() { return statement; }
  public int attempts() { return attempts; }
  public int vendorCode() { return vendorCode; }
  public String sqlState() { return sqlState; }

  public BackendException withAttempts(int n) {
    if (n == attempts) return this;
    return new BackendException(failureClass, statement, n, vendorCode, sqlState, getCause());
  }

  private static String message(FailureClass fc, String statement, int attempts, int vendorCode, String sqlState,
                                Throwable cause) {
    StringBuilder sb = new StringBuilder();
    sb.append(fc).append(" (vendorCode=").append(vendorCode).append(", sqlState=").append(sqlState)
        .append(", attempts=").append(attempts).append(')');
    if (cause != null && cause.getMessage() != null) sb.append(": ").append(cause.getMessage());
    if (statement != null) sb.append(" [statement: ").append(statement).append(']');
    return sb.toString();
  }
}
