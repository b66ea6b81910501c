package io.intellixity.sqlbridge.error;

import java.time.Duration;

/** A statement exceeded the configured statement timeout and was cancelled; its connection was discarded. */
public final class StatementTimeoutException extends SqlBridgeException {
  private final String statement;
  private final Duration timeout;

  public StatementTimeoutException(String statement, Duration timeout) {
    super("Statement cancelled after " + timeout.toMillis() + "ms" + (statement == null ? "" : ": " + statement));
    this.statement = statement;
    this.timeout = timeout;
  }

  public String statement() { return statement; }
  public Duration timeout() { return timeout; }
}
