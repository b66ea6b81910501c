package io.intellixity.sqlbridge.error;

import java.time.Duration;

/** No connection became available within the acquisition timeout. */
public final class PoolTimeoutException extends SqlBridgeException {
  private final String source;
  private final Duration timeout;

  public PoolTimeoutException(String source, Duration timeout) {
    super("Timed out after " + timeout.toMillis() + "ms acquiring a connection from " + source);
    this.source = source;
    this.timeout = timeout;
  }

  public String source() { return source; }
  public Duration timeout() { return timeout; }
}
