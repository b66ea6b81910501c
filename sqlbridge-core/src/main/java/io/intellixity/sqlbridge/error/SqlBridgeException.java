package io.intellixity.sqlbridge.error;

/**
 * Root of every failure surfaced by this library.\n
 *
 * All subclasses are unchecked and carry structured context (statement, indexes, attempts)
 * rather than just a message.\n
 */
public abstract class SqlBridgeException extends RuntimeException {
  protected SqlBridgeException(String message) {
    super(message);
  }

  protected SqlBridgeException(String message, Throwable cause) {
    super(message, cause);
  }
}
