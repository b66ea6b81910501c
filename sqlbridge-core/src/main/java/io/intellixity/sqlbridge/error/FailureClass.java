package io.intellixity.sqlbridge.error;

/**
 * Classification of a backend failure.\n
 *
 * Retryable classes are re-attempted for non-transactional operations; connection-level classes
 * additionally cause the physical connection to be discarded.\n
 */
public enum FailureClass {
  CONNECTION_RESET(true, true),
  LOCK_TIMEOUT(true, false),
  DEADLOCK(true, false),
  CONSTRAINT_VIOLATION(false, false),
  SYNTAX_ERROR(false, false),
  TYPE_ERROR(false, false),
  OTHER(false, false);

  private final boolean retryable;
  private final boolean connectionLevel;

  FailureClass(boolean retryable, boolean connectionLevel) {
    this.retryable = retryable;
    this.connectionLevel = connectionLevel;
  }

  public boolean isRetryable() { return retryable; }
  public boolean isConnectionLevel() { return connectionLevel; }
}
