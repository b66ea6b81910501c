package io.intellixity.sqlbridge.error;

/**
 * The transaction was rolled back; nothing it issued was applied.
 * The caller must restart the whole transaction body.\n
 *
 * The cause is either a classified {@link BackendException} or the cancellation, timeout or
 * unexpected runtime failure that interrupted the statement.\n
 */
public final class TransactionRolledBackException extends SqlBridgeException {
  private final BackendException failure;

  public TransactionRolledBackException(BackendException failure) {
    super("Transaction rolled back: " + failure.getMessage(), failure);
    this.failure = failure;
  }

  public TransactionRolledBackException(Throwable cause) {
    super("Transaction rolled back: " + (cause instanceof BackendException ? cause.getMessage() : cause), cause);
    this.failure = (cause instanceof BackendException be) ? be : null;
  }

  /** The classified backend failure, or null when the rollback had another cause. */
  public BackendException failure() { return failure; }

  /** True if restarting the transaction body may succeed. */
  public boolean isRetryable() { return failure != null && failure.isRetryable(); }
}
