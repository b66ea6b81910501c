package io.intellixity.sqlbridge.error;

import io.intellixity.sqlbridge.exec.TransactionState;

/** Operation attempted on a transaction that already committed or rolled back. */
public final class TransactionClosedException extends SqlBridgeException {
  private final TransactionState state;

  public TransactionClosedException(TransactionState state) {
    super("Transaction is " + state);
    this.state = state;
  }

  public TransactionState state() { return state; }
}
