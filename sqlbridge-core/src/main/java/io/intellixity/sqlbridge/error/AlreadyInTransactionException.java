package io.intellixity.sqlbridge.error;

/** A transaction is already active on this connection. */
public final class AlreadyInTransactionException extends SqlBridgeException {
  public AlreadyInTransactionException(String connection) {
    super("Connection " + connection + " already has an active transaction");
  }
}
