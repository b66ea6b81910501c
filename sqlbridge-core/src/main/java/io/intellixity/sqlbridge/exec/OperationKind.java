package io.intellixity.sqlbridge.exec;

public enum OperationKind {
  EXECUTE,
  QUERY,
  BEGIN,
  COMMIT,
  ROLLBACK
}
