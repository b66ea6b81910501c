package io.intellixity.sqlbridge.error;

/** A backend cell could not be represented as a {@link io.intellixity.sqlbridge.value.Value}. */
public final class CodecException extends SqlBridgeException {
  private final int columnIndex;

  public CodecException(int columnIndex, String message) {
    super("column " + columnIndex + ": " + message);
    this.columnIndex = columnIndex;
  }

  public CodecException(int columnIndex, String message, Throwable cause) {
    super("column " + columnIndex + ": " + message, cause);
    this.columnIndex = columnIndex;
  }

  /** 0-based column ordinal, or -1 when the failure concerns a bind parameter. */
  public int columnIndex() { return columnIndex; }
}
