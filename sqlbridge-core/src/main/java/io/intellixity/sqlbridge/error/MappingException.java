package io.intellixity.sqlbridge.error;

/** Row shape does not fit the target record: wrong arity or an incompatible cell. */
public final class MappingException extends SqlBridgeException {
  private final int index;
  private final int rowIndex;
  private final String detail;

  public MappingException(int index, String detail) {
    this(index, -1, detail, null);
  }

  public MappingException(int index, String detail, Throwable cause) {
    this(index, -1, detail, cause);
  }

  private MappingException(int index, int rowIndex, String detail, Throwable cause) {
    super(message(index, rowIndex, detail), cause);
    this.index = index;
    this.rowIndex = rowIndex;
    this.detail = detail;
  }

  /** 0-based field/column ordinal at which mapping failed, or -1 when no single column was at fault. */
  public int index() { return index; }

  /** 0-based row ordinal within the result, or -1 when mapping a standalone row. */
  public int rowIndex() { return rowIndex; }

  /** Same failure, annotated with the row it happened on. */
  public MappingException atRow(int row) {
    if (rowIndex == row) return this;
    return new MappingException(index, row, detail, getCause());
  }

  private static String message(int index, int rowIndex, String detail) {
    String column = (index < 0) ? "record construction" : "index " + index;
    String where = (rowIndex < 0) ? column : "row " + rowIndex + ", " + column;
    return "Mapping failed at " + where + ": " + detail;
  }
}
