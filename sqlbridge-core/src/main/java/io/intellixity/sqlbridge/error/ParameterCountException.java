package io.intellixity.sqlbridge.error;

/** Placeholder count in the statement differs from the number of supplied parameters. */
public final class ParameterCountException extends SqlBridgeException {
  private final String statement;
  private final int expected;
  private final int actual;

  public ParameterCountException(String statement, int expected, int actual) {
    super("Statement expects " + expected + " parameter(s) but " + actual + " were supplied: " + statement);
    this.statement = statement;
    this.expected = expected;
    this.actual = actual;
  }

  public String statement() { return statement; }
  public int expected() { return expected; }
  public int actual() { return actual; }
}
