package io.intellixity.sqlbridge.spi.sql;

/**
 * Lexical rules a backend applies to statement text.\n
 *
 * Only what matters for locating {@code ?} placeholders is modelled: quoting and comments.\n
 */
public enum StatementSyntax {
  /** Single/double quotes, {@code --} and block comments. */
  STANDARD(false, false, false, false),
  /** STANDARD plus backtick identifiers, {@code #} line comments and backslash escapes inside strings. */
  MYSQL(true, true, true, false),
  /** STANDARD plus backtick and {@code [bracket]} identifiers. */
  SQLITE(true, false, false, true);

  private final boolean backtickIdentifiers;
  private final boolean hashComments;
  private final boolean backslashEscapes;
  private final boolean bracketIdentifiers;

  StatementSyntax(boolean backtickIdentifiers, boolean hashComments, boolean backslashEscapes,
                  boolean bracketIdentifiers) {
    this.backtickIdentifiers = backtickIdentifiers;
    this.hashComments = hashComments;
    this.backslashEscapes = backslashEscapes;
    this.bracketIdentifiers = bracketIdentifiers;
  }

  public boolean backtickIdentifiers() { return backtickIdentifiers; }
  public boolean hashComments() { return hashComments; }
  public boolean backslashEscapes() { return backslashEscapes; }
  public boolean bracketIdentifiers() { return bracketIdentifiers; }
}
