package io.intellixity.sqlbridge.spi.sql;

import io.intellixity.sqlbridge.error.ParameterCountException;
import io.intellixity.sqlbridge.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * Counts positional {@code ?} placeholders in a statement.\n
 *
 * Purely lexical scanning:\n
 * - {@code ?} inside quoted strings or quoted identifiers is ignored\n
 * - {@code ?} inside {@code --} / {@code #} line comments and block comments is ignored\n
 * - doubled quote characters inside a quoted run are escapes, not terminators\n
 *
 * A numbered form such as {@code ?12} counts as one placeholder, the same as a bare {@code ?}.
 * Reusing a number is not detected, and named forms ({@code :name}, {@code @name}) count zero.\n
 */
public final class Placeholders {
  private Placeholders() {}

  public static int count(String sql, StatementSyntax syntax) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(syntax, "syntax");
    int n = 0;
    int len = sql.length();

    for (int i = 0; i < len; i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"' || (ch == '`' && syntax.backtickIdentifiers())) {
        i = skipQuoted(sql, i, ch, syntax.backslashEscapes() && ch != '`');
        continue;
      }
      if (ch == '[' && syntax.bracketIdentifiers()) {
        int end = sql.indexOf(']', i + 1);
        i = (end < 0) ? len : end;
        continue;
      }
      if (ch == '-' && i + 1 < len && sql.charAt(i + 1) == '-') {
        i = skipLine(sql, i);
        continue;
      }
      if (ch == '#' && syntax.hashComments()) {
        i = skipLine(sql, i);
        continue;
      }
      if (ch == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = (end < 0) ? len : end + 1;
        continue;
      }
      if (ch == '?') n++;
    }
    return n;
  }

  /** Throws {@link ParameterCountException} unless {@code params} matches the placeholder count. */
  public static void check(String sql, List<Value> params, StatementSyntax syntax) {
    int expected = count(sql, syntax);
    int actual = (params == null) ? 0 : params.size();
    if (expected != actual) throw new ParameterCountException(sql, expected, actual);
  }

  // Returns the index of the closing quote (or the end of input for an unterminated run).
  private static int skipQuoted(String sql, int open, char quote, boolean backslashEscapes) {
    int len = sql.length();
    for (int i = open + 1; i < len; i++) {
      char ch = sql.charAt(i);
      if (backslashEscapes && ch == '\\') {
        i++;
        continue;
      }
      if (ch == quote) {
        if (i + 1 < len && sql.charAt(i + 1) == quote) {
          i++;
          continue;
        }
        return i;
      }
    }
    return len;
  }

  private static int skipLine(String sql, int start) {
    int end = sql.indexOf('\n', start);
    return (end < 0) ? sql.length() : end;
  }
}
