package io.intellixity.sqlbridge.result;

import java.util.OptionalLong;

/**
 * Outcome of a statement without a result set.\n
 *
 * {@code lastInsertId} is only present when the backend reported a generated key.\n
 */
public record WriteResult(long affectedRows, OptionalLong lastInsertId) {
  public WriteResult {
    if (affectedRows < 0) throw new IllegalArgumentException("affectedRows must be >= 0");
    lastInsertId = (lastInsertId == null) ? OptionalLong.empty() : lastInsertId;
  }

  public static WriteResult of(long affectedRows) {
    return new WriteResult(affectedRows, OptionalLong.empty());
  }

  public static WriteResult of(long affectedRows, long lastInsertId) {
    return new WriteResult(affectedRows, OptionalLong.of(lastInsertId));
  }
}
