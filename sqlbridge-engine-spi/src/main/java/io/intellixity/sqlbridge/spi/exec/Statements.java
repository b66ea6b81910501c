package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Argument normalisation shared by connections and transactions. */
final class Statements {
  private Statements() {}

  /** Immutable copy; a null list means no parameters and a null element means SQL NULL. */
  static List<Value> params(List<Value> params) {
    if (params == null || params.isEmpty()) return List.of();
    List<Value> out = new ArrayList<>(params.size());
    for (Value v : params) out.add(v == null ? Value.NULL : v);
    return Collections.unmodifiableList(out);
  }
}
