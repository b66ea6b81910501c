package io.intellixity.sqlbridge.instrument;

import java.util.List;

/** Fans each event out to several sinks, in order. */
public final class CompositeQueryInstrumentation implements QueryInstrumentation {
  private final List<QueryInstrumentation> sinks;

  public CompositeQueryInstrumentation(List<QueryInstrumentation> sinks) {
    this.sinks = List.copyOf(sinks);
  }

  public static QueryInstrumentation of(QueryInstrumentation... sinks) {
    return new CompositeQueryInstrumentation(List.of(sinks));
  }

  @Override
  public void record(QueryEvent event) {
    for (QueryInstrumentation s : sinks) s.record(event);
  }
}
