package io.intellixity.sqlbridge.instrument;

/**
 * Telemetry sink for per-attempt outcomes.\n
 *
 * Called synchronously on the thread that completed the attempt, once per attempt (retries are
 * reported separately). Implementations must return quickly; anything they throw is logged and
 * ignored.\n
 */
@FunctionalInterface
public interface QueryInstrumentation {
  QueryInstrumentation NOOP = event -> {};

  void record(QueryEvent event);
}
