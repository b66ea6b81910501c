package io.intellixity.sqlbridge.instrument;

import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.exec.OperationKind;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters keyed by (operation, backend, outcome).\n
 *
 * Writes go to striped {@link LongAdder}s so concurrent recording does not contend; reads
 * ({@link #snapshot()}) sum the stripes and may miss attempts recorded concurrently.\n
 */
public final class AggregatingQueryInstrumentation implements QueryInstrumentation {
  private final Map<Key, Counters> counters = new ConcurrentHashMap<>();

  public record Key(OperationKind operation, BackendKind backend, boolean success) {}

  public record Stats(long count, Duration total, Duration max) {
    public Duration average() {
      return count == 0 ? Duration.ZERO : total.dividedBy(count);
    }
  }

  private static final class Counters {
    final LongAdder count = new LongAdder();
    final LongAdder totalNanos = new LongAdder();
    final LongAccumulator maxNanos = new LongAccumulator(Math::max, 0);
  }

  @Override
  public void record(QueryEvent e) {
    Counters c = counters.computeIfAbsent(new Key(e.operation(), e.backend(), e.success()), k -> new Counters());
    long nanos = e.duration().toNanos();
    c.count.increment();
    c.totalNanos.add(nanos);
    c.maxNanos.accumulate(nanos);
  }

  public Map<Key, Stats> snapshot() {
    Map<Key, Stats> out = new LinkedHashMap<>();
    counters.forEach((k, c) -> out.put(k, new Stats(
        c.count.sum(), Duration.ofNanos(c.totalNanos.sum()), Duration.ofNanos(c.maxNanos.get()))));
    return out;
  }

  /** Attempts recorded for {@code operation}, successful or not, on any backend. */
  public long attempts(OperationKind operation) {
    long n = 0;
    for (Map.Entry<Key, Counters> e : counters.entrySet()) {
      if (e.getKey().operation() == operation) n += e.getValue().count.sum();
    }
    return n;
  }

  public long count(OperationKind operation, boolean success) {
    long n = 0;
    for (Map.Entry<Key, Counters> e : counters.entrySet()) {
      if (e.getKey().operation() == operation && e.getKey().success() == success) n += e.getValue().count.sum();
    }
    return n;
  }

  public void reset() {
    counters.clear();
  }
}
