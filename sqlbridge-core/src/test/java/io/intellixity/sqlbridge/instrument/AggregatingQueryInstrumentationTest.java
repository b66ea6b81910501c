package io.intellixity.sqlbridge.instrument;

import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.exec.OperationKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

final class AggregatingQueryInstrumentationTest {

  private static QueryEvent event(OperationKind op, boolean ok, long millis) {
    return new QueryEvent("db", op, BackendKind.NETWORKED, Duration.ofMillis(millis), ok, 1,
        ok ? null : FailureClass.DEADLOCK, "SELECT 1");
  }

  @Test
  void aggregatesPerOperationAndOutcome() {
    AggregatingQueryInstrumentation agg = new AggregatingQueryInstrumentation();
    agg.record(event(OperationKind.QUERY, true, 10));
    agg.record(event(OperationKind.QUERY, true, 30));
    agg.record(event(OperationKind.QUERY, false, 5));
    agg.record(event(OperationKind.EXECUTE, true, 1));

    Map<AggregatingQueryInstrumentation.Key, AggregatingQueryInstrumentation.Stats> snap = agg.snapshot();
    AggregatingQueryInstrumentation.Stats ok =
        snap.get(new AggregatingQueryInstrumentation.Key(OperationKind.QUERY, BackendKind.NETWORKED, true));
    assertEquals(2, ok.count());
    assertEquals(Duration.ofMillis(40), ok.total());
    assertEquals(Duration.ofMillis(30), ok.max());
    assertEquals(Duration.ofMillis(20), ok.average());

    assertEquals(3, agg.attempts(OperationKind.QUERY));
    assertEquals(1, agg.count(OperationKind.QUERY, false));
    assertEquals(1, agg.attempts(OperationKind.EXECUTE));
    assertEquals(0, agg.attempts(OperationKind.COMMIT));
  }

  @Test
  void resetClearsCounters() {
    AggregatingQueryInstrumentation agg = new AggregatingQueryInstrumentation();
    agg.record(event(OperationKind.QUERY, true, 1));
    agg.reset();
    assertTrue(agg.snapshot().isEmpty());
  }

  @Test
  void concurrentRecordingLosesNothing() throws InterruptedException {
    AggregatingQueryInstrumentation agg = new AggregatingQueryInstrumentation();
    int threads = 8;
    int perThread = 1_000;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      Thread w = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < perThread; i++) agg.record(event(OperationKind.EXECUTE, i % 2 == 0, 1));
      });
      w.start();
      workers.add(w);
    }
    start.countDown();
    for (Thread w : workers) w.join();

    assertEquals((long) threads * perThread, agg.attempts(OperationKind.EXECUTE));
    assertEquals((long) threads * perThread / 2, agg.count(OperationKind.EXECUTE, true));
  }

  @Test
  void compositeFansOutInOrder() {
    List<String> seen = new ArrayList<>();
    QueryInstrumentation sink = CompositeQueryInstrumentation.of(
        e -> seen.add("a:" + e.operation()), e -> seen.add("b:" + e.operation()), QueryInstrumentation.NOOP,
        new LoggingQueryInstrumentation(Duration.ofSeconds(1)));
    sink.record(event(OperationKind.BEGIN, true, 1));
    assertEquals(List.of("a:BEGIN", "b:BEGIN"), seen);
  }

  @Test
  void eventRequiresAPositiveAttempt() {
    assertThrows(IllegalArgumentException.class, () -> new QueryEvent("db", OperationKind.QUERY, BackendKind.EMBEDDED,
        Duration.ZERO, true, 0, null, null));
  }
}
