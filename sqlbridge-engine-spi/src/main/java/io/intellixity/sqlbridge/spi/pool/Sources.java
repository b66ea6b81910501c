package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.error.PoolTimeoutException;
import io.intellixity.sqlbridge.spi.backend.BackendSession;
import io.intellixity.sqlbridge.spi.backend.BackendThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/** Helpers shared by the connection sources. */
final class Sources {
  private static final Logger log = LoggerFactory.getLogger(Sources.class);

  private Sources() {}

  /** Fail {@code f} with a pool timeout unless it completes first; {@code onDone} runs on any completion. */
  static void armTimeout(CompletableFuture<ConnectionLease> f, String source, Duration timeout, Runnable onDone) {
    ScheduledFuture<?> timer = BackendThreads.schedule(() -> {
      if (f.completeExceptionally(new PoolTimeoutException(source, timeout))) {
        log.debug("sqlbridge.pool op=acquire_timeout pool={} timeoutMs={}", source, timeout.toMillis());
      }
    }, timeout);
    f.whenComplete((l, t) -> {
      timer.cancel(false);
      onDone.run();
    });
  }

  /** First waiter that nobody has completed or cancelled yet. Caller holds the source's lock. */
  static CompletableFuture<ConnectionLease> pollLive(Deque<CompletableFuture<ConnectionLease>> waiters) {
    CompletableFuture<ConnectionLease> f;
    while ((f = waiters.pollFirst()) != null) {
      if (!f.isDone()) return f;
    }
    return null;
  }

  /** Run {@code task} on {@code executor}, or inline when the executor is already shut down. */
  static void runOn(Executor executor, Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      task.run();
    }
  }

  static void closeQuietly(BackendSession session) {
    try {
      session.close();
    } catch (RuntimeException e) {
      log.warn("sqlbridge.pool op=close_failed session={}", session.id(), e);
    }
  }
}
