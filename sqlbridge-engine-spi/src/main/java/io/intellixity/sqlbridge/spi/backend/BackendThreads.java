package io.intellixity.sqlbridge.spi.backend;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread plumbing shared by backends.\n
 *
 * Threads created here are recognisable via {@link #isBackendThread()}, which lets blocking entry
 * points refuse to wait on work that would have to run on the very thread doing the waiting.\n
 */
public final class BackendThreads {
  private static final ScheduledExecutorService TIMER = createTimer();

  private BackendThreads() {}

  /** Single-thread executor for an embedded backend. */
  public static ExecutorService dedicated(String name) {
    return Executors.newSingleThreadExecutor(factory(name));
  }

  /** Fixed worker pool for a networked backend. */
  public static ExecutorService workers(String name, int threads) {
    return Executors.newFixedThreadPool(threads, factory(name));
  }

  public static ThreadFactory factory(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new BackendThread(r, prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /** True when called from a thread created by {@link #factory(String)}. */
  public static boolean isBackendThread() {
    return Thread.currentThread() instanceof BackendThread;
  }

  /**
   * Run {@code action} on the common pool after {@code delay}.\n
   *
   * The timer thread itself only hands off, so a slow callback chained onto a timed-out future
   * cannot hold up other timeouts.\n
   */
  public static ScheduledFuture<?> schedule(Runnable action, Duration delay) {
    return TIMER.schedule(() -> ForkJoinPool.commonPool().execute(action), delay.toNanos(), TimeUnit.NANOSECONDS);
  }

  private static ScheduledExecutorService createTimer() {
    ScheduledThreadPoolExecutor t = new ScheduledThreadPoolExecutor(1, r -> {
      Thread th = new Thread(r, "sqlbridge-timer");
      th.setDaemon(true);
      return th;
    });
    t.setRemoveOnCancelPolicy(true);
    return t;
  }

  private static final class BackendThread extends Thread {
    BackendThread(Runnable r, String name) {
      super(r, name);
    }
  }
}
