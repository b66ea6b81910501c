package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.config.PoolConfig;
import io.intellixity.sqlbridge.spi.backend.BackendSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bounded pool of sessions for a networked backend.\n
 *
 * - at most {@code maxConnections} sessions are live at once (leased, idle or being opened)\n
 * - sessions are opened lazily; released sessions go straight to the oldest live waiter\n
 * - idle sessions older than {@code healthCheckInterval} are validated before reuse\n
 * - broken leases are closed and their slot freed\n
 */
public final class BoundedConnectionPool implements ConnectionSource {
  private static final Logger log = LoggerFactory.getLogger(BoundedConnectionPool.class);
  private static final Duration MAX_VALIDATION_TIMEOUT = Duration.ofSeconds(5);

  private final String name;
  private final PoolConfig config;
  private final SessionFactory factory;
  private final Executor executor;
  private final Duration validationTimeout;

  // guarded by this
  private final Deque<Idle> idle = new ArrayDeque<>();
  private final Deque<CompletableFuture<ConnectionLease>> waiters = new ArrayDeque<>();
  private int open;
  private boolean closed;

  private record Idle(BackendSession session, long returnedAtNanos) {}

  public BoundedConnectionPool(String name, PoolConfig config, SessionFactory factory, Executor executor) {
    this.name = Objects.requireNonNull(name, "name");
    this.config = Objects.requireNonNull(config, "config");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.executor = Objects.requireNonNull(executor, "executor");
    Duration t = config.acquisitionTimeout();
    this.validationTimeout = t.compareTo(MAX_VALIDATION_TIMEOUT) < 0 ? t : MAX_VALIDATION_TIMEOUT;
  }

  @Override
  public String name() { return name; }

  @Override
  public CompletableFuture<ConnectionLease> acquire() {
    CompletableFuture<ConnectionLease> f = new CompletableFuture<>();
    Sources.armTimeout(f, name, config.acquisitionTimeout(), () -> forget(f));
    dispatch(f);
    return f;
  }

  private void dispatch(CompletableFuture<ConnectionLease> f) {
    Idle reuse;
    boolean rejected;
    synchronized (this) {
      if (f.isDone()) return;
      rejected = closed;
      reuse = rejected ? null : idle.pollFirst();
      if (!rejected && reuse == null) {
        if (open >= config.maxConnections()) {
          waiters.addLast(f);
          return;
        }
        open++;
      }
    }
    if (rejected) {
      f.completeExceptionally(closedException());
      return;
    }
    if (reuse != null) {
      handOut(reuse, f);
    } else {
      openFor(f);
    }
  }

  private void handOut(Idle e, CompletableFuture<ConnectionLease> f) {
    long idleNanos = System.nanoTime() - e.returnedAtNanos();
    if (idleNanos < config.healthCheckInterval().toNanos()) {
      grant(e.session(), f);
      return;
    }
    Sources.runOn(executor, () -> {
      if (e.session().isValid(validationTimeout)) {
        grant(e.session(), f);
        return;
      }
      log.debug("sqlbridge.pool op=discard pool={} session={} reason=validation", name, e.session().id());
      Sources.closeQuietly(e.session());
      synchronized (this) {
        open--;
      }
      dispatch(f);
    });
  }

  // Caller has reserved a slot in 'open'.
  private void openFor(CompletableFuture<ConnectionLease> f) {
    Runnable task = () -> {
      BackendSession s;
      long start = System.nanoTime();
      try {
        s = factory.open();
      } catch (Throwable t) {
        synchronized (this) {
          open--;
        }
        log.debug("sqlbridge.pool op=open_failed pool={} error={}", name, t.toString());
        f.completeExceptionally(t);
        serveWaiter();
        return;
      }
      if (log.isDebugEnabled()) {
        log.debug("sqlbridge.pool op=open pool={} session={} durationMs={}",
            name, s.id(), (System.nanoTime() - start) / 1_000_000);
      }
      grant(s, f);
    };
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      synchronized (this) {
        open--;
      }
      f.completeExceptionally(closedException());
    }
  }

  private void grant(BackendSession s, CompletableFuture<ConnectionLease> f) {
    ConnectionLease lease = new ConnectionLease(s, this::release);
    if (!f.complete(lease)) lease.release();
  }

  private void release(ConnectionLease lease) {
    BackendSession s = lease.session();
    if (lease.isBroken()) {
      log.debug("sqlbridge.pool op=discard pool={} session={} reason=broken", name, s.id());
      Sources.runOn(executor, () -> Sources.closeQuietly(s));
      synchronized (this) {
        open--;
      }
      serveWaiter();
      return;
    }
    while (true) {
      CompletableFuture<ConnectionLease> next;
      synchronized (this) {
        if (closed) {
          open--;
          next = null;
        } else {
          next = Sources.pollLive(waiters);
          if (next == null) {
            idle.addFirst(new Idle(s, System.nanoTime()));
            return;
          }
        }
      }
      if (next == null) {
        Sources.runOn(executor, () -> Sources.closeQuietly(s));
        return;
      }
      if (next.complete(new ConnectionLease(s, this::release))) return;
    }
  }

  // A slot was freed: open a session for the oldest waiter, if any.
  private void serveWaiter() {
    CompletableFuture<ConnectionLease> next;
    synchronized (this) {
      if (closed || open >= config.maxConnections()) return;
      next = Sources.pollLive(waiters);
      if (next == null) return;
      open++;
    }
    openFor(next);
  }

  private synchronized void forget(CompletableFuture<ConnectionLease> f) {
    waiters.remove(f);
  }

  private IllegalStateException closedException() {
    return new IllegalStateException("Connection pool " + name + " is closed");
  }

  @Override
  public synchronized int openCount() { return open; }

  @Override
  public synchronized int idleCount() { return idle.size(); }

  @Override
  public synchronized int pendingCount() {
    int n = 0;
    for (CompletableFuture<ConnectionLease> w : waiters) {
      if (!w.isDone()) n++;
    }
    return n;
  }

  @Override
  public void close() {
    List<Idle> toClose;
    List<CompletableFuture<ConnectionLease>> toFail;
    synchronized (this) {
      if (closed) return;
      closed = true;
      toClose = new ArrayList<>(idle);
      idle.clear();
      open -= toClose.size();
      toFail = new ArrayList<>(waiters);
      waiters.clear();
    }
    for (CompletableFuture<ConnectionLease> w : toFail) w.completeExceptionally(closedException());
    for (Idle e : toClose) Sources.runOn(executor, () -> Sources.closeQuietly(e.session()));
    log.debug("sqlbridge.pool op=close pool={} closedIdle={} failedWaiters={}", name, toClose.size(), toFail.size());
  }
}
