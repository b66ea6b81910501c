package io.intellixity.sqlbridge.spi.pool;

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
 * One shared session handed out to one holder at a time, in arrival order.\n
 *
 * Used by embedded backends, whose single file handle must never be used concurrently. The handle
 * is opened on first use and reopened after a lease marked broken.\n
 */
public final class SerializedConnectionSource implements ConnectionSource {
  private static final Logger log = LoggerFactory.getLogger(SerializedConnectionSource.class);

  private final String name;
  private final Duration acquisitionTimeout;
  private final SessionFactory factory;
  private final Executor executor;

  // guarded by this
  private final Deque<CompletableFuture<ConnectionLease>> waiters = new ArrayDeque<>();
  private BackendSession session;
  private boolean held;
  private boolean closed;

  public SerializedConnectionSource(String name, Duration acquisitionTimeout, SessionFactory factory, Executor executor) {
    this.name = Objects.requireNonNull(name, "name");
    this.acquisitionTimeout = Objects.requireNonNull(acquisitionTimeout, "acquisitionTimeout");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public String name() { return name; }

  @Override
  public CompletableFuture<ConnectionLease> acquire() {
    CompletableFuture<ConnectionLease> f = new CompletableFuture<>();
    Sources.armTimeout(f, name, acquisitionTimeout, () -> forget(f));
    boolean rejected;
    synchronized (this) {
      rejected = closed;
      if (!rejected) {
        if (held) {
          waiters.addLast(f);
          return f;
        }
        held = true;
      }
    }
    if (rejected) {
      f.completeExceptionally(closedException());
    } else {
      grant(f);
    }
    return f;
  }

  // Caller owns the handle ('held' is true).
  private void grant(CompletableFuture<ConnectionLease> f) {
    BackendSession s;
    synchronized (this) {
      s = session;
    }
    if (s != null) {
      complete(s, f);
      return;
    }
    try {
      executor.execute(() -> {
        BackendSession opened;
        try {
          opened = factory.open();
        } catch (Throwable t) {
          log.debug("sqlbridge.pool op=open_failed pool={} error={}", name, t.toString());
          f.completeExceptionally(t);
          passOn();
          return;
        }
        log.debug("sqlbridge.pool op=open pool={} session={}", name, opened.id());
        synchronized (this) {
          session = opened;
        }
        complete(opened, f);
      });
    } catch (RejectedExecutionException e) {
      f.completeExceptionally(closedException());
      passOn();
    }
  }

  private void complete(BackendSession s, CompletableFuture<ConnectionLease> f) {
    ConnectionLease lease = new ConnectionLease(s, this::release);
    if (!f.complete(lease)) lease.release();
  }

  private void release(ConnectionLease lease) {
    BackendSession discard = null;
    synchronized (this) {
      if (lease.isBroken() || closed) {
        if (session == lease.session()) session = null;
        discard = lease.session();
      }
    }
    if (discard != null) {
      BackendSession s = discard;
      log.debug("sqlbridge.pool op=discard pool={} session={} reason={}", name, s.id(), closed() ? "closed" : "broken");
      Sources.runOn(executor, () -> Sources.closeQuietly(s));
    }
    passOn();
  }

  // Hand the handle to the next live waiter, or mark it free.
  private void passOn() {
    CompletableFuture<ConnectionLease> next;
    synchronized (this) {
      next = closed ? null : Sources.pollLive(waiters);
      if (next == null) {
        held = false;
        return;
      }
    }
    grant(next);
  }

  private synchronized void forget(CompletableFuture<ConnectionLease> f) {
    waiters.remove(f);
  }

  private synchronized boolean closed() { return closed; }

  private IllegalStateException closedException() {
    return new IllegalStateException("Connection source " + name + " is closed");
  }

  @Override
  public synchronized int openCount() { return session == null ? 0 : 1; }

  @Override
  public synchronized int idleCount() { return (session != null && !held) ? 1 : 0; }

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
    List<CompletableFuture<ConnectionLease>> toFail;
    BackendSession toClose = null;
    synchronized (this) {
      if (closed) return;
      closed = true;
      toFail = new ArrayList<>(waiters);
      waiters.clear();
      if (!held && session != null) {
        toClose = session;
        session = null;
      }
    }
    for (CompletableFuture<ConnectionLease> w : toFail) w.completeExceptionally(closedException());
    if (toClose != null) {
      BackendSession s = toClose;
      Sources.runOn(executor, () -> Sources.closeQuietly(s));
    }
    log.debug("sqlbridge.pool op=close pool={} failedWaiters={}", name, toFail.size());
  }
}
