package io.intellixity.sqlbridge.spi.pool;

import java.util.concurrent.CompletableFuture;

/**
 * Hands out leases on physical sessions for one backend target.\n
 *
 * {@link #acquire()} never blocks the caller: it returns a future that completes once a session is
 * free, or fails with {@link io.intellixity.sqlbridge.error.PoolTimeoutException} when the
 * acquisition timeout elapses first. Waiters are served in arrival order.\n
 */
public interface ConnectionSource extends AutoCloseable {
  String name();

  CompletableFuture<ConnectionLease> acquire();

  /** Live sessions, including leased ones and ones being opened. */
  int openCount();

  int idleCount();

  /** Callers currently waiting for a session. */
  int pendingCount();

  /** Fails pending waiters and closes idle sessions; leased sessions are closed on release. */
  @Override
  void close();
}
