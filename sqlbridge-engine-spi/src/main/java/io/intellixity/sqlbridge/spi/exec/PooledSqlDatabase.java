package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.config.BackendTarget;
import io.intellixity.sqlbridge.config.PoolConfig;
import io.intellixity.sqlbridge.config.RetryPolicy;
import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.exec.AsyncTransactionBody;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.exec.SqlConnection;
import io.intellixity.sqlbridge.exec.SqlDatabase;
import io.intellixity.sqlbridge.exec.SqlTransaction;
import io.intellixity.sqlbridge.exec.TransactionBody;
import io.intellixity.sqlbridge.exec.TransactionState;
import io.intellixity.sqlbridge.instrument.QueryInstrumentation;
import io.intellixity.sqlbridge.spi.backend.BackendSession;
import io.intellixity.sqlbridge.spi.backend.BackendThreads;
import io.intellixity.sqlbridge.spi.backend.SqlBackend;
import io.intellixity.sqlbridge.spi.pool.BoundedConnectionPool;
import io.intellixity.sqlbridge.spi.pool.ConnectionRouter;
import io.intellixity.sqlbridge.spi.pool.ConnectionSource;
import io.intellixity.sqlbridge.spi.pool.SerializedConnectionSource;
import io.intellixity.sqlbridge.spi.pool.SessionFactory;
import io.intellixity.sqlbridge.spi.sql.StatementSyntax;
import io.intellixity.sqlbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link SqlDatabase} assembled from a {@link SqlBackend} and a {@link SqlConfig}.\n
 *
 * Connection sources per backend kind:\n
 * - NETWORKED: one {@link BoundedConnectionPool} per target\n
 * - EMBEDDED: one {@link SerializedConnectionSource} per target\n
 *
 * {@code initStatements} run on every freshly opened primary session.\n
 */
public final class PooledSqlDatabase implements SqlDatabase {
  private static final Logger log = LoggerFactory.getLogger(PooledSqlDatabase.class);

  private final SqlConfig config;
  private final SqlBackend backend;
  private final ConnectionRouter router;
  private final OperationRunner runner;
  private final AtomicLong txSeq = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();

  public PooledSqlDatabase(SqlConfig config, SqlBackend backend, QueryInstrumentation instrumentation) {
    this.config = Objects.requireNonNull(config, "config");
    this.backend = Objects.requireNonNull(backend, "backend");
    PoolConfig pool = config.pool();
    this.runner = new OperationRunner(config.name(), backend, pool.statementTimeout(), instrumentation);
    ConnectionSource primary = source(config.name() + "-primary", sessions(config.primary(), true));
    ConnectionSource replica = config.hasReplica()
        ? source(config.name() + "-replica", sessions(config.replica(), false))
        : null;
    this.router = new ConnectionRouter(primary, replica);
    log.debug("sqlbridge.db op=open db={} backend={} kind={} primary={} replica={} maxConnections={}",
        config.name(), backend.id(), backend.kind(), config.primary().describe(),
        config.hasReplica() ? config.replica().describe() : "-", pool.maxConnections());
  }

  private ConnectionSource source(String name, SessionFactory sessions) {
    PoolConfig pool = config.pool();
    if (backend.kind() == BackendKind.EMBEDDED) {
      return new SerializedConnectionSource(name, pool.acquisitionTimeout(), sessions, backend.executor());
    }
    return new BoundedConnectionPool(name, pool, sessions, backend.executor());
  }

  private SessionFactory sessions(BackendTarget target, boolean runInit) {
    List<String> init = runInit ? config.initStatements() : List.of();
    return () -> {
      BackendSession s = backend.open(target);
      try {
        for (String stmt : init) s.execute(stmt, List.of());
      } catch (SQLException | RuntimeException e) {
        s.close();
        throw e;
      }
      return s;
    };
  }

  @Override
  public String name() { return config.name(); }

  @Override
  public BackendKind backendKind() { return backend.kind(); }

  @Override
  public RetryPolicy defaultRetryPolicy() { return config.retry(); }

  public SqlConfig config() { return config; }

  @Override
  public SqlConnection connection() {
    ensureOpen();
    return new DefaultSqlConnection(this, config.retry());
  }

  @Override
  public <T> CompletableFuture<T> inTransactionAsync(RetryPolicy policy, AsyncTransactionBody<T> body) {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(body, "body");
    ensureOpen();
    return RetryRunner.run("transaction", policy, n -> transactionOnce(body), RetryRunner::isRetryableFailure);
  }

  private <T> CompletableFuture<T> transactionOnce(AsyncTransactionBody<T> body) {
    SqlConnection c = new DefaultSqlConnection(this, RetryPolicy.NONE);
    return c.beginTransactionAsync().thenCompose(tx -> {
      CompletableFuture<T> work;
      try {
        work = body.apply(tx);
        if (work == null) work = Futures.failed(new NullPointerException("transaction body returned null"));
      } catch (RuntimeException e) {
        work = Futures.failed(e);
      }
      return work.handle((v, t) -> {
        if (t != null) {
          Throwable failure = Futures.unwrap(t);
          return tx.rollbackAsync().handle((x, y) -> null).<T>thenCompose(x -> Futures.failed(failure));
        }
        if (tx.state() == TransactionState.ACTIVE) return tx.commitAsync().thenApply(x -> v);
        return CompletableFuture.completedFuture(v);
      }).thenCompose(f -> f);
    });
  }

  /**
   * Runs {@code body} on the calling thread. Must not be called from a backend thread: the body's
   * blocking calls would wait for work queued behind the caller itself.
   */
  @Override
  public <T> T inTransaction(RetryPolicy policy, TransactionBody<T> body) {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(body, "body");
    if (BackendThreads.isBackendThread()) {
      throw new IllegalStateException("Blocking transaction started on a backend thread; use inTransactionAsync");
    }
    ensureOpen();
    for (int attempt = 1; ; attempt++) {
      try {
        return transactionOnce(body);
      } catch (RuntimeException e) {
        if (attempt >= policy.maxAttempts() || !RetryRunner.isRetryableFailure(e)) {
          Throwable surfaced = RetryRunner.withAttempts(e, attempt);
          throw (surfaced instanceof RuntimeException re) ? re : e;
        }
        long delay = RetryRunner.delayMillis(policy, attempt);
        log.warn("sqlbridge.retry op=transaction attempt={} maxAttempts={} delayMs={} error={}",
            attempt, policy.maxAttempts(), delay, e.toString());
        sleep(delay);
      }
    }
  }

  private <T> T transactionOnce(TransactionBody<T> body) {
    SqlConnection c = new DefaultSqlConnection(this, RetryPolicy.NONE);
    try (SqlTransaction tx = c.beginTransaction()) {
      T v = body.run(tx);
      if (tx.state() == TransactionState.ACTIVE) tx.commit();
      return v;
    }
  }

  private static void sleep(long millis) {
    if (millis <= 0) return;
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while backing off before retrying a transaction");
    }
  }

  StatementSyntax syntax() { return backend.syntax(); }

  ConnectionRouter router() { return router; }

  OperationRunner runner() { return runner; }

  String nextTransactionId() {
    return config.name() + "-tx-" + txSeq.incrementAndGet();
  }

  private void ensureOpen() {
    if (closed.get()) throw new IllegalStateException("Database " + config.name() + " is closed");
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    try {
      router.close();
    } finally {
      backend.close();
      log.debug("sqlbridge.db op=close db={}", config.name());
    }
  }

  @Override
  public String toString() {
    return "SqlDatabase[" + config.name() + ", " + backend.id() + "]";
  }
}
