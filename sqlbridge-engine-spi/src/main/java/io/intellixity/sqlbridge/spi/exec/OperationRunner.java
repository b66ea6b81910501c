package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.error.BackendException;
import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.error.StatementTimeoutException;
import io.intellixity.sqlbridge.exec.OperationKind;
import io.intellixity.sqlbridge.instrument.QueryEvent;
import io.intellixity.sqlbridge.instrument.QueryInstrumentation;
import io.intellixity.sqlbridge.spi.backend.BackendSession;
import io.intellixity.sqlbridge.spi.backend.BackendThreads;
import io.intellixity.sqlbridge.spi.backend.SqlBackend;
import io.intellixity.sqlbridge.spi.pool.ConnectionLease;
import io.intellixity.sqlbridge.spi.pool.ConnectionSource;
import io.intellixity.sqlbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs single attempts of backend operations for one database.\n
 *
 * An attempt is: lease a session (unless one is already held), run the blocking call on the
 * backend executor, classify any failure, report one {@link QueryEvent}. Cancelling an attempt or
 * exceeding the statement timeout interrupts the backend call and marks the session broken.\n
 */
final class OperationRunner {
  private static final Logger log = LoggerFactory.getLogger(OperationRunner.class);

  private final String database;
  private final SqlBackend backend;
  private final Duration statementTimeout;
  private final QueryInstrumentation instrumentation;

  OperationRunner(String database, SqlBackend backend, Duration statementTimeout, QueryInstrumentation instrumentation) {
    this.database = Objects.requireNonNull(database, "database");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.statementTimeout = (statementTimeout == null) ? Duration.ZERO : statementTimeout;
    this.instrumentation = (instrumentation == null) ? QueryInstrumentation.NOOP : instrumentation;
  }

  SqlBackend backend() { return backend; }

  /**
   * In-flight backend call.\n
   *
   * {@code result} is what callers see; {@code settled} completes once the backend has actually
   * returned, which may be later than {@code result} after a cancellation.\n
   */
  record Dispatch<R>(CompletableFuture<R> result, CompletableFuture<Void> settled) {}

  /** One attempt on a fresh lease from {@code source}; the lease is released when the backend call settles. */
  <R> CompletableFuture<R> attempt(ConnectionSource source, OperationKind op, String sql, SessionCall<R> call, int attempt) {
    long start = System.nanoTime();
    CompletableFuture<R> out = new CompletableFuture<>();
    CompletableFuture<ConnectionLease> acquiring = source.acquire();
    out.whenComplete((v, t) -> {
      if (out.isCancelled()) acquiring.cancel(false);
    });
    acquiring.whenComplete((lease, acquireError) -> {
      if (acquireError != null) {
        Throwable failure = classify(Futures.unwrap(acquireError), sql);
        record(op, sql, start, failure, attempt);
        out.completeExceptionally(failure);
        return;
      }
      if (out.isDone()) {
        lease.release();
        return;
      }
      Dispatch<R> d = dispatch(lease, sql, call);
      d.settled().whenComplete((x, y) -> lease.release());
      out.whenComplete((v, t) -> {
        if (out.isCancelled()) d.result().cancel(true);
      });
      d.result().whenComplete((v, t) -> {
        Throwable failure = (t == null) ? null : Futures.unwrap(t);
        record(op, sql, start, failure, attempt);
        if (failure == null) {
          out.complete(v);
        } else {
          out.completeExceptionally(failure);
        }
      });
    });
    return out;
  }

  /** Lease a session from {@code source} and open a transaction on it. On success the lease stays held. */
  CompletableFuture<ConnectionLease> begin(ConnectionSource source, int attempt) {
    long start = System.nanoTime();
    CompletableFuture<ConnectionLease> out = new CompletableFuture<>();
    source.acquire().whenComplete((lease, acquireError) -> {
      if (acquireError != null) {
        Throwable failure = classify(Futures.unwrap(acquireError), null);
        record(OperationKind.BEGIN, null, start, failure, attempt);
        out.completeExceptionally(failure);
        return;
      }
      Dispatch<Void> d = dispatch(lease, null, s -> {
        s.begin();
        return null;
      });
      d.result().whenComplete((v, t) -> {
        Throwable failure = (t == null) ? null : Futures.unwrap(t);
        record(OperationKind.BEGIN, null, start, failure, attempt);
        if (failure == null && out.complete(lease)) return;
        if (failure == null) lease.markBroken();
        d.settled().whenComplete((x, y) -> lease.release());
        if (failure != null) out.completeExceptionally(failure);
      });
    });
    return out;
  }

  /** One call on a lease the caller already holds (transactions). Reported as attempt 1. */
  <R> Dispatch<R> onLease(ConnectionLease lease, OperationKind op, String sql, SessionCall<R> call) {
    long start = System.nanoTime();
    Dispatch<R> d = dispatch(lease, sql, call);
    d.result().whenComplete((v, t) -> record(op, sql, start, t == null ? null : Futures.unwrap(t), 1));
    return d;
  }

  private <R> Dispatch<R> dispatch(ConnectionLease lease, String sql, SessionCall<R> call) {
    CompletableFuture<R> result = new CompletableFuture<>();
    CompletableFuture<Void> settled = new CompletableFuture<>();
    BackendSession session = lease.session();

    Runnable task = () -> {
      if (result.isDone()) {
        settled.complete(null);
        return;
      }
      long start = System.nanoTime();
      R value = null;
      Throwable failure = null;
      try {
        value = call.call(session);
      } catch (SQLException e) {
        BackendException be = classify(e, sql);
        if (be.isConnectionLevel()) lease.markBroken();
        failure = be;
      } catch (Throwable t) {
        failure = t;
      }
      if (log.isDebugEnabled()) {
        log.debug("sqlbridge.exec db={} session={} durationMs={} ok={}",
            database, session.id(), (System.nanoTime() - start) / 1_000_000, failure == null);
      }
      settled.complete(null);
      if (failure == null) {
        result.complete(value);
      } else {
        result.completeExceptionally(failure);
      }
    };

    result.whenComplete((v, t) -> {
      if (t == null || settled.isDone()) return;
      Throwable c = Futures.unwrap(t);
      if (c instanceof CancellationException || c instanceof StatementTimeoutException) {
        log.debug("sqlbridge.exec op=cancel db={} session={} reason={}", database, session.id(), c.getClass().getSimpleName());
        lease.markBroken();
        session.cancel();
      }
    });

    if (!statementTimeout.isZero()) {
      ScheduledFuture<?> timer = BackendThreads.schedule(
          () -> result.completeExceptionally(new StatementTimeoutException(sql, statementTimeout)), statementTimeout);
      result.whenComplete((v, t) -> timer.cancel(false));
    }

    try {
      backend.executor().execute(task);
    } catch (RejectedExecutionException e) {
      settled.complete(null);
      result.completeExceptionally(new IllegalStateException("Database " + database + " is closed", e));
    }
    return new Dispatch<>(result, settled);
  }

  /** Map a backend-native failure; everything else passes through unchanged. */
  Throwable classify(Throwable t, String sql) {
    if (t instanceof SQLException e) return classify(e, sql);
    return t;
  }

  BackendException classify(SQLException e, String sql) {
    FailureClass fc;
    try {
      fc = backend.errorClassifier().classify(e);
    } catch (RuntimeException ce) {
      log.warn("sqlbridge.classifier_failed db={} vendorCode={}", database, e.getErrorCode(), ce);
      fc = FailureClass.OTHER;
    }
    return new BackendException(fc == null ? FailureClass.OTHER : fc, sql, e.getErrorCode(), e.getSQLState(), e);
  }

  private void record(OperationKind op, String sql, long startNanos, Throwable failure, int attempt) {
    FailureClass fc = (failure instanceof BackendException be) ? be.failureClass() : null;
    QueryEvent event = new QueryEvent(database, op, backend.kind(), Duration.ofNanos(System.nanoTime() - startNanos),
        failure == null, attempt, fc, sql);
    try {
      instrumentation.record(event);
    } catch (RuntimeException e) {
      log.warn("sqlbridge.instrumentation_failed db={} op={}", database, op, e);
    }
  }
}
