package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.error.BackendException;
import io.intellixity.sqlbridge.error.ParameterCountException;
import io.intellixity.sqlbridge.error.SqlBridgeException;
import io.intellixity.sqlbridge.error.StatementTimeoutException;
import io.intellixity.sqlbridge.error.TransactionClosedException;
import io.intellixity.sqlbridge.error.TransactionRolledBackException;
import io.intellixity.sqlbridge.exec.OperationKind;
import io.intellixity.sqlbridge.exec.TransactionState;
import io.intellixity.sqlbridge.spi.pool.ConnectionLease;
import io.intellixity.sqlbridge.spi.sql.Placeholders;
import io.intellixity.sqlbridge.spi.sql.StatementSyntax;
import io.intellixity.sqlbridge.util.Futures;
import io.intellixity.sqlbridge.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * State and statement queue of one transaction.\n
 *
 * - statements, commit and rollback run strictly in issue order on the held lease\n
 * - a terminal backend error, a codec failure or a mapping failure leaves the transaction ACTIVE\n
 * - any other failure rolls the transaction back; the failing statement surfaces
 *   {@link TransactionRolledBackException} wrapping it\n
 * - the lease is released exactly once, when the state becomes terminal\n
 *
 * Never references its {@link DefaultSqlTransaction} facade, so the facade can become unreachable
 * and trigger the safety rollback in {@link #abandoned()}.\n
 */
final class TransactionCore {
  private static final Logger log = LoggerFactory.getLogger(TransactionCore.class);
  private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

  private final String id;
  private final OperationRunner runner;
  private final ConnectionLease lease;
  private final StatementSyntax syntax;
  private final Consumer<TransactionCore> onEnd;
  private final CompletableFuture<Void> finished = new CompletableFuture<>();

  private volatile TransactionState state = TransactionState.ACTIVE;
  private volatile Throwable abortCause;

  // guarded by this
  private CompletableFuture<Void> tail = DONE;
  private TransactionState ending;
  private CompletableFuture<Void> endFuture;

  TransactionCore(String id, OperationRunner runner, ConnectionLease lease, StatementSyntax syntax,
                  Consumer<TransactionCore> onEnd) {
    this.id = id;
    this.runner = runner;
    this.lease = lease;
    this.syntax = syntax;
    this.onEnd = onEnd;
  }

  String id() { return id; }

  TransactionState state() { return state; }

  /** Completes once the transaction is terminal and its lease has been released. */
  CompletableFuture<Void> finished() { return finished; }

  <R> CompletableFuture<R> submit(OperationKind op, String sql, List<Value> params, SessionCall<R> call) {
    CompletableFuture<R> res = new CompletableFuture<>();
    synchronized (this) {
      if (ending != null) return Futures.failed(new TransactionClosedException(ending));
      if (state != TransactionState.ACTIVE) return Futures.failed(closedFailure());
      try {
        Placeholders.check(sql, params, syntax);
      } catch (ParameterCountException e) {
        return Futures.failed(e);
      }
      tail = tail.thenCompose(x -> runStatement(op, sql, call, res))
          .exceptionally(t -> {
            res.completeExceptionally(Futures.unwrap(t));
            return null;
          });
    }
    return res;
  }

  private <R> CompletableFuture<Void> runStatement(OperationKind op, String sql, SessionCall<R> call,
                                                    CompletableFuture<R> res) {
    if (res.isDone()) return DONE;
    if (state != TransactionState.ACTIVE) {
      res.completeExceptionally(closedFailure());
      return DONE;
    }
    OperationRunner.Dispatch<R> d = runner.onLease(lease, op, sql, call);
    res.whenComplete((v, t) -> {
      if (res.isCancelled()) d.result().cancel(true);
    });
    CompletableFuture<Void> step = new CompletableFuture<>();
    d.result().whenComplete((v, t) -> {
      if (t == null) {
        res.complete(v);
        d.settled().whenComplete((x, y) -> step.complete(null));
        return;
      }
      Throwable failure = Futures.unwrap(t);
      if (leavesActive(failure)) {
        res.completeExceptionally(failure);
        d.settled().whenComplete((x, y) -> step.complete(null));
        return;
      }
      log.debug("sqlbridge.tx op=abort tx={} error={}", id, failure.toString());
      abortCause = failure;
      state = TransactionState.ROLLED_BACK;
      d.settled().thenCompose(x -> rollbackAndRelease()).whenComplete((x, y) -> {
        step.complete(null);
        res.completeExceptionally(new TransactionRolledBackException(failure));
      });
    });
    return step;
  }

  CompletableFuture<Void> commit() {
    CompletableFuture<Void> out = new CompletableFuture<>();
    synchronized (this) {
      if (ending != null) return Futures.failed(new TransactionClosedException(ending));
      if (state != TransactionState.ACTIVE) return Futures.failed(closedFailure());
      ending = TransactionState.COMMITTED;
      endFuture = out;
      tail = tail.thenCompose(x -> runCommit(out));
    }
    return out;
  }

  private CompletableFuture<Void> runCommit(CompletableFuture<Void> out) {
    if (state != TransactionState.ACTIVE) {
      out.completeExceptionally(closedFailure());
      return DONE;
    }
    OperationRunner.Dispatch<Void> d = runner.onLease(lease, OperationKind.COMMIT, null, s -> {
      s.commit();
      return null;
    });
    CompletableFuture<Void> step = new CompletableFuture<>();
    d.result().whenComplete((v, t) -> {
      if (t == null) {
        state = TransactionState.COMMITTED;
        log.debug("sqlbridge.tx op=commit tx={}", id);
        d.settled().whenComplete((x, y) -> {
          release();
          step.complete(null);
          out.complete(null);
        });
        return;
      }
      Throwable failure = Futures.unwrap(t);
      abortCause = failure;
      state = TransactionState.ROLLED_BACK;
      log.debug("sqlbridge.tx op=commit_failed tx={} error={}", id, failure.toString());
      d.settled().thenCompose(x -> rollbackAndRelease()).whenComplete((x, y) -> {
        step.complete(null);
        out.completeExceptionally(new TransactionRolledBackException(failure));
      });
    });
    return step;
  }

  CompletableFuture<Void> rollback() {
    synchronized (this) {
      if (state == TransactionState.ROLLED_BACK) return finished.copy();
      if (ending == TransactionState.ROLLED_BACK) return endFuture.copy();
      if (ending == TransactionState.COMMITTED) {
        // Only a failed commit may still be followed by a (no-op) rollback.
        return endFuture.handle((v, t) -> {
          if (state == TransactionState.ROLLED_BACK) return null;
          throw new TransactionClosedException(TransactionState.COMMITTED);
        });
      }
      CompletableFuture<Void> out = new CompletableFuture<>();
      ending = TransactionState.ROLLED_BACK;
      endFuture = out;
      tail = tail.thenCompose(x -> runRollback(out));
      return out.copy();
    }
  }

  private CompletableFuture<Void> runRollback(CompletableFuture<Void> out) {
    if (state != TransactionState.ACTIVE) {
      out.complete(null);
      return DONE;
    }
    state = TransactionState.ROLLED_BACK;
    return rollbackAndRelease().whenComplete((x, y) -> out.complete(null));
  }

  /** Roll back unless already ending; used by close(). */
  CompletableFuture<Void> rollbackIfActive() {
    synchronized (this) {
      if (ending != null || state != TransactionState.ACTIVE) return finished.copy();
    }
    return rollback();
  }

  /** Cleaner action: the facade became unreachable. */
  void abandoned() {
    synchronized (this) {
      if (ending != null || state != TransactionState.ACTIVE) return;
    }
    log.warn("sqlbridge.tx op=abandoned tx={} action=rollback", id);
    rollback();
  }

  // State is already ROLLED_BACK; the session is idle.
  private CompletableFuture<Void> rollbackAndRelease() {
    if (lease.isBroken()) {
      release();
      return DONE;
    }
    CompletableFuture<Void> done = new CompletableFuture<>();
    OperationRunner.Dispatch<Void> d = runner.onLease(lease, OperationKind.ROLLBACK, null, s -> {
      s.rollback();
      return null;
    });
    d.result().whenComplete((v, t) -> {
      if (t != null) {
        log.warn("sqlbridge.tx op=rollback_failed tx={} action=discard", id, Futures.unwrap(t));
        lease.markBroken();
      } else {
        log.debug("sqlbridge.tx op=rollback tx={}", id);
      }
      d.settled().whenComplete((x, y) -> {
        release();
        done.complete(null);
      });
    });
    return done;
  }

  private void release() {
    lease.release();
    try {
      onEnd.accept(this);
    } finally {
      finished.complete(null);
    }
  }

  // Cancellation, timeouts, retryable or connection-level errors and unexpected exceptions abort.
  private static boolean leavesActive(Throwable failure) {
    if (failure instanceof BackendException be) return !be.isRetryable() && !be.isConnectionLevel();
    return failure instanceof SqlBridgeException && !(failure instanceof StatementTimeoutException);
  }

  private RuntimeException closedFailure() {
    Throwable cause = abortCause;
    return cause != null ? new TransactionRolledBackException(cause) : new TransactionClosedException(state);
  }
}
