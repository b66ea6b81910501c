package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.config.RetryPolicy;
import io.intellixity.sqlbridge.error.AlreadyInTransactionException;
import io.intellixity.sqlbridge.error.ParameterCountException;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.exec.OperationKind;
import io.intellixity.sqlbridge.exec.ReadMode;
import io.intellixity.sqlbridge.exec.SqlConnection;
import io.intellixity.sqlbridge.exec.SqlTransaction;
import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.spi.pool.ConnectionLease;
import io.intellixity.sqlbridge.spi.pool.ConnectionSource;
import io.intellixity.sqlbridge.spi.sql.Placeholders;
import io.intellixity.sqlbridge.util.Futures;
import io.intellixity.sqlbridge.value.Value;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/** {@link SqlConnection} over a {@link PooledSqlDatabase}. */
final class DefaultSqlConnection implements SqlConnection {
  private static final AtomicLong SEQ = new AtomicLong();

  private final PooledSqlDatabase db;
  private final RetryPolicy policy;
  private final String id;

  // guarded by this
  private TransactionCore active;
  private boolean beginning;

  DefaultSqlConnection(PooledSqlDatabase db, RetryPolicy policy) {
    this.db = db;
    this.policy = Objects.requireNonNull(policy, "policy");
    this.id = db.name() + "#" + SEQ.incrementAndGet();
  }

  @Override
  public String id() { return id; }

  @Override
  public BackendKind backendKind() { return db.backendKind(); }

  @Override
  public RetryPolicy retryPolicy() { return policy; }

  @Override
  public SqlConnection withRetryPolicy(RetryPolicy policy) {
    return new DefaultSqlConnection(db, policy);
  }

  @Override
  public CompletableFuture<WriteResult> executeAsync(String sql, List<Value> params) {
    List<Value> p = Statements.params(params);
    try {
      Placeholders.check(sql, p, db.syntax());
    } catch (ParameterCountException e) {
      return Futures.failed(e);
    }
    ConnectionSource source = db.router().forWrite();
    return RetryRunner.run("execute", policy,
        n -> db.runner().attempt(source, OperationKind.EXECUTE, sql, s -> s.execute(sql, p), n),
        RetryRunner::isRetryableFailure);
  }

  @Override
  public CompletableFuture<QueryResult> queryAsync(ReadMode mode, String sql, List<Value> params) {
    List<Value> p = Statements.params(params);
    try {
      Placeholders.check(sql, p, db.syntax());
    } catch (ParameterCountException e) {
      return Futures.failed(e);
    }
    ConnectionSource source = db.router().forRead(mode == null ? ReadMode.REPLICA : mode);
    return RetryRunner.run("query", policy,
        n -> db.runner().attempt(source, OperationKind.QUERY, sql, s -> s.query(sql, p), n),
        RetryRunner::isRetryableFailure);
  }

  @Override
  public CompletableFuture<SqlTransaction> beginTransactionAsync() {
    synchronized (this) {
      if (beginning || active != null) return Futures.failed(new AlreadyInTransactionException(id));
      beginning = true;
    }
    ConnectionSource source = db.router().forTransaction();
    CompletableFuture<SqlTransaction> f = RetryRunner.run("begin", policy,
        n -> db.runner().begin(source, n).thenApply(this::started),
        RetryRunner::isRetryableFailure);
    f.whenComplete((tx, t) -> {
      if (t != null) {
        synchronized (this) {
          beginning = false;
        }
      }
    });
    return f;
  }

  private SqlTransaction started(ConnectionLease lease) {
    TransactionCore core = new TransactionCore(db.nextTransactionId(), db.runner(), lease, db.syntax(), this::ended);
    synchronized (this) {
      active = core;
      beginning = false;
    }
    return new DefaultSqlTransaction(core);
  }

  private synchronized void ended(TransactionCore core) {
    if (active == core) active = null;
  }

  @Override
  public synchronized boolean inTransaction() {
    return active != null;
  }

  @Override
  public String toString() {
    return "SqlConnection[" + id + "]";
  }
}
