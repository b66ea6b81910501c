package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.exec.OperationKind;
import io.intellixity.sqlbridge.exec.SqlTransaction;
import io.intellixity.sqlbridge.exec.TransactionState;
import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.spi.backend.BackendThreads;
import io.intellixity.sqlbridge.util.Futures;
import io.intellixity.sqlbridge.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing handle of a {@link TransactionCore}.\n
 *
 * If the handle becomes unreachable while the transaction is still active, the transaction is
 * rolled back and its connection released.\n
 */
final class DefaultSqlTransaction implements SqlTransaction {
  private static final Logger log = LoggerFactory.getLogger(DefaultSqlTransaction.class);
  private static final Cleaner CLEANER = Cleaner.create();

  private final TransactionCore core;
  private final Cleaner.Cleanable cleanable;

  DefaultSqlTransaction(TransactionCore core) {
    this.core = core;
    this.cleanable = CLEANER.register(this, core::abandoned);
  }

  @Override
  public String id() { return core.id(); }

  @Override
  public TransactionState state() { return core.state(); }

  @Override
  public CompletableFuture<WriteResult> executeAsync(String sql, List<Value> params) {
    List<Value> p = Statements.params(params);
    return core.submit(OperationKind.EXECUTE, sql, p, s -> s.execute(sql, p));
  }

  @Override
  public CompletableFuture<QueryResult> queryAsync(String sql, List<Value> params) {
    List<Value> p = Statements.params(params);
    return core.submit(OperationKind.QUERY, sql, p, s -> s.query(sql, p));
  }

  @Override
  public CompletableFuture<Void> commitAsync() {
    return core.commit();
  }

  @Override
  public CompletableFuture<Void> rollbackAsync() {
    return core.rollback();
  }

  /**
   * Rolls back if still active and waits until the connection is released.\n
   * On a backend thread the rollback is started but not awaited.\n
   */
  @Override
  public void close() {
    CompletableFuture<Void> done = core.rollbackIfActive();
    cleanable.clean();
    if (BackendThreads.isBackendThread()) return;
    try {
      Futures.join(done);
    } catch (RuntimeException e) {
      log.warn("sqlbridge.tx op=close_failed tx={}", core.id(), e);
    }
  }

  @Override
  public String toString() {
    return "SqlTransaction[" + core.id() + ", " + core.state() + "]";
  }
}
