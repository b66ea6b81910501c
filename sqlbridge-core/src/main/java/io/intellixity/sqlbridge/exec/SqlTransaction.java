package io.intellixity.sqlbridge.exec;

import io.intellixity.sqlbridge.mapping.RowReader;
import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.util.Futures;
import io.intellixity.sqlbridge.value.Value;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * An open transaction holding exclusive use of one physical connection.\n
 *
 * Lifecycle: {@code ACTIVE -> COMMITTED | ROLLED_BACK}. Use with try-with-resources: {@link #close()}
 * rolls back if the transaction is still active. Statements are applied in issue order.\n
 *
 * Blocking methods must not be called from a callback running on a backend thread.
 */
public interface SqlTransaction extends AutoCloseable {
  String id();

  TransactionState state();

  CompletableFuture<WriteResult> executeAsync(String sql, List<Value> params);

  CompletableFuture<QueryResult> queryAsync(String sql, List<Value> params);

  /** Commit; on failure the transaction ends {@code ROLLED_BACK} and the future fails. */
  CompletableFuture<Void> commitAsync();

  /** Roll back; a second call is a no-op. */
  CompletableFuture<Void> rollbackAsync();

  default WriteResult execute(String sql, Value... params) {
    return Futures.join(executeAsync(sql, Arrays.asList(params)));
  }

  default QueryResult query(String sql, Value... params) {
    return Futures.join(queryAsync(sql, Arrays.asList(params)));
  }

  default <T> List<T> query(String sql, RowReader<T> reader, Value... params) {
    return query(sql, params).map(reader);
  }

  default void commit() {
    Futures.join(commitAsync());
  }

  default void rollback() {
    Futures.join(rollbackAsync());
  }

  /** Rolls back if still active; otherwise does nothing. */
  @Override
  void close();
}
