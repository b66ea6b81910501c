package io.intellixity.sqlbridge.exec;

import io.intellixity.sqlbridge.config.RetryPolicy;
import io.intellixity.sqlbridge.mapping.RowReader;
import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.util.Futures;
import io.intellixity.sqlbridge.value.Value;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Logical session against one {@link SqlDatabase}.\n
 *
 * Statements use positional {@code ?} placeholders and an ordered list of {@link Value}s.
 * Each call leases a physical connection for its duration only; {@link #beginTransactionAsync()}
 * keeps one leased until the transaction ends. At most one transaction may be active per
 * SqlConnection.\n
 *
 * Non-transactional calls are retried according to {@link #retryPolicy()}.
 */
public interface SqlConnection {
  String id();

  BackendKind backendKind();

  RetryPolicy retryPolicy();

  /** Same database, same routing, different retry policy. Transaction state is not shared. */
  SqlConnection withRetryPolicy(RetryPolicy policy);

  CompletableFuture<WriteResult> executeAsync(String sql, List<Value> params);

  CompletableFuture<QueryResult> queryAsync(ReadMode mode, String sql, List<Value> params);

  /** Fails with {@link io.intellixity.sqlbridge.error.AlreadyInTransactionException} if one is active. */
  CompletableFuture<SqlTransaction> beginTransactionAsync();

  /** True while a transaction begun on this connection is active. */
  boolean inTransaction();

  default CompletableFuture<QueryResult> queryAsync(String sql, List<Value> params) {
    return queryAsync(ReadMode.REPLICA, sql, params);
  }

  default CompletableFuture<WriteResult> executeAsync(String sql, Value... params) {
    return executeAsync(sql, Arrays.asList(params));
  }

  default CompletableFuture<QueryResult> queryAsync(String sql, Value... params) {
    return queryAsync(ReadMode.REPLICA, sql, Arrays.asList(params));
  }

  default <T> CompletableFuture<List<T>> queryAsync(String sql, RowReader<T> reader, Value... params) {
    return queryAsync(sql, params).thenApply(r -> r.map(reader));
  }

  default WriteResult execute(String sql, Value... params) {
    return Futures.join(executeAsync(sql, Arrays.asList(params)));
  }

  default QueryResult query(String sql, Value... params) {
    return Futures.join(queryAsync(ReadMode.REPLICA, sql, Arrays.asList(params)));
  }

  default QueryResult query(ReadMode mode, String sql, Value... params) {
    return Futures.join(queryAsync(mode, sql, Arrays.asList(params)));
  }

  default <T> List<T> query(String sql, RowReader<T> reader, Value... params) {
    return query(sql, params).map(reader);
  }

  default SqlTransaction beginTransaction() {
    return Futures.join(beginTransactionAsync());
  }
}
