package io.intellixity.sqlbridge.exec;

import io.intellixity.sqlbridge.config.RetryPolicy;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for one configured backend (primary plus optional replica).\n
 *
 * Owns every physical connection; hands out {@link SqlConnection}s that lease them.\n
 */
public interface SqlDatabase extends AutoCloseable {
  String name();

  BackendKind backendKind();

  RetryPolicy defaultRetryPolicy();

  SqlConnection connection();

  default SqlConnection connection(RetryPolicy policy) {
    return connection().withRetryPolicy(policy);
  }

  /**
   * Run {@code body} in a fresh transaction and commit it. If the transaction is rolled back by a
   * retryable backend failure, the whole body is run again in a new transaction, up to
   * {@code policy.maxAttempts()}.
   */
  <T> CompletableFuture<T> inTransactionAsync(RetryPolicy policy, AsyncTransactionBody<T> body);

  /** Blocking counterpart of {@link #inTransactionAsync(RetryPolicy, AsyncTransactionBody)}. */
  <T> T inTransaction(RetryPolicy policy, TransactionBody<T> body);

  default <T> CompletableFuture<T> inTransactionAsync(AsyncTransactionBody<T> body) {
    return inTransactionAsync(defaultRetryPolicy(), body);
  }

  default <T> T inTransaction(TransactionBody<T> body) {
    return inTransaction(defaultRetryPolicy(), body);
  }

  /** Closes all physical connections and stops backend threads. */
  @Override
  void close();
}
