package io.intellixity.sqlbridge.exec;

import java.util.concurrent.CompletableFuture;

/** Asynchronous unit of transactional work; must not block. */
@FunctionalInterface
public interface AsyncTransactionBody<T> {
  CompletableFuture<T> apply(SqlTransaction tx);
}
