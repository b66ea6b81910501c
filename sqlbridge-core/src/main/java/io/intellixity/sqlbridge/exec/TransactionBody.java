package io.intellixity.sqlbridge.exec;

/** Blocking unit of transactional work; runs on the calling thread. */
@FunctionalInterface
public interface TransactionBody<T> {
  T run(SqlTransaction tx);
}
