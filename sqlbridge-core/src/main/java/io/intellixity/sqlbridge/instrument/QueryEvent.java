package io.intellixity.sqlbridge.instrument;

import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.exec.OperationKind;

import java.time.Duration;
import java.util.Objects;

/**
 * One completed attempt of one operation.\n
 *
 * {@code failureClass} is null on success, and also null for failures that never reached the
 * backend (e.g. pool timeouts). {@code attempt} is 1-based.\n
 */
public record QueryEvent(String database,
                         OperationKind operation,
                         BackendKind backend,
                         Duration duration,
                         boolean success,
                         int attempt,
                         FailureClass failureClass,
                         String statement) {
  public QueryEvent {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(duration, "duration");
    if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
  }
}
