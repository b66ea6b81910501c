package io.intellixity.sqlbridge.spi.exec;

import io.intellixity.sqlbridge.config.RetryPolicy;
import io.intellixity.sqlbridge.error.BackendException;
import io.intellixity.sqlbridge.error.TransactionRolledBackException;
import io.intellixity.sqlbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Re-runs an asynchronous operation while it fails with a retryable error.\n
 *
 * - the delay after failed attempt {@code n} is uniform in {@code [0, policy.backoffCeilingMillis(n)]}\n
 * - every retry is logged at WARN with the attempt number and the chosen delay\n
 * - the surfaced failure carries the number of attempts made\n
 * - cancelling the returned future cancels the attempt in flight and stops further attempts\n
 */
final class RetryRunner {
  private static final Logger log = LoggerFactory.getLogger(RetryRunner.class);

  private RetryRunner() {}

  static <T> CompletableFuture<T> run(String what,
                                      RetryPolicy policy,
                                      IntFunction<CompletableFuture<T>> attempt,
                                      Predicate<Throwable> retryable) {
    Run<T> run = new Run<>(what, policy, attempt, retryable);
    run.attempt(1);
    return run.out;
  }

  /** Retries only backend failures classified as retryable. */
  static boolean isRetryableFailure(Throwable t) {
    if (t instanceof BackendException be) return be.isRetryable();
    if (t instanceof TransactionRolledBackException tr) return tr.isRetryable();
    return false;
  }

  /** Full-jitter delay after the given failed attempt (1-based). */
  static long delayMillis(RetryPolicy policy, int failedAttempt) {
    long ceiling = policy.backoffCeilingMillis(failedAttempt);
    return ceiling <= 0 ? 0 : ThreadLocalRandom.current().nextLong(ceiling + 1);
  }

  static Throwable withAttempts(Throwable t, int attempts) {
    if (t instanceof BackendException be) return be.withAttempts(attempts);
    if (t instanceof TransactionRolledBackException tr && tr.failure() != null) {
      return new TransactionRolledBackException(tr.failure().withAttempts(attempts));
    }
    return t;
  }

  private static final class Run<T> {
    private final String what;
    private final RetryPolicy policy;
    private final IntFunction<CompletableFuture<T>> attempt;
    private final Predicate<Throwable> retryable;
    private final CompletableFuture<T> out = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<T>> current = new AtomicReference<>();

    Run(String what, RetryPolicy policy, IntFunction<CompletableFuture<T>> attempt, Predicate<Throwable> retryable) {
      this.what = what;
      this.policy = Objects.requireNonNull(policy, "policy");
      this.attempt = attempt;
      this.retryable = retryable;
      out.whenComplete((v, t) -> {
        if (out.isCancelled()) {
          CompletableFuture<T> c = current.get();
          if (c != null) c.cancel(true);
        }
      });
    }

    void attempt(int n) {
      if (out.isDone()) return;
      CompletableFuture<T> f;
      try {
        f = attempt.apply(n);
      } catch (RuntimeException e) {
        f = Futures.failed(e);
      }
      current.set(f);
      if (out.isCancelled()) f.cancel(true);
      f.whenComplete((v, t) -> {
        if (t == null) {
          out.complete(v);
          return;
        }
        Throwable cause = Futures.unwrap(t);
        if (n < policy.maxAttempts() && !out.isDone() && retryable.test(cause)) {
          long delay = delayMillis(policy, n);
          log.warn("sqlbridge.retry op={} attempt={} maxAttempts={} delayMs={} error={}",
              what, n, policy.maxAttempts(), delay, cause.toString());
          if (delay == 0) {
            attempt(n + 1);
          } else {
            CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS).execute(() -> attempt(n + 1));
          }
        } else {
          out.completeExceptionally(withAttempts(cause, n));
        }
      });
    }
  }
}
