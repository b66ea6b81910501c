package io.intellixity.sqlbridge.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Bridging helpers between the asynchronous core and blocking callers. */
public final class Futures {
  private Futures() {}

  /**
   * Wait for {@code f} and return its value. Failures are rethrown unwrapped: the original
   * {@link RuntimeException} or {@link Error}, not a {@link CompletionException}.
   */
  public static <T> T join(CompletableFuture<T> f) {
    try {
      return f.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      f.cancel(true);
      throw new CancellationException("Interrupted while waiting for database operation");
    } catch (ExecutionException e) {
      throw rethrow(e.getCause());
    }
  }

  /** Strip {@link CompletionException}/{@link ExecutionException} layers. */
  public static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }

  public static <T> CompletableFuture<T> failed(Throwable t) {
    CompletableFuture<T> f = new CompletableFuture<>();
    f.completeExceptionally(t);
    return f;
  }

  private static RuntimeException rethrow(Throwable cause) {
    Throwable t = unwrap(cause);
    if (t instanceof RuntimeException re) return re;
    if (t instanceof Error err) throw err;
    return new CompletionException(t);
  }
}
