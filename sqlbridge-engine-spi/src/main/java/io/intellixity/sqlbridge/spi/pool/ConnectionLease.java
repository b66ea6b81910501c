package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.spi.backend.BackendSession;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Exclusive, temporary use of one {@link BackendSession}.\n
 *
 * {@link #release()} hands the session back to its source exactly once; a lease marked broken is
 * discarded instead of being reused.\n
 */
public final class ConnectionLease {
  private final BackendSession session;
  private final Consumer<ConnectionLease> onRelease;
  private final AtomicBoolean released = new AtomicBoolean();
  private volatile boolean broken;

  public ConnectionLease(BackendSession session, Consumer<ConnectionLease> onRelease) {
    this.session = Objects.requireNonNull(session, "session");
    this.onRelease = Objects.requireNonNull(onRelease, "onRelease");
  }

  public BackendSession session() { return session; }

  public void markBroken() { broken = true; }

  public boolean isBroken() { return broken; }

  public boolean isReleased() { return released.get(); }

  /** Idempotent. */
  public void release() {
    if (released.compareAndSet(false, true)) onRelease.accept(this);
  }
}
