package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.config.FileTarget;
import io.intellixity.sqlbridge.error.PoolTimeoutException;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.spi.fake.FakeBackend;
import io.intellixity.sqlbridge.util.Futures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static io.intellixity.sqlbridge.spi.fake.Eventually.eventually;
import static org.junit.jupiter.api.Assertions.*;

final class SerializedConnectionSourceTest {
  private final FakeBackend backend = new FakeBackend(BackendKind.EMBEDDED);
  private SerializedConnectionSource source;

  @AfterEach
  void tearDown() {
    if (source != null) source.close();
    backend.close();
  }

  private SerializedConnectionSource source(Duration timeout) {
    FileTarget target = FileTarget.inMemory("serialized");
    source = new SerializedConnectionSource("local", timeout, () -> backend.open(target), backend.executor());
    return source;
  }

  @Test
  void oneHolderAtATime_sameHandleForEveryone() {
    source(Duration.ofSeconds(1));
    ConnectionLease a = Futures.join(source.acquire());
    CompletableFuture<ConnectionLease> b = source.acquire();
    CompletableFuture<ConnectionLease> c = source.acquire();

    assertFalse(b.isDone());
    assertEquals(2, source.pendingCount());

    a.release();
    ConnectionLease lb = Futures.join(b);
    assertFalse(c.isDone());
    lb.release();
    ConnectionLease lc = Futures.join(c);

    assertSame(a.session(), lc.session());
    assertEquals(1, backend.opens.get());
    lc.release();
    assertEquals(1, source.idleCount());
  }

  @Test
  void waiterTimesOutWhileTheHandleIsHeld() {
    source(Duration.ofMillis(50));
    ConnectionLease a = Futures.join(source.acquire());

    assertThrows(PoolTimeoutException.class, () -> Futures.join(source.acquire()));

    a.release();
    Futures.join(source.acquire()).release();
  }

  @Test
  void brokenHandleIsReopenedForTheNextHolder() {
    source(Duration.ofSeconds(1));
    ConnectionLease a = Futures.join(source.acquire());
    a.markBroken();
    a.release();

    ConnectionLease b = Futures.join(source.acquire());

    assertNotSame(a.session(), b.session());
    assertEquals(2, backend.opens.get());
    eventually("broken handle closed", () -> backend.sessions.get(0).isClosed());
    b.release();
  }

  @Test
  void closeFailsWaitersAndClosesTheHandleOnRelease() {
    source(Duration.ofSeconds(1));
    ConnectionLease a = Futures.join(source.acquire());
    CompletableFuture<ConnectionLease> waiting = source.acquire();

    source.close();

    assertThrows(IllegalStateException.class, () -> Futures.join(waiting));
    a.release();
    eventually("handle closed", () -> backend.sessions.get(0).isClosed());
    assertEquals(0, source.openCount());
  }
}
