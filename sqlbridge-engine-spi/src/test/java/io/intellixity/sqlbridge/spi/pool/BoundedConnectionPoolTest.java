package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.config.NetworkTarget;
import io.intellixity.sqlbridge.config.PoolConfig;
import io.intellixity.sqlbridge.error.PoolTimeoutException;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.spi.fake.FakeBackend;
import io.intellixity.sqlbridge.util.Futures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static io.intellixity.sqlbridge.spi.fake.Eventually.eventually;
import static org.junit.jupiter.api.Assertions.*;

final class BoundedConnectionPoolTest {
  private static final NetworkTarget TARGET = new NetworkTarget("db", 3306, "orders", "app", "pw");

  private final FakeBackend backend = new FakeBackend(BackendKind.NETWORKED);
  private BoundedConnectionPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) pool.close();
    backend.close();
  }

  private BoundedConnectionPool pool(PoolConfig config) {
    pool = new BoundedConnectionPool("test", config, () -> backend.open(TARGET), backend.executor());
    return pool;
  }

  private static PoolConfig config(int max, long timeoutMillis) {
    return PoolConfig.builder()
        .maxConnections(max)
        .acquisitionTimeout(Duration.ofMillis(timeoutMillis))
        .healthCheckInterval(Duration.ofMinutes(1))
        .build();
  }

  @Test
  void opensLazilyAndReusesReleasedSessions() {
    pool(config(4, 1000));
    assertEquals(0, pool.openCount());

    ConnectionLease a = Futures.join(pool.acquire());
    a.release();
    ConnectionLease b = Futures.join(pool.acquire());

    assertSame(a.session(), b.session());
    assertEquals(1, backend.opens.get());
    assertEquals(1, pool.openCount());
    b.release();
    assertEquals(1, pool.idleCount());
  }

  @Test
  void neverExceedsMaxConnections() {
    pool(config(2, 1000));
    ConnectionLease a = Futures.join(pool.acquire());
    ConnectionLease b = Futures.join(pool.acquire());
    CompletableFuture<ConnectionLease> c = pool.acquire();

    assertFalse(c.isDone());
    assertEquals(2, pool.openCount());
    assertEquals(1, pool.pendingCount());

    b.release();
    ConnectionLease handedOver = Futures.join(c);
    assertSame(b.session(), handedOver.session());
    assertEquals(2, backend.opens.get());
    a.release();
    handedOver.release();
  }

  @Test
  void waitersAreServedInArrivalOrder() {
    pool(config(1, 1000));
    ConnectionLease held = Futures.join(pool.acquire());
    CompletableFuture<ConnectionLease> first = pool.acquire();
    CompletableFuture<ConnectionLease> second = pool.acquire();

    held.release();
    assertTrue(first.isDone());
    assertFalse(second.isDone());
    Futures.join(first).release();
    Futures.join(second).release();
  }

  @Test
  void acquireFailsAfterTheTimeout() {
    pool(config(1, 50));
    ConnectionLease held = Futures.join(pool.acquire());

    PoolTimeoutException e = assertThrows(PoolTimeoutException.class, () -> Futures.join(pool.acquire()));

    assertEquals("test", e.source());
    assertEquals(0, pool.pendingCount());
    held.release();
    assertEquals(1, pool.idleCount());
  }

  @Test
  void releaseAfterAWaiterTimedOut_returnsTheSessionToIdle() {
    pool(config(1, 30));
    ConnectionLease held = Futures.join(pool.acquire());
    CompletableFuture<ConnectionLease> late = pool.acquire();
    assertThrows(PoolTimeoutException.class, () -> Futures.join(late));

    held.release();
    assertEquals(1, pool.idleCount());
    assertEquals(1, pool.openCount());
  }

  @Test
  void brokenLeaseIsClosedAndItsSlotFreed() {
    pool(config(1, 1000));
    ConnectionLease a = Futures.join(pool.acquire());
    CompletableFuture<ConnectionLease> waiting = pool.acquire();

    a.markBroken();
    a.release();

    ConnectionLease b = Futures.join(waiting);
    assertNotSame(a.session(), b.session());
    assertEquals(2, backend.opens.get());
    eventually("broken session closed", () -> backend.sessions.get(0).isClosed());
    b.release();
  }

  @Test
  void releaseIsIdempotent() {
    pool(config(1, 1000));
    ConnectionLease a = Futures.join(pool.acquire());
    a.release();
    a.release();
    assertEquals(1, pool.idleCount());
    assertEquals(1, pool.openCount());
  }

  @Test
  void staleIdleSessionsAreValidatedBeforeReuse() {
    pool(PoolConfig.builder().maxConnections(1).healthCheckInterval(Duration.ZERO).build());
    Futures.join(pool.acquire()).release();
    backend.invalidateSessions();

    ConnectionLease fresh = Futures.join(pool.acquire());

    assertEquals(2, backend.opens.get());
    assertEquals("fake-2", fresh.session().id());
    eventually("invalid session closed", () -> backend.sessions.get(0).isClosed());
    fresh.release();
  }

  @Test
  void openFailureIsReportedAndFreesTheSlot() {
    pool = new BoundedConnectionPool("failing", config(1, 1000), () -> {
      throw new SQLException("Communications link failure", "08S01", 0);
    }, backend.executor());

    SQLException e = assertThrows(SQLException.class, () -> {
      try {
        pool.acquire().get(5, TimeUnit.SECONDS);
      } catch (ExecutionException ee) {
        throw ee.getCause();
      }
    });
    assertEquals("08S01", e.getSQLState());
    assertEquals(0, pool.openCount());
  }

  @Test
  void closeFailsWaitersAndClosesIdleSessions() {
    pool(config(1, 1000));
    ConnectionLease held = Futures.join(pool.acquire());
    CompletableFuture<ConnectionLease> waiting = pool.acquire();

    pool.close();

    assertThrows(IllegalStateException.class, () -> Futures.join(waiting));
    assertThrows(IllegalStateException.class, () -> Futures.join(pool.acquire()));
    held.release();
    eventually("leased session closed on release", () -> backend.sessions.get(0).isClosed());
  }
}
