package io.intellixity.sqlbridge.exec;

import io.intellixity.sqlbridge.config.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class ShardedSqlDatabaseTest {

  private static final class StubDatabase implements SqlDatabase {
    final String name;
    final BackendKind kind;
    final boolean failOnClose;
    boolean closed;

    StubDatabase(String name, BackendKind kind, boolean failOnClose) {
      this.name = name;
      this.kind = kind;
      this.failOnClose = failOnClose;
    }

    @Override public String name() { return name; }
    @Override public BackendKind backendKind() { return kind; }
    @Override public RetryPolicy defaultRetryPolicy() { return RetryPolicy.NONE; }
    @Override public SqlConnection connection() { throw new UnsupportedOperationException(); }

    @Override
    public <T> CompletableFuture<T> inTransactionAsync(RetryPolicy policy, AsyncTransactionBody<T> body) {
      throw new UnsupportedOperationException();
    }

    @Override
    public <T> T inTransaction(RetryPolicy policy, TransactionBody<T> body) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void close() {
      closed = true;
      if (failOnClose) throw new IllegalStateException("close failed: " + name);
    }
  }

  private static StubDatabase shard(String name) {
    return new StubDatabase(name, BackendKind.NETWORKED, false);
  }

  @Test
  void keysMapByFloorMod() {
    ShardedSqlDatabase sharded = new ShardedSqlDatabase(List.of(shard("s0"), shard("s1"), shard("s2")));

    assertEquals("s1", sharded.shard(7).name());
    assertEquals("s2", sharded.shard(-1).name());
    assertEquals("s2", sharded.shard(Long.MIN_VALUE + 1).name());
    assertEquals(3, sharded.shardCount());
  }

  @Test
  void rejectsEmptyOrMixedSets() {
    assertThrows(IllegalArgumentException.class, () -> new ShardedSqlDatabase(List.of()));
    assertThrows(IllegalArgumentException.class, () -> new ShardedSqlDatabase(
        List.of(shard("a"), new StubDatabase("b", BackendKind.EMBEDDED, false))));
  }

  @Test
  void closeReachesEveryShardAndReportsTheFirstFailure() {
    StubDatabase a = new StubDatabase("a", BackendKind.NETWORKED, true);
    StubDatabase b = new StubDatabase("b", BackendKind.NETWORKED, true);
    StubDatabase c = shard("c");

    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> new ShardedSqlDatabase(List.of(a, b, c)).close());

    assertTrue(e.getMessage().endsWith("a"));
    assertTrue(a.closed && b.closed && c.closed);
  }
}
