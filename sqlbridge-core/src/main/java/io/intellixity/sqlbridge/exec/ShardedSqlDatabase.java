package io.intellixity.sqlbridge.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fixed set of databases holding disjoint partitions of the same schema.\n
 *
 * Shard selection is {@code floorMod(key, shardCount)}; the set never changes after construction.\n
 */
public final class ShardedSqlDatabase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ShardedSqlDatabase.class);

  private final List<SqlDatabase> shards;

  public ShardedSqlDatabase(List<? extends SqlDatabase> shards) {
    Objects.requireNonNull(shards, "shards");
    if (shards.isEmpty()) throw new IllegalArgumentException("at least one shard is required");
    this.shards = List.copyOf(shards);
    BackendKind kind = this.shards.get(0).backendKind();
    for (SqlDatabase s : this.shards) {
      if (s.backendKind() != kind) throw new IllegalArgumentException("all shards must use the same backend kind");
    }
  }

  public int shardCount() { return shards.size(); }

  public SqlDatabase shard(long key) {
    return shards.get((int) Math.floorMod(key, (long) shards.size()));
  }

  public SqlDatabase shardAt(int index) {
    return shards.get(index);
  }

  public List<SqlDatabase> all() { return shards; }

  @Override
  public void close() {
    RuntimeException first = null;
    for (SqlDatabase s : shards) {
      try {
        s.close();
      } catch (RuntimeException e) {
        log.warn("sqlbridge.shard_close_failed db={}", s.name(), e);
        if (first == null) first = e;
      }
    }
    if (first != null) throw first;
  }
}
