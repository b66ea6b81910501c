package io.intellixity.sqlbridge.spi.pool;

import io.intellixity.sqlbridge.exec.ReadMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Chooses the connection source for an operation.\n
 *
 * - writes and transactions always use the primary\n
 * - reads use the replica when one is configured, unless the caller asks for {@link ReadMode#PRIMARY}\n
 */
public final class ConnectionRouter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRouter.class);

  private final ConnectionSource primary;
  private final ConnectionSource replica;

  /** {@code replica} may be null. */
  public ConnectionRouter(ConnectionSource primary, ConnectionSource replica) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.replica = replica;
  }

  public ConnectionSource primary() { return primary; }

  public boolean hasReplica() { return replica != null; }

  public ConnectionSource forWrite() { return primary; }

  public ConnectionSource forTransaction() { return primary; }

  public ConnectionSource forRead(ReadMode mode) {
    return (replica == null || mode == ReadMode.PRIMARY) ? primary : replica;
  }

  @Override
  public void close() {
    RuntimeException first = null;
    for (ConnectionSource s : replica == null ? new ConnectionSource[] {primary} : new ConnectionSource[] {replica, primary}) {
      try {
        s.close();
      } catch (RuntimeException e) {
        log.warn("sqlbridge.pool op=close_failed pool={}", s.name(), e);
        if (first == null) first = e;
      }
    }
    if (first != null) throw first;
  }
}
