package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.config.BackendTarget;
import io.intellixity.sqlbridge.exec.BackendKind;
import io.intellixity.sqlbridge.spi.backend.BackendSession;
import io.intellixity.sqlbridge.spi.backend.ErrorClassifier;
import io.intellixity.sqlbridge.spi.backend.SqlBackend;
import io.intellixity.sqlbridge.spi.sql.StatementSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for JDBC-family backends.\n
 *
 * Subclasses decide how a {@link BackendTarget} becomes a {@link Connection}; sessions, binding,
 * decoding and thread ownership live here.\n
 */
public abstract class JdbcBackend implements SqlBackend {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackend.class);

  private final String id;
  private final BackendKind kind;
  private final StatementSyntax syntax;
  private final ErrorClassifier classifier;
  private final JdbcValueCodec codec;
  private final ExecutorService executor;
  private final AtomicInteger sessionSeq = new AtomicInteger();

  protected JdbcBackend(String id,
                        BackendKind kind,
                        StatementSyntax syntax,
                        ErrorClassifier classifier,
                        JdbcValueCodec codec,
                        ExecutorService executor) {
    this.id = Objects.requireNonNull(id, "id");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.syntax = Objects.requireNonNull(syntax, "syntax");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override public String id() { return id; }
  @Override public BackendKind kind() { return kind; }
  @Override public StatementSyntax syntax() { return syntax; }
  @Override public ErrorClassifier errorClassifier() { return classifier; }
  @Override public ExecutorService executor() { return executor; }

  public JdbcValueCodec codec() { return codec; }

  @Override
  public final BackendSession open(BackendTarget target) throws SQLException {
    long start = System.nanoTime();
    Connection c = connect(Objects.requireNonNull(target, "target"));
    try {
      c.setAutoCommit(true);
      BackendSession s = newSession(id + "-" + sessionSeq.incrementAndGet(), c);
      if (log.isDebugEnabled()) {
        log.debug("sqlbridge.jdbc op=connect backend={} target={} session={} durationMs={}",
            id, target.describe(), s.id(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return s;
    } catch (SQLException | RuntimeException e) {
      try {
        c.close();
      } catch (SQLException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }
  }

  /** Open a raw connection for {@code target}. Blocking. */
  protected abstract Connection connect(BackendTarget target) throws SQLException;

  protected JdbcSession newSession(String sessionId, Connection c) throws SQLException {
    return new JdbcSession(sessionId, c, codec);
  }

  @Override
  public void close() {
    executor.shutdown();
    log.debug("sqlbridge.jdbc op=shutdown backend={}", id);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id + ", " + kind + "]";
  }
}
