package io.intellixity.sqlbridge.instrument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/** Logs every attempt at DEBUG and slow ones at WARN. Statement text is only logged at TRACE. */
public final class LoggingQueryInstrumentation implements QueryInstrumentation {
  private static final Logger log = LoggerFactory.getLogger(LoggingQueryInstrumentation.class);

  private final Duration slowThreshold;

  public LoggingQueryInstrumentation(Duration slowThreshold) {
    this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold");
  }

  @Override
  public void record(QueryEvent e) {
    boolean slow = e.duration().compareTo(slowThreshold) >= 0;
    if (slow && log.isWarnEnabled()) {
      log.warn("sqlbridge.slow db={} op={} backend={} attempt={} success={} durationMs={}",
          e.database(), e.operation(), e.backend(), e.attempt(), e.success(), e.duration().toMillis());
    } else if (log.isDebugEnabled()) {
      log.debug("sqlbridge.attempt db={} op={} backend={} attempt={} success={} failure={} durationMs={}",
          e.database(), e.operation(), e.backend(), e.attempt(), e.success(), e.failureClass(),
          e.duration().toNanos() / 1_000_000.0);
    }
    if (log.isTraceEnabled() && e.statement() != null) {
      log.trace("sqlbridge.attempt db={} op={} sql={}", e.database(), e.operation(), e.statement());
    }
  }
}
