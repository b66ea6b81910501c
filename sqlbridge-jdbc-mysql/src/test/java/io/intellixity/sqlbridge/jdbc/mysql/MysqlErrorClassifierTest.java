package io.intellixity.sqlbridge.jdbc.mysql;

import io.intellixity.sqlbridge.error.FailureClass;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

final class MysqlErrorClassifierTest {
  private final MysqlErrorClassifier classifier = new MysqlErrorClassifier();

  private FailureClass code(int vendorCode) {
    return classifier.classify(new SQLException("x", "HY000", vendorCode));
  }

  @Test
  void vendorCodes() {
    assertEquals(FailureClass.CONNECTION_RESET, code(2006));
    assertEquals(FailureClass.CONNECTION_RESET, code(2013));
    assertEquals(FailureClass.LOCK_TIMEOUT, code(1205));
    assertEquals(FailureClass.DEADLOCK, code(1213));
    assertEquals(FailureClass.CONSTRAINT_VIOLATION, code(1062));
    assertEquals(FailureClass.CONSTRAINT_VIOLATION, code(1452));
    assertEquals(FailureClass.SYNTAX_ERROR, code(1064));
    assertEquals(FailureClass.SYNTAX_ERROR, code(1146));
    assertEquals(FailureClass.TYPE_ERROR, code(1366));
    assertEquals(FailureClass.OTHER, code(1045));
  }

  @Test
  void communicationsFailureWithoutCodeFallsBackToSqlState() {
    assertEquals(FailureClass.CONNECTION_RESET, classifier.classify(new SQLException("link failure", "08S01", 0)));
  }

  @Test
  void retryabilityFollowsTheClass() {
    assertTrue(code(1213).isRetryable());
    assertTrue(code(2006).isConnectionLevel());
    assertFalse(code(1062).isRetryable());
  }
}
