package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.config.FileTarget;
import io.intellixity.sqlbridge.config.PoolConfig;
import io.intellixity.sqlbridge.config.RetryPolicy;
import io.intellixity.sqlbridge.config.SqlConfig;
import io.intellixity.sqlbridge.error.BackendException;
import io.intellixity.sqlbridge.error.CodecException;
import io.intellixity.sqlbridge.error.FailureClass;
import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.error.ParameterCountException;
import io.intellixity.sqlbridge.exec.OperationKind;
import io.intellixity.sqlbridge.exec.SqlConnection;
import io.intellixity.sqlbridge.exec.SqlDatabase;
import io.intellixity.sqlbridge.exec.SqlTransaction;
import io.intellixity.sqlbridge.exec.TransactionState;
import io.intellixity.sqlbridge.instrument.AggregatingQueryInstrumentation;
import io.intellixity.sqlbridge.mapping.RecordRowReader;
import io.intellixity.sqlbridge.mapping.RowReaders;
import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.spi.exec.PooledSqlDatabase;
import io.intellixity.sqlbridge.value.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcDatabaseTest {
  record Account(long id, String owner, double balance, byte[] avatar) {}

  private final AggregatingQueryInstrumentation stats = new AggregatingQueryInstrumentation();
  private SqlDatabase db;
  private SqlConnection conn;

  @BeforeEach
  void setUp() {
    SqlConfig config = SqlConfig.of("accounts", "h2", FileTarget.inMemory("jdbc-db-" + UUID.randomUUID()))
        .withPool(PoolConfig.builder().maxConnections(3).acquisitionTimeout(Duration.ofSeconds(5)).build())
        .withRetry(RetryPolicy.of(3, Duration.ofMillis(1), Duration.ofMillis(5)))
        .withInitStatements(List.of("SET LOCK_TIMEOUT 2000"));
    db = new PooledSqlDatabase(config, new H2Backend(), stats);
    conn = db.connection();
    conn.execute("CREATE TABLE IF NOT EXISTS accounts (id BIGINT PRIMARY KEY, owner VARCHAR(64) NOT NULL, "
        + "balance DOUBLE, avatar VARBINARY(64))");
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  @Test
  void everyValueVariantRoundTrips() {
    byte[] avatar = {1, 2, 3};
    conn.execute("INSERT INTO accounts VALUES (?, ?, ?, ?)", Value.of(1), Value.of("ann"), Value.of(10.5), Value.of(avatar));
    conn.execute("INSERT INTO accounts VALUES (?, ?, ?, ?)", Value.of(2), Value.of("bob"), Value.NULL, Value.NULL);

    QueryResult r = conn.query("SELECT id, owner, balance, avatar FROM accounts ORDER BY id");

    assertEquals(List.of(Value.of(1), Value.of("ann"), Value.of(10.5), Value.of(avatar)), r.row(0).values());
    assertEquals(List.of(Value.of(2), Value.of("bob"), Value.NULL, Value.NULL), r.row(1).values());
  }

  @Test
  void rowsMapToRecords() {
    conn.execute("INSERT INTO accounts VALUES (?, ?, ?, ?)", Value.of(7), Value.of("cy"), Value.of(3.0), Value.of(new byte[0]));

    List<Account> accounts = conn.query("SELECT id, owner, balance, avatar FROM accounts", RecordRowReader.of(Account.class));
    long count = conn.query("SELECT COUNT(*) FROM accounts", RowReaders.single(Long.class)).get(0);

    assertEquals(1, accounts.size());
    assertEquals("cy", accounts.get(0).owner());
    assertEquals(1L, count);
  }

  @Test
  void constraintViolationIsTerminal() {
    conn.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("ann"));
    stats.reset();

    BackendException e = assertThrows(BackendException.class,
        () -> conn.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("dup")));

    assertEquals(FailureClass.CONSTRAINT_VIOLATION, e.failureClass());
    assertEquals(1, e.attempts());
    assertEquals(1, stats.attempts(OperationKind.EXECUTE));
  }

  @Test
  void syntaxErrorIsClassified() {
    BackendException e = assertThrows(BackendException.class, () -> conn.query("SELEC id FROM accounts"));
    assertEquals(FailureClass.SYNTAX_ERROR, e.failureClass());
  }

  @Test
  void parameterMismatchNeverReachesTheDriver() {
    stats.reset();
    assertThrows(ParameterCountException.class, () -> conn.query("SELECT id FROM accounts WHERE id = ?"));
    assertEquals(0, stats.attempts(OperationKind.QUERY));
  }

  @Test
  void committedTransactionIsVisible() {
    try (SqlTransaction tx = conn.beginTransaction()) {
      tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("ann"));
      assertEquals(0, db.connection().query("SELECT id FROM accounts").size());
      tx.commit();
      assertEquals(TransactionState.COMMITTED, tx.state());
    }
    assertEquals(1, conn.query("SELECT id FROM accounts").size());
  }

  @Test
  void transactionDroppedWithoutCommitIsRolledBack() {
    try (SqlTransaction tx = conn.beginTransaction()) {
      tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("ann"));
    }
    assertEquals(0, conn.query("SELECT id FROM accounts").size());
  }

  @Test
  void terminalErrorInsideTransactionKeepsItUsable() {
    try (SqlTransaction tx = conn.beginTransaction()) {
      tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("ann"));
      assertThrows(BackendException.class,
          () -> tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("dup")));
      assertEquals(TransactionState.ACTIVE, tx.state());
      tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(2), Value.of("bob"));
      tx.commit();
    }
    assertEquals(2, conn.query("SELECT id FROM accounts").size());
  }

  @Test
  void undecodableCellInsideTransactionKeepsItUsable() {
    try (SqlTransaction tx = conn.beginTransaction()) {
      tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("ann"));

      CodecException e = assertThrows(CodecException.class, () -> tx.query("SELECT ARRAY[1, 2]"));
      assertEquals(0, e.columnIndex());
      assertEquals(TransactionState.ACTIVE, tx.state());

      tx.commit();
      assertEquals(TransactionState.COMMITTED, tx.state());
    }
    assertEquals(1, conn.query("SELECT id FROM accounts").size());
  }

  @Test
  void unmappableRowInsideTransactionKeepsItUsable() {
    try (SqlTransaction tx = conn.beginTransaction()) {
      tx.execute("INSERT INTO accounts(id, owner) VALUES (?, ?)", Value.of(1), Value.of("ann"));

      assertThrows(MappingException.class, () -> tx.query("SELECT owner FROM accounts", RowReaders.single(Long.class)));
      assertEquals(TransactionState.ACTIVE, tx.state());

      tx.commit();
    }
    assertEquals(1, conn.query("SELECT id FROM accounts").size());
  }

  @Test
  void inTransactionCommitsTheBodyResult() {
    long total = db.inTransaction(tx -> {
      tx.execute("INSERT INTO accounts(id, owner, balance) VALUES (?, ?, ?)", Value.of(1), Value.of("a"), Value.of(5.0));
      tx.execute("INSERT INTO accounts(id, owner, balance) VALUES (?, ?, ?)", Value.of(2), Value.of("b"), Value.of(7.0));
      return tx.query("SELECT COUNT(*) FROM accounts", RowReaders.single(Long.class)).get(0);
    });

    assertEquals(2, total);
    assertEquals(2, conn.query("SELECT id FROM accounts").size());
  }
}
