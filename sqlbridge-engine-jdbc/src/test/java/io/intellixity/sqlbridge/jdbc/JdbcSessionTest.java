package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.result.QueryResult;
import io.intellixity.sqlbridge.result.WriteResult;
import io.intellixity.sqlbridge.value.ColumnType;
import io.intellixity.sqlbridge.value.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcSessionTest {
  private final String db = "session-" + UUID.randomUUID();
  private JdbcSession session;

  @BeforeEach
  void setUp() throws SQLException {
    session = open("s1");
    session.execute("CREATE TABLE items (id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR(64), "
        + "price DOUBLE, payload VARBINARY(16))", List.of());
  }

  @AfterEach
  void tearDown() {
    session.close();
  }

  private JdbcSession open(String id) throws SQLException {
    Connection c = DriverManager.getConnection(H2Backend.url(db), "sa", "");
    return new JdbcSession(id, c, new JdbcValueCodec());
  }

  @Test
  void insertReportsAffectedRowsAndGeneratedKey() throws SQLException {
    WriteResult first = session.execute("INSERT INTO items(name, price) VALUES (?, ?)",
        List.of(Value.of("apple"), Value.of(1.25)));
    WriteResult second = session.execute("INSERT INTO items(name, price) VALUES (?, ?)",
        List.of(Value.of("pear"), Value.NULL));

    assertEquals(1, first.affectedRows());
    assertTrue(first.lastInsertId().isPresent());
    assertEquals(first.lastInsertId().getAsLong() + 1, second.lastInsertId().getAsLong());

    WriteResult update = session.execute("UPDATE items SET price = ? WHERE price IS NULL", List.of(Value.of(2.0)));
    assertEquals(1, update.affectedRows());
    assertTrue(update.lastInsertId().isEmpty());
  }

  @Test
  void queryCarriesColumnsHintsAndDecodedCells() throws SQLException {
    byte[] payload = {0, 1, (byte) 0xFF};
    session.execute("INSERT INTO items(name, price, payload) VALUES (?, ?, ?)",
        List.of(Value.of("apple"), Value.of(1.25), Value.of(payload)));

    QueryResult r = session.query("SELECT id, name, price, payload FROM items WHERE name = ?", List.of(Value.of("apple")));

    assertEquals(4, r.columnCount());
    assertEquals(ColumnType.INTEGER, r.columns().get(0).declaredType());
    assertEquals(ColumnType.TEXT, r.columns().get(1).declaredType());
    assertEquals(ColumnType.REAL, r.columns().get(2).declaredType());
    assertEquals(ColumnType.BLOB, r.columns().get(3).declaredType());
    assertEquals(1, r.size());
    assertEquals(Value.of("apple"), r.row(0).get(1));
    assertEquals(Value.of(1.25), r.row(0).get(2));
    assertEquals(Value.of(payload), r.row(0).get(3));
  }

  @Test
  void emptyResultStillHasColumns() throws SQLException {
    QueryResult r = session.query("SELECT id, name FROM items", List.of());
    assertTrue(r.isEmpty());
    assertEquals(2, r.columnCount());
  }

  @Test
  void rollbackDiscardsWorkAndRestoresAutoCommit() throws SQLException {
    session.begin();
    session.execute("INSERT INTO items(name) VALUES (?)", List.of(Value.of("temp")));
    session.rollback();
    session.execute("INSERT INTO items(name) VALUES (?)", List.of(Value.of("kept")));

    JdbcSession other = open("s2");
    try {
      QueryResult r = other.query("SELECT name FROM items", List.of());
      assertEquals(1, r.size());
      assertEquals(Value.of("kept"), r.row(0).get(0));
    } finally {
      other.close();
    }
  }

  @Test
  void uncommittedRowsAreInvisibleElsewhere() throws SQLException {
    JdbcSession other = open("s2");
    try {
      session.begin();
      session.execute("INSERT INTO items(name) VALUES (?)", List.of(Value.of("pending")));
      assertEquals(0, other.query("SELECT name FROM items", List.of()).size());
      session.commit();
      assertEquals(1, other.query("SELECT name FROM items", List.of()).size());
    } finally {
      other.close();
    }
  }

  @Test
  void closedSessionIsInvalid() {
    assertTrue(session.isValid(Duration.ofSeconds(1)));
    session.close();
    assertFalse(session.isValid(Duration.ofSeconds(1)));
    session.cancel();
  }

  @Test
  void generatedKeysOnlyRequestedForInserts() {
    assertTrue(session.wantsGeneratedKeys("  insert into t values (1)"));
    assertTrue(session.wantsGeneratedKeys("REPLACE INTO t VALUES (1)"));
    assertFalse(session.wantsGeneratedKeys("UPDATE t SET a = 1"));
    assertFalse(session.wantsGeneratedKeys("CREATE TABLE inserts (a INT)"));
  }
}
