package sqlgate.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sqlgate.SqlGate;
import sqlgate.TxOptions;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSqlGateTest {
  private String url;
  private Map<String, Object> config;
  private SqlGate gate;

  @BeforeEach
  void setUp() throws SQLException {
    url = TestDatabases.newUrl("gate");
    config = Map.of("jdbc-url", url, "user", "sa", "password", "");
    gate = JdbcSqlGate.create();
    try (Connection conn = gate.resolveConnection(config)) {
      TestDatabases.createTestTable(conn);
    }
  }

  @Test
  void executeOnConfigurationReturnsRowsAndLeavesConnectionOpen() throws SQLException {
    assertEquals(List.of(Map.of("x", 42)), gate.execute(config, List.of("select cast(? as int) as x", 42)));

    Connection conn = gate.resolveConnection(config);
    try {
      assertFalse(conn.isClosed());
    } finally {
      conn.close();
    }
  }

  @Test
  void executeOneReturnsFirstRowOrNull() throws SQLException {
    try (Connection conn = gate.resolveConnection(config)) {
      gate.execute(conn, List.of("insert into test_data (id, val) values (1, 'a'), (2, 'b')"));

      assertEquals(Map.of("val", "a"), gate.executeOne(conn, List.of("select val from test_data order by id")));
      assertNull(gate.executeOne(conn, List.of("select val from test_data where id = ?", 99)));
    }
  }

  @Test
  void preparedStatementExecutesWithParams() throws SQLException {
    try (Connection conn = gate.resolveConnection(config)) {
      gate.execute(conn, List.of("insert into test_data (id, val) values (?, ?)", 5, "five"));

      try (PreparedStatement ps = gate.prepare(conn, List.of("select val from test_data where id = ?", 0))) {
        assertEquals(List.of(Map.of("val", "five")), gate.execute(conn, List.of(ps, 5)));
      }
    }
  }

  @Test
  void withTransactionCommitsAndClosesConnection() throws SQLException {
    Connection used = gate.withTransaction(config, conn -> {
      gate.execute(conn, List.of("insert into test_data (id, val) values (?, ?)", 1, "kept"));
      return conn;
    });

    assertTrue(used.isClosed());
    try (Connection conn = gate.resolveConnection(config)) {
      assertEquals(Map.of("val", "kept"), gate.executeOne(conn, List.of("select val from test_data")));
    }
  }

  @Test
  void rollbackOnlyReturnsResultButDiscardsWrites() throws SQLException {
    try (Connection conn = gate.resolveConnection(config)) {
      int isolationBefore = conn.getTransactionIsolation();
      String result = gate.transact(conn, c -> {
        gate.execute(c, List.of("insert into test_data (id, val) values (?, ?)", 1, "gone"));
        return "done";
      }, Map.of(TxOptions.ROLLBACK_ONLY, true, TxOptions.ISOLATION, "serializable"));

      assertEquals("done", result);
      assertNull(gate.executeOne(conn, List.of("select val from test_data")));
      assertTrue(conn.getAutoCommit());
      assertEquals(isolationBefore, conn.getTransactionIsolation());
    }
  }

  @Test
  void failureRollsBackAndRethrowsDriverError() throws SQLException {
    try (Connection conn = gate.resolveConnection(config)) {
      assertThrows(SQLException.class, () -> gate.transact(conn, c -> {
        gate.execute(c, List.of("insert into test_data (id, val) values (?, ?)", 1, "a"));
        assertTrue(gate.isInTransaction(c));
        return gate.execute(c, List.of("insert into test_data (id, val) values (?, ?)", 1, "dup"));
      }));

      assertFalse(gate.isInTransaction(conn));
      assertNull(gate.executeOne(conn, List.of("select val from test_data")));
    }
  }
}
