package sqlgate.exec;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sqlgate.ExecuteOptions;
import sqlgate.InvalidExpressionException;
import sqlgate.stub.CountingMetrics;
import sqlgate.stub.H2;
import sqlgate.stub.RecordingStatementExecutor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionDispatcherTest {
  private Connection connection;
  private RecordingStatementExecutor executor;
  private CountingMetrics metrics;
  private ExecutionDispatcher dispatcher;

  @BeforeEach
  void setUp() throws SQLException {
    connection = H2.newDataSource().getConnection();
    executor = new RecordingStatementExecutor();
    metrics = new CountingMetrics();
    dispatcher = new ExecutionDispatcher(executor, metrics);
  }

  @AfterEach
  void tearDown() throws SQLException {
    connection.close();
  }

  @Test
  void pathForText() {
    assertEquals(ExecutionPath.TEXT, ExecutionDispatcher.pathFor("select 1"));
    assertEquals(ExecutionPath.TEXT, ExecutionDispatcher.pathFor(new StringBuilder("select 1")));
  }

  @Test
  void pathForPreparedStatement() throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement("select 1")) {
      assertEquals(ExecutionPath.STATEMENT, ExecutionDispatcher.pathFor(ps));
    }
  }

  @Test
  void pathForRejectsOtherValues() {
    InvalidExpressionException ex = assertThrows(InvalidExpressionException.class,
        () -> ExecutionDispatcher.pathFor(42));
    assertEquals(42, ex.getExpression());
    assertThrows(InvalidExpressionException.class, () -> ExecutionDispatcher.pathFor(null));
  }

  @Test
  void textRunsThroughExecuteTextWithOrderedParams() throws SQLException {
    List<Map<String, Object>> rows = dispatcher.execute(connection,
        QueryExpression.of(List.of("select ? as x", 42, 43)), null);

    assertEquals(List.of("text:select ? as x"), executor.calls);
    assertEquals(List.of(42, 43), executor.options.get(0).params());
    assertSame(connection, executor.connections.get(0));
    assertEquals(2, rows.size());
    assertEquals(42, rows.get(0).get("x"));
    assertEquals(1, metrics.executions.get());
  }

  @Test
  void statementRunsThroughExecuteStatement() throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement("select ? as x")) {
      dispatcher.execute(connection, QueryExpression.of(ps, 7), Map.of());

      assertEquals(List.of("statement"), executor.calls);
      assertEquals(List.of(7), executor.options.get(0).params());
    }
  }

  @Test
  void invalidExecutableFailsWithoutCallingExecutor() {
    assertThrows(InvalidExpressionException.class,
        () -> dispatcher.execute(connection, QueryExpression.of(List.of(3.14, 1)), null));
    assertTrue(executor.calls.isEmpty());
  }

  @Test
  void executeOneSetsFirstRowOnly() throws SQLException {
    Map<String, Object> row = dispatcher.executeOne(connection,
        QueryExpression.of(List.of("select ? as x", 1, 2, 3)), null);

    assertTrue(executor.options.get(0).firstRowOnly());
    assertEquals(Map.of("x", 1), row);
  }

  @Test
  void executeOneReturnsNullWhenNoRows() throws SQLException {
    assertNull(dispatcher.executeOne(connection, QueryExpression.of(List.of("select 1 where 1 = 0")), null));
  }

  @Test
  void internalOptionsOverrideCallerOptions() throws SQLException {
    Map<String, Object> callerOptions = Map.of(
        ExecuteOptions.PARAMS, List.of("stale"),
        ExecuteOptions.FIRST_ROW_ONLY, false,
        ExecuteOptions.FETCH_SIZE, 50);

    dispatcher.executeOne(connection, QueryExpression.of(List.of("select ?", "fresh")), callerOptions);

    ExecuteOptions merged = executor.options.get(0);
    assertEquals(List.of("fresh"), merged.params());
    assertTrue(merged.firstRowOnly());
    assertEquals(50, merged.get(ExecuteOptions.FETCH_SIZE));
  }

  @Test
  void executeKeepsCallerFirstRowOnly() throws SQLException {
    dispatcher.execute(connection, QueryExpression.of(List.of("select ?", 1, 2)),
        Map.of(ExecuteOptions.FIRST_ROW_ONLY, true));

    assertTrue(executor.options.get(0).firstRowOnly());
  }

  @Test
  void nullParamsArePreserved() throws SQLException {
    dispatcher.execute(connection, QueryExpression.of(Arrays.asList("select ?, ?", null, 1)), null);

    assertEquals(Arrays.asList(null, 1), executor.options.get(0).params());
  }

  @Test
  void prepareRequiresText() throws SQLException {
    try (PreparedStatement ps = dispatcher.prepare(connection, QueryExpression.of(List.of("select ? as x", 42)), null)) {
      assertEquals(List.of("prepare:select ? as x"), executor.calls);
      assertEquals(List.of(42), executor.options.get(0).params());
    }
    try (PreparedStatement ps = connection.prepareStatement("select 1")) {
      assertThrows(InvalidExpressionException.class,
          () -> dispatcher.prepare(connection, QueryExpression.of(ps), null));
    }
  }
}
