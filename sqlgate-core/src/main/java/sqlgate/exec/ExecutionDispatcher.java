package sqlgate.exec;

import sqlgate.ExecuteOptions;
import sqlgate.InvalidExpressionException;
import sqlgate.spi.MetricsExporter;
import sqlgate.spi.StatementExecutor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes a {@link QueryExpression} to the matching {@link StatementExecutor}
 * primitive.
 *
 * <p>SQL text goes to {@link StatementExecutor#executeText}, a
 * {@link PreparedStatement} to {@link StatementExecutor#executeStatement}.
 * Anything else is rejected with {@link InvalidExpressionException} before the
 * connection is touched.
 */
public final class ExecutionDispatcher {
  private static final Logger logger = Logger.getLogger(ExecutionDispatcher.class.getName());

  private final StatementExecutor executor;
  private final MetricsExporter metrics;

  public ExecutionDispatcher(StatementExecutor executor, MetricsExporter metrics) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * @throws InvalidExpressionException if {@code executable} is neither text
   *                                    nor a prepared statement
   */
  public static ExecutionPath pathFor(Object executable) {
    if (executable instanceof CharSequence) {
      return ExecutionPath.TEXT;
    }
    if (executable instanceof PreparedStatement) {
      return ExecutionPath.STATEMENT;
    }
    throw new InvalidExpressionException(executable);
  }

  /** Runs the expression and returns every row. */
  public List<Map<String, Object>> execute(Connection connection, QueryExpression expression,
      Map<String, ?> options) throws SQLException {
    return run(connection, expression, merge(options, expression, false));
  }

  /** Runs the expression asking the primitive for a single row. */
  public Map<String, Object> executeOne(Connection connection, QueryExpression expression,
      Map<String, ?> options) throws SQLException {
    List<Map<String, Object>> rows = run(connection, expression, merge(options, expression, true));
    return rows.isEmpty() ? null : rows.get(0);
  }

  /**
   * Prepares SQL text. The parameters are passed along as type hints and are
   * not bound.
   */
  public PreparedStatement prepare(Connection connection, QueryExpression expression,
      Map<String, ?> options) throws SQLException {
    Object executable = expression.executable();
    if (!(executable instanceof CharSequence sql)) {
      throw new InvalidExpressionException(executable);
    }
    return executor.prepare(connection, sql.toString(), merge(options, expression, false));
  }

  private List<Map<String, Object>> run(Connection connection, QueryExpression expression,
      ExecuteOptions options) throws SQLException {
    ExecutionPath path = pathFor(expression.executable());
    Objects.requireNonNull(connection, "connection");
    long start = System.nanoTime();
    try {
      return switch (path) {
        case TEXT -> executor.executeText(connection, expression.executable().toString(), options);
        case STATEMENT -> executor.executeStatement(connection,
            (PreparedStatement) expression.executable(), options);
      };
    } finally {
      long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
      metrics.recordExecutionMs(elapsedMs);
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, "Executed {0} via {1} in {2} ms",
            new Object[] {expression, path, elapsedMs});
      }
    }
  }

  static ExecuteOptions merge(Map<String, ?> options, QueryExpression expression, boolean firstRowOnly) {
    ExecuteOptions merged = ExecuteOptions.of(options).with(ExecuteOptions.PARAMS, expression.params());
    return firstRowOnly ? merged.with(ExecuteOptions.FIRST_ROW_ONLY, true) : merged;
  }
}
