package sqlgate.spi;

import sqlgate.ExecuteOptions;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Execution primitives the dispatcher routes to.
 *
 * <p>Every method receives the merged {@link ExecuteOptions}; the positional
 * parameters are in {@link ExecuteOptions#params()}. When
 * {@link ExecuteOptions#firstRowOnly()} is set an implementation should fetch
 * at most one row rather than fetching all and truncating.
 *
 * @see sqlgate.jdbc.JdbcStatementExecutor
 */
public interface StatementExecutor {

  /** Compiles and runs SQL text. */
  List<Map<String, Object>> executeText(Connection connection, String sql, ExecuteOptions options)
      throws SQLException;

  /** Binds parameters to an already prepared statement and runs it. */
  List<Map<String, Object>> executeStatement(Connection connection, PreparedStatement statement,
      ExecuteOptions options) throws SQLException;

  /** Prepares SQL text for repeated execution on the same connection. */
  PreparedStatement prepare(Connection connection, String sql, ExecuteOptions options)
      throws SQLException;
}
