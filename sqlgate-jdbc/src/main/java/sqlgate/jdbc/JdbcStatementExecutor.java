package sqlgate.jdbc;

import sqlgate.ExecuteOptions;
import sqlgate.spi.StatementExecutor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link StatementExecutor} over plain JDBC.
 *
 * <p>Rows come back as insertion-ordered maps keyed by column label, lower-cased
 * unless configured otherwise. A statement that yields no result set returns a
 * single row {@code {update-count: n}}.
 *
 * <p>Recognized options: {@code params}, {@code first-row-only},
 * {@code fetch-size}, {@code max-rows}, {@code query-timeout} (seconds). Other
 * keys are ignored.
 */
public final class JdbcStatementExecutor implements StatementExecutor {
  public static final String UPDATE_COUNT = "update-count";

  private final boolean lowerCaseLabels;

  public JdbcStatementExecutor() {
    this(true);
  }

  public JdbcStatementExecutor(boolean lowerCaseLabels) {
    this.lowerCaseLabels = lowerCaseLabels;
  }

  @Override
  public List<Map<String, Object>> executeText(Connection connection, String sql, ExecuteOptions options)
      throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      applyOptions(ps, options);
      bindParams(ps, options.params());
      return run(ps, options);
    }
  }

  @Override
  public List<Map<String, Object>> executeStatement(Connection connection, PreparedStatement statement,
      ExecuteOptions options) throws SQLException {
    int previousMaxRows = statement.getMaxRows();
    int previousFetchSize = statement.getFetchSize();
    int previousQueryTimeout = statement.getQueryTimeout();
    try {
      statement.clearParameters();
      applyOptions(statement, options);
      bindParams(statement, options.params());
      return run(statement, options);
    } finally {
      statement.setMaxRows(previousMaxRows);
      statement.setFetchSize(previousFetchSize);
      statement.setQueryTimeout(previousQueryTimeout);
    }
  }

  @Override
  public PreparedStatement prepare(Connection connection, String sql, ExecuteOptions options)
      throws SQLException {
    // params are type hints only; JDBC drivers infer types at bind time
    PreparedStatement ps = connection.prepareStatement(sql);
    try {
      applyOptions(ps, options.with(ExecuteOptions.FIRST_ROW_ONLY, false));
    } catch (SQLException | RuntimeException e) {
      ps.close();
      throw e;
    }
    return ps;
  }

  private List<Map<String, Object>> run(PreparedStatement ps, ExecuteOptions options) throws SQLException {
    if (!ps.execute()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(UPDATE_COUNT, ps.getUpdateCount());
      return List.of(row);
    }
    try (ResultSet rs = ps.getResultSet()) {
      return readRows(rs, options.firstRowOnly());
    }
  }

  private List<Map<String, Object>> readRows(ResultSet rs, boolean firstRowOnly) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int columns = meta.getColumnCount();
    String[] labels = new String[columns];
    for (int i = 0; i < columns; i++) {
      String label = meta.getColumnLabel(i + 1);
      labels[i] = lowerCaseLabels ? label.toLowerCase(Locale.ROOT) : label;
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < columns; i++) {
        row.put(labels[i], rs.getObject(i + 1));
      }
      rows.add(row);
      if (firstRowOnly) {
        break;
      }
    }
    return rows;
  }

  private static void applyOptions(PreparedStatement ps, ExecuteOptions options) throws SQLException {
    if (options.firstRowOnly()) {
      ps.setMaxRows(1);
    } else if (options.contains(ExecuteOptions.MAX_ROWS)) {
      ps.setMaxRows(options.intOption(ExecuteOptions.MAX_ROWS, 0));
    }
    if (options.contains(ExecuteOptions.FETCH_SIZE)) {
      ps.setFetchSize(options.intOption(ExecuteOptions.FETCH_SIZE, 0));
    }
    if (options.contains(ExecuteOptions.QUERY_TIMEOUT)) {
      ps.setQueryTimeout(options.intOption(ExecuteOptions.QUERY_TIMEOUT, 0));
    }
  }

  static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object param = params.get(i);
      if (param instanceof Enum<?> e) {
        ps.setString(i + 1, e.name());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
