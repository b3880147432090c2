package sqlgate;

import sqlgate.exec.ExecutionDispatcher;
import sqlgate.exec.QueryExpression;
import sqlgate.source.ConnectionScope;
import sqlgate.source.SourceResolver;
import sqlgate.spi.ConnectionCallback;
import sqlgate.spi.Connector;
import sqlgate.spi.MetricsExporter;
import sqlgate.spi.StatementExecutor;
import sqlgate.spi.TransactionControl;
import sqlgate.tx.TransactionCoordinator;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for running SQL against a connection source.
 *
 * <p>Every operation takes a <em>source</em>: a live {@link Connection}, a
 * {@link sqlgate.spi.ConnectionPool}, or a configuration ({@link ConnectionConfig}
 * or a {@code Map} with the same keys). What happens to the connection depends
 * on the operation:
 * <ul>
 *   <li>{@link #execute}, {@link #executeOne}, {@link #prepare} and
 *       {@link #transact} resolve the source and leave the connection with
 *       the caller. For a pool or a configuration that means the caller must
 *       return or close it.</li>
 *   <li>{@link #withConnection} and {@link #withTransaction} release what they
 *       acquired on every exit path.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SqlGate gate = JdbcSqlGate.create();
 * long id = gate.withTransaction(pool, Map.of(TxOptions.ISOLATION, "serializable"), conn -> {
 *   gate.execute(conn, List.of("insert into account (id, owner) values (?, ?)", 7L, "ada"));
 *   return 7L;
 * });
 * }</pre>
 *
 * <p>Driver failures and exceptions thrown by caller code propagate unchanged.
 */
public final class SqlGate {
  private final SourceResolver resolver;
  private final ConnectionScope scope;
  private final ExecutionDispatcher dispatcher;
  private final TransactionCoordinator coordinator;

  private SqlGate(Builder builder) {
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.resolver = new SourceResolver(Objects.requireNonNull(builder.connector, "connector"), metrics);
    this.scope = new ConnectionScope(resolver);
    this.dispatcher = new ExecutionDispatcher(
        Objects.requireNonNull(builder.statementExecutor, "statementExecutor"), metrics);
    this.coordinator = new TransactionCoordinator(resolver, scope,
        Objects.requireNonNull(builder.transactionControl, "transactionControl"), metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a connection for {@code source}. A pool is borrowed from and a
   * configuration is opened; the caller releases the result.
   *
   * @throws NullSourceException        if {@code source} is {@code null}
   * @throws UnsupportedSourceException if {@code source} is of no known kind
   */
  public Connection resolveConnection(Object source) throws SQLException {
    return resolver.resolve(source);
  }

  public List<Map<String, Object>> execute(Object source, List<?> sqlVector) throws SQLException {
    return execute(source, sqlVector, null);
  }

  /**
   * Runs {@code [expr, param...]} and returns all rows. {@code expr} is SQL text
   * or a {@link PreparedStatement} from {@link #prepare}.
   */
  public List<Map<String, Object>> execute(Object source, List<?> sqlVector, Map<String, ?> options)
      throws SQLException {
    QueryExpression expression = QueryExpression.of(sqlVector);
    ExecutionDispatcher.pathFor(expression.executable());
    return dispatcher.execute(resolver.resolve(source), expression, options);
  }

  public Map<String, Object> executeOne(Object source, List<?> sqlVector) throws SQLException {
    return executeOne(source, sqlVector, null);
  }

  /**
   * Like {@link #execute} but fetches only the first row.
   *
   * @return the first row, or {@code null} if there is none
   */
  public Map<String, Object> executeOne(Object source, List<?> sqlVector, Map<String, ?> options)
      throws SQLException {
    QueryExpression expression = QueryExpression.of(sqlVector);
    ExecutionDispatcher.pathFor(expression.executable());
    return dispatcher.executeOne(resolver.resolve(source), expression, options);
  }

  public PreparedStatement prepare(Object source, List<?> sqlVector) throws SQLException {
    return prepare(source, sqlVector, null);
  }

  /**
   * Prepares {@code [sql, param...]}. The parameters only serve as type hints.
   * The statement belongs to the resolved connection and must not be shared
   * with other connections.
   */
  public PreparedStatement prepare(Object source, List<?> sqlVector, Map<String, ?> options)
      throws SQLException {
    QueryExpression expression = QueryExpression.of(sqlVector);
    if (!(expression.executable() instanceof CharSequence)) {
      throw new InvalidExpressionException(expression.executable());
    }
    return dispatcher.prepare(resolver.resolve(source), expression, options);
  }

  /**
   * Server-side batch execution is not supported.
   *
   * @throws NotImplementedException always
   */
  public List<Map<String, Object>> executeBatch(Object source, Object sql, Map<String, ?> options) {
    throw new NotImplementedException("executeBatch is not implemented");
  }

  /**
   * Runs {@code body} with a connection from {@code source} and releases the
   * connection afterwards if it was borrowed or opened here.
   */
  public <T> T withConnection(Object source, ConnectionCallback<T> body) throws SQLException {
    return scope.withConnection(source, body);
  }

  public <T> T transact(Object source, ConnectionCallback<T> body) throws SQLException {
    return transact(source, body, null);
  }

  /**
   * Runs {@code body} in a transaction on a connection resolved from
   * {@code source}. Does not release a borrowed or opened connection; see
   * {@link #withTransaction}.
   *
   * @param options {@code isolation}, {@code read-only}, {@code rollback-only}
   *                (see {@link TxOptions}); may be {@code null}
   */
  public <T> T transact(Object source, ConnectionCallback<T> body, Map<String, ?> options)
      throws SQLException {
    return coordinator.transact(source, body, options);
  }

  public <T> T withTransaction(Object source, ConnectionCallback<T> body) throws SQLException {
    return withTransaction(source, null, body);
  }

  /**
   * Runs {@code body} in a transaction and releases the connection afterwards.
   */
  public <T> T withTransaction(Object source, Map<String, ?> options, ConnectionCallback<T> body)
      throws SQLException {
    return coordinator.withTransaction(source, options, body);
  }

  /**
   * Returns {@code true} if a transaction is open on the connection, even one
   * in a failed state.
   */
  public boolean isInTransaction(Connection connection) throws SQLException {
    return coordinator.isActive(connection);
  }

  /**
   * Builder for {@link SqlGate}. Connector, statement executor and transaction
   * control are required; metrics default to {@link MetricsExporter#NOOP}.
   */
  public static final class Builder {
    private Connector connector;
    private StatementExecutor statementExecutor;
    private TransactionControl transactionControl;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder connector(Connector connector) {
      this.connector = connector;
      return this;
    }

    public Builder statementExecutor(StatementExecutor statementExecutor) {
      this.statementExecutor = statementExecutor;
      return this;
    }

    public Builder transactionControl(TransactionControl transactionControl) {
      this.transactionControl = transactionControl;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SqlGate build() {
      return new SqlGate(this);
    }
  }
}
