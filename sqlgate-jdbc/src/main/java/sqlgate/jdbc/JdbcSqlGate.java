package sqlgate.jdbc;

import sqlgate.SqlGate;
import sqlgate.jdbc.tx.JdbcTransactionControl;
import sqlgate.spi.MetricsExporter;

/**
 * Factory for {@link SqlGate} instances wired with the JDBC primitives.
 */
public final class JdbcSqlGate {

  /** Defaults: PostgreSQL URL template, lower-cased labels, no metrics. */
  public static SqlGate create() {
    return builder().build();
  }

  public static SqlGate create(MetricsExporter metrics) {
    return builder().metrics(metrics).build();
  }

  /**
   * Returns a builder pre-populated with {@link JdbcConnector},
   * {@link JdbcStatementExecutor} and {@link JdbcTransactionControl}; any of
   * them can still be replaced.
   */
  public static SqlGate.Builder builder() {
    return SqlGate.builder()
        .connector(new JdbcConnector())
        .statementExecutor(new JdbcStatementExecutor())
        .transactionControl(new JdbcTransactionControl());
  }

  private JdbcSqlGate() {
  }
}
