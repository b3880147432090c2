/**
 * JDBC implementations of the {@code sqlgate.spi} primitives.
 *
 * <p>{@link sqlgate.jdbc.JdbcConnector} opens connections through
 * {@code DriverManager}, {@link sqlgate.jdbc.DataSourceConnectionPool} adapts a
 * pooling {@code DataSource}, and {@link sqlgate.jdbc.JdbcStatementExecutor}
 * runs statements. {@link sqlgate.jdbc.JdbcSqlGate} wires them into a
 * {@link sqlgate.SqlGate}.
 *
 * @see sqlgate.jdbc.JdbcSqlGate
 * @see sqlgate.jdbc.tx.JdbcTransactionControl
 */
package sqlgate.jdbc;
