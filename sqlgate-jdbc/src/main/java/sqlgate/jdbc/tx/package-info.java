/**
 * JDBC transaction control.
 *
 * <p>{@link sqlgate.jdbc.tx.JdbcTransactionControl} opens transactions by
 * turning auto-commit off; {@link sqlgate.jdbc.tx.JdbcTransaction} completes
 * them and restores the connection's settings.
 *
 * @see sqlgate.jdbc.tx.JdbcTransactionControl
 * @see sqlgate.jdbc.tx.JdbcTransaction
 */
package sqlgate.jdbc.tx;
