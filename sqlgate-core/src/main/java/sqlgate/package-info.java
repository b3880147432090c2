/**
 * Connection acquisition and transaction coordination for SQL clients.
 *
 * <p>{@link sqlgate.SqlGate} is the entry point. It accepts a connection, a
 * pool or a configuration as the source of a connection, and runs statements or
 * transactional units of work against it.
 *
 * @see sqlgate.SqlGate
 * @see sqlgate.TxOptions
 * @see sqlgate.ExecuteOptions
 */
package sqlgate;
