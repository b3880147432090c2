/**
 * Service Provider Interfaces (SPI) behind which sqlgate reaches the driver.
 *
 * <p>These interfaces define the primitives an integration implements: opening
 * connections, pooling them, running statements, controlling transactions and
 * exporting metrics. {@code sqlgate-jdbc} implements all of them over plain JDBC.
 *
 * @see sqlgate.spi.Connector
 * @see sqlgate.spi.ConnectionPool
 * @see sqlgate.spi.StatementExecutor
 * @see sqlgate.spi.TransactionControl
 * @see sqlgate.spi.MetricsExporter
 */
package sqlgate.spi;
