/**
 * Transaction coordination on top of scoped connections.
 *
 * @see sqlgate.tx.TransactionCoordinator
 * @see sqlgate.spi.TransactionControl
 */
package sqlgate.tx;
