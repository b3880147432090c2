package sqlgate.spi;

import java.sql.SQLException;

/**
 * An open transaction on a single connection, as returned by
 * {@link TransactionControl#begin}.
 *
 * <p>{@link #commit()} and {@link #rollback()} complete the transaction; calls
 * after completion are no-ops. {@link #close()} rolls back an incomplete
 * transaction.
 */
public interface Transaction extends AutoCloseable {

  /** Whether the transaction was opened with the {@code rollback?} flag. */
  boolean isRollbackOnly();

  void commit() throws SQLException;

  void rollback() throws SQLException;

  @Override
  void close() throws SQLException;
}
