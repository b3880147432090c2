package sqlgate.spi;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Transaction primitive of the underlying driver.
 *
 * <p>Options arrive already translated into the primitive's vocabulary
 * ({@code isolation-level}, {@code read-only?}, {@code rollback?}, see
 * {@link sqlgate.TxOptions}). Keys the implementation does not know must be
 * ignored, not rejected.
 *
 * @see sqlgate.jdbc.tx.JdbcTransactionControl
 */
public interface TransactionControl {

  /**
   * Returns {@code true} if no transaction is open on the connection. A
   * transaction that has failed but not yet been rolled back is not idle.
   */
  boolean isIdle(Connection connection) throws SQLException;

  /** Opens a transaction on the connection. */
  Transaction begin(Connection connection, Map<String, Object> options) throws SQLException;
}
