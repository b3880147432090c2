package sqlgate.jdbc.tx;

import sqlgate.IsolationLevel;
import sqlgate.TxOptions;
import sqlgate.spi.Transaction;
import sqlgate.spi.TransactionControl;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TransactionControl} over JDBC auto-commit.
 *
 * <p>A connection is idle while auto-commit is on. {@link #begin} switches
 * auto-commit off after applying {@code isolation-level} and
 * {@code read-only?}; the returned {@link JdbcTransaction} puts all three
 * settings back when it completes.
 *
 * <p>Use via try-with-resources:
 * <pre>{@code
 * try (Transaction tx = control.begin(conn, Map.of(TxOptions.ISOLATION_LEVEL, "serializable"))) {
 *     ...
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionControl implements TransactionControl {
  private static final Logger logger = Logger.getLogger(JdbcTransactionControl.class.getName());

  private static final Set<String> KNOWN_KEYS =
      Set.of(TxOptions.ISOLATION_LEVEL, TxOptions.READ_ONLY_FLAG, TxOptions.ROLLBACK_FLAG);

  @Override
  public boolean isIdle(Connection connection) throws SQLException {
    return connection.getAutoCommit();
  }

  /**
   * @throws IllegalArgumentException if {@code isolation-level} is not a known
   *                                  level or a flag is not a boolean
   * @throws IllegalStateException    if a transaction is already open
   */
  @Override
  public Transaction begin(Connection connection, Map<String, Object> options) throws SQLException {
    IsolationLevel isolation = options.get(TxOptions.ISOLATION_LEVEL) == null
        ? null : IsolationLevel.of(options.get(TxOptions.ISOLATION_LEVEL));
    boolean readOnly = flag(options, TxOptions.READ_ONLY_FLAG);
    boolean rollbackOnly = flag(options, TxOptions.ROLLBACK_FLAG);
    for (String key : options.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        logger.log(Level.FINE, "Ignoring transaction option {0}", key);
      }
    }

    if (!connection.getAutoCommit()) {
      throw new IllegalStateException("Transaction already active on connection");
    }
    int previousIsolation = connection.getTransactionIsolation();
    boolean previousReadOnly = connection.isReadOnly();
    JdbcTransaction tx = new JdbcTransaction(connection, rollbackOnly, previousIsolation, previousReadOnly);
    try {
      if (isolation != null && isolation.jdbcLevel() != previousIsolation) {
        connection.setTransactionIsolation(isolation.jdbcLevel());
      }
      if (readOnly != previousReadOnly) {
        connection.setReadOnly(readOnly);
      }
      connection.setAutoCommit(false);
    } catch (SQLException | RuntimeException e) {
      tx.restoreAfterFailedBegin(e);
      throw e;
    }
    return tx;
  }

  private static boolean flag(Map<String, Object> options, String key) {
    Object value = options.get(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    throw new IllegalArgumentException(key + " must be a boolean, got " + value);
  }
}
