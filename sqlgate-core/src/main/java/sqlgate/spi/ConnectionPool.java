package sqlgate.spi;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A bounded set of connections handed out for exclusive, temporary use.
 *
 * <p>Implementations must be safe for concurrent {@link #borrow()} and
 * {@link #release(Connection)} calls; sqlgate adds no locking of its own.
 *
 * @see sqlgate.jdbc.DataSourceConnectionPool
 */
public interface ConnectionPool {

  /**
   * Takes a connection out of the pool. The caller has exclusive use of it
   * until it is passed to {@link #release(Connection)}.
   *
   * @throws SQLException if no connection can be obtained
   */
  Connection borrow() throws SQLException;

  /**
   * Returns a borrowed connection to the pool.
   *
   * @throws SQLException if the connection cannot be returned
   */
  void release(Connection connection) throws SQLException;

  /**
   * Borrows a connection, runs {@code body} with it and returns the connection
   * on every exit path. If both the body and the release fail, the release
   * failure is attached to the body's exception as suppressed.
   */
  default <T> T withBorrowedConnection(ConnectionCallback<T> body) throws SQLException {
    Connection connection = borrow();
    T result;
    try {
      result = body.doInConnection(connection);
    } catch (Throwable t) {
      try {
        release(connection);
      } catch (SQLException | RuntimeException e) {
        Logger.getLogger(ConnectionPool.class.getName())
            .log(Level.WARNING, "Failed to return connection to pool after error", e);
        t.addSuppressed(e);
      }
      throw t;
    }
    release(connection);
    return result;
  }
}
