package sqlgate.spi;

import sqlgate.ConnectionConfig;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens brand-new connections from a {@link ConnectionConfig}.
 *
 * @see sqlgate.jdbc.JdbcConnector
 */
public interface Connector {

  /**
   * Opens a new connection. The caller owns it and must close it, normally via
   * {@link #close(Connection)}.
   */
  Connection open(ConnectionConfig config) throws SQLException;

  default void close(Connection connection) throws SQLException {
    connection.close();
  }
}
