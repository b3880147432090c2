package sqlgate.jdbc;

import sqlgate.spi.ConnectionPool;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionPool} backed by a pooling {@link DataSource} such as
 * HikariCP. Borrowing delegates to {@link DataSource#getConnection()};
 * releasing closes the connection, which hands it back to the pool.
 *
 * @see ConnectionPool
 */
public final class DataSourceConnectionPool implements ConnectionPool {
  private final DataSource dataSource;

  public DataSourceConnectionPool(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection borrow() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public void release(Connection connection) throws SQLException {
    connection.close();
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public String toString() {
    return "DataSourceConnectionPool[" + dataSource + "]";
  }
}
