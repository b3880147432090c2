package sqlgate.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work run against a bound connection.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface ConnectionCallback<T> {
  T doInConnection(Connection connection) throws SQLException;
}
