package sqlgate.source;

import sqlgate.ConnectionConfig;
import sqlgate.spi.ConnectionCallback;
import sqlgate.spi.ConnectionPool;
import sqlgate.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a unit of work with a connection bound from a source and releases that
 * connection according to how it was obtained.
 *
 * <ul>
 *   <li>{@link SourceKind#CONNECTION}: the body runs on the caller's connection,
 *       which stays open.</li>
 *   <li>{@link SourceKind#POOL}: a borrowed connection goes back to the pool.</li>
 *   <li>{@link SourceKind#CONFIGURATION}: an opened connection is closed.</li>
 * </ul>
 *
 * <p>Release happens on normal return and when the body throws. If both the
 * body and the release fail, the body's exception is rethrown with the release
 * failure attached as suppressed.
 */
public final class ConnectionScope {
  private static final Logger logger = Logger.getLogger(ConnectionScope.class.getName());

  private final SourceResolver resolver;

  public ConnectionScope(SourceResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public <T> T withConnection(Object source, ConnectionCallback<T> body) throws SQLException {
    Objects.requireNonNull(body, "body");
    return switch (SourceResolver.classify(source)) {
      case CONNECTION -> body.doInConnection((Connection) source);
      case POOL -> onPool((ConnectionPool) source, body);
      case CONFIGURATION -> onConfig(ConnectionConfig.from(source), body);
    };
  }

  private <T> T onPool(ConnectionPool pool, ConnectionCallback<T> body) throws SQLException {
    MetricsExporter metrics = resolver.metrics();
    return pool.withBorrowedConnection(connection -> {
      metrics.incrementConnectionsBorrowed();
      try {
        return body.doInConnection(connection);
      } finally {
        // the pool returns the connection right after this callback exits
        metrics.incrementConnectionsReturned();
      }
    });
  }

  private <T> T onConfig(ConnectionConfig config, ConnectionCallback<T> body) throws SQLException {
    Connection connection = resolver.open(config);
    T result;
    try {
      result = body.doInConnection(connection);
    } catch (Throwable t) {
      try {
        close(connection);
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close connection after error", e);
        t.addSuppressed(e);
      }
      throw t;
    }
    close(connection);
    return result;
  }

  private void close(Connection connection) throws SQLException {
    resolver.connector().close(connection);
    resolver.metrics().incrementConnectionsClosed();
    logger.log(Level.FINE, "Closed connection");
  }
}
