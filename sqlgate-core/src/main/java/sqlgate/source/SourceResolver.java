package sqlgate.source;

import sqlgate.ConnectionConfig;
import sqlgate.NullSourceException;
import sqlgate.UnsupportedSourceException;
import sqlgate.spi.ConnectionPool;
import sqlgate.spi.Connector;
import sqlgate.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a connection source into a {@link Connection}.
 *
 * <p>A source is one of:
 * <ul>
 *   <li>a {@link Connection}, returned unchanged;</li>
 *   <li>a {@link ConnectionPool}, from which a connection is borrowed;</li>
 *   <li>a {@link ConnectionConfig} or a {@link Map} of connection parameters,
 *       from which a new connection is opened.</li>
 * </ul>
 *
 * <p>{@link #resolve(Object)} does not release anything. Each call on a pool or
 * a configuration acquires a fresh connection that the caller has to give back;
 * {@link ConnectionScope} does that pairing automatically.
 */
public final class SourceResolver {
  private static final Logger logger = Logger.getLogger(SourceResolver.class.getName());

  private final Connector connector;
  private final MetricsExporter metrics;

  public SourceResolver(Connector connector, MetricsExporter metrics) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Classifies a source without acquiring anything.
   *
   * @throws NullSourceException        if {@code source} is {@code null}
   * @throws UnsupportedSourceException if {@code source} is of no known kind
   */
  public static SourceKind classify(Object source) {
    if (source == null) {
      throw new NullSourceException();
    }
    if (source instanceof Connection) {
      return SourceKind.CONNECTION;
    }
    if (source instanceof ConnectionPool) {
      return SourceKind.POOL;
    }
    if (source instanceof ConnectionConfig || source instanceof Map) {
      return SourceKind.CONFIGURATION;
    }
    throw new UnsupportedSourceException(source);
  }

  /**
   * Returns a connection for the source: the connection itself, a connection
   * borrowed from the pool, or a newly opened connection.
   */
  public Connection resolve(Object source) throws SQLException {
    return switch (classify(source)) {
      case CONNECTION -> (Connection) source;
      case POOL -> borrow((ConnectionPool) source);
      case CONFIGURATION -> open(ConnectionConfig.from(source));
    };
  }

  Connection borrow(ConnectionPool pool) throws SQLException {
    Connection connection = pool.borrow();
    metrics.incrementConnectionsBorrowed();
    logger.log(Level.FINE, "Borrowed connection from {0}", pool);
    return connection;
  }

  Connection open(ConnectionConfig config) throws SQLException {
    Connection connection = connector.open(config);
    metrics.incrementConnectionsOpened();
    logger.log(Level.FINE, "Opened connection for {0}", config);
    return connection;
  }

  Connector connector() {
    return connector;
  }

  MetricsExporter metrics() {
    return metrics;
  }
}
