package sqlgate.tx;

import sqlgate.TxOptions;
import sqlgate.source.ConnectionScope;
import sqlgate.source.SourceResolver;
import sqlgate.spi.ConnectionCallback;
import sqlgate.spi.MetricsExporter;
import sqlgate.spi.Transaction;
import sqlgate.spi.TransactionControl;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs units of work inside a transaction: commit when the body returns,
 * rollback when it throws.
 *
 * <p>Caller options use the {@link TxOptions} caller vocabulary and are renamed
 * before they reach {@link TransactionControl#begin}. A transaction opened with
 * {@code rollback-only} is rolled back even when the body succeeds; the body's
 * result is still returned.
 *
 * <p>{@link #transact} resolves its source but does not release it. Use
 * {@link #withTransaction} for pools and configurations.
 */
public final class TransactionCoordinator {
  private static final Logger logger = Logger.getLogger(TransactionCoordinator.class.getName());

  private final SourceResolver resolver;
  private final ConnectionScope scope;
  private final TransactionControl control;
  private final MetricsExporter metrics;

  public TransactionCoordinator(SourceResolver resolver, ConnectionScope scope,
      TransactionControl control, MetricsExporter metrics) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.control = Objects.requireNonNull(control, "control");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Resolves {@code source}, opens a transaction on it and runs {@code body}.
   *
   * <p>A connection borrowed or opened here is not released.
   */
  public <T> T transact(Object source, ConnectionCallback<T> body, Map<String, ?> options)
      throws SQLException {
    Objects.requireNonNull(body, "body");
    Connection connection = resolver.resolve(source);
    return inTransaction(connection, TxOptions.remap(options), body);
  }

  /**
   * Binds a connection from {@code source} for the duration of a transaction
   * and releases it afterwards.
   */
  public <T> T withTransaction(Object source, Map<String, ?> options, ConnectionCallback<T> body)
      throws SQLException {
    Objects.requireNonNull(body, "body");
    return scope.withConnection(source, connection -> transact(connection, body, options));
  }

  /**
   * Returns {@code true} while a transaction is open on the connection,
   * including one that has failed and is waiting for rollback.
   */
  public boolean isActive(Connection connection) throws SQLException {
    return !control.isIdle(connection);
  }

  <T> T inTransaction(Connection connection, Map<String, Object> txOptions, ConnectionCallback<T> body)
      throws SQLException {
    try (Transaction tx = control.begin(connection, txOptions)) {
      logger.log(Level.FINE, "Transaction started with {0}", txOptions);
      T result;
      try {
        result = body.doInConnection(connection);
      } catch (Throwable t) {
        rollbackAfterFailure(tx, t);
        throw t;
      }
      if (tx.isRollbackOnly()) {
        tx.rollback();
        metrics.incrementRollbacks();
        logger.fine("Transaction rolled back (rollback-only)");
      } else {
        tx.commit();
        metrics.incrementCommits();
        logger.fine("Transaction committed");
      }
      return result;
    }
  }

  private void rollbackAfterFailure(Transaction tx, Throwable failure) {
    try {
      tx.rollback();
      metrics.incrementRollbacks();
      logger.log(Level.FINE, "Transaction rolled back after failure: {0}", failure.toString());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Rollback failed after transaction body error", e);
      failure.addSuppressed(e);
    }
  }
}
