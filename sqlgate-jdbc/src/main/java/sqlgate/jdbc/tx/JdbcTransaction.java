package sqlgate.jdbc.tx;

import sqlgate.spi.Transaction;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * An open JDBC transaction. Supports explicit {@link #commit()} and
 * {@link #rollback()}. If neither is called, {@link #close()} rolls back.
 *
 * <p>Completion restores auto-commit, isolation and read-only to the values the
 * connection had before {@link JdbcTransactionControl#begin}. The connection
 * itself is never closed here.
 */
public final class JdbcTransaction implements Transaction {
  private final Connection connection;
  private final boolean rollbackOnly;
  private final int previousIsolation;
  private final boolean previousReadOnly;
  private boolean completed;

  JdbcTransaction(Connection connection, boolean rollbackOnly, int previousIsolation,
      boolean previousReadOnly) {
    this.connection = connection;
    this.rollbackOnly = rollbackOnly;
    this.previousIsolation = previousIsolation;
    this.previousReadOnly = previousReadOnly;
  }

  @Override
  public boolean isRollbackOnly() {
    return rollbackOnly;
  }

  /**
   * Commits. If the commit fails the transaction is rolled back and the commit
   * failure is rethrown.
   */
  @Override
  public void commit() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.commit();
    } catch (SQLException e) {
      try {
        connection.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      finalizeTx(e);
      throw e;
    }
    finalizeTx(null);
  }

  @Override
  public void rollback() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.rollback();
    } catch (SQLException e) {
      finalizeTx(e);
      throw e;
    }
    finalizeTx(null);
  }

  @Override
  public void close() throws SQLException {
    if (!completed) {
      rollback();
    }
  }

  public boolean isCompleted() {
    return completed;
  }

  void restoreAfterFailedBegin(Exception failure) {
    try {
      finalizeTx(failure);
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * Puts the connection settings back. With a pending failure, restore errors
   * are attached to it; without one, the first restore error is thrown.
   */
  private void finalizeTx(Exception pending) throws SQLException {
    completed = true;
    SQLException first = null;
    try {
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      first = e;
    }
    try {
      if (connection.getTransactionIsolation() != previousIsolation) {
        connection.setTransactionIsolation(previousIsolation);
      }
      if (connection.isReadOnly() != previousReadOnly) {
        connection.setReadOnly(previousReadOnly);
      }
    } catch (SQLException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (first == null) {
      return;
    }
    if (pending != null) {
      pending.addSuppressed(first);
      return;
    }
    throw first;
  }
}
