package eventstore.jdbc;

import eventstore.jdbc.spi.Dialect;
import eventstore.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class of the relational stores. Each operation borrows one connection from the
 * {@link ConnectionProvider} and returns it on every exit path.
 */
public abstract class AbstractJdbcStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcStore.class.getName());

  @FunctionalInterface
  protected interface ConnectionCallback<T> {
    T doInConnection(Connection conn);
  }

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;

  protected AbstractJdbcStore(ConnectionProvider connectionProvider, Dialect dialect) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  protected Dialect dialect() {
    return dialect;
  }

  /** Runs the callback on an auto-commit connection. */
  protected <T> T withConnection(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new StorageException("Failed to obtain connection", e);
    }
  }

  /**
   * Runs the callback in one transaction: commits if it returns, rolls back if it throws.
   * Auto-commit is restored before the connection is released.
   */
  protected <T> T inTransaction(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      boolean committed = false;
      try {
        T result = callback.doInConnection(conn);
        conn.commit();
        committed = true;
        return result;
      } finally {
        if (!committed) {
          safeRollback(conn);
        }
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new StorageException("Transaction failed", e);
    }
  }

  private static void safeRollback(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }
}
