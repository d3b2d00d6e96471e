package eventstore.jdbc;

import eventstore.EventStoreException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the relational stores.
 */
public final class StorageException extends EventStoreException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the underlying error is an integrity constraint violation (SQLState class 23),
   * such as a duplicate key.
   */
  public boolean isIntegrityViolation() {
    for (Throwable t = getCause(); t != null; t = t.getCause()) {
      if (t instanceof SQLException sql && sql.getSQLState() != null
          && sql.getSQLState().startsWith("23")) {
        return true;
      }
    }
    return false;
  }
}
