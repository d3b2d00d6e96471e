package eventstore.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the relational backends. Typically backed by a bounded
 * pool; when the pool is exhausted {@link #getConnection()} blocks until a connection is
 * released.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see eventstore.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Borrows a connection for one store operation or transaction.
     *
     * @return an open connection in auto-commit mode
     * @throws SQLException if the pool or driver refuses the connection
     */
    Connection getConnection() throws SQLException;
}
