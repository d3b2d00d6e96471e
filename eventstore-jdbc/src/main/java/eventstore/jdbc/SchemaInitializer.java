package eventstore.jdbc;

import eventstore.jdbc.spi.Dialect;
import eventstore.spi.ConnectionProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Creates the event store tables from the dialect's DDL script and resets their content.
 *
 * <p>{@link #initialize()} is idempotent. {@link #reset()} deletes every event, stream,
 * subscription and snapshot; it is meant for tests.
 */
public final class SchemaInitializer extends AbstractJdbcStore {
  private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

  public SchemaInitializer(ConnectionProvider connectionProvider, Dialect dialect) {
    super(connectionProvider, dialect);
  }

  public void initialize() {
    List<String> statements = loadStatements(dialect().schemaResource());
    inTransaction(conn -> {
      execute(conn, statements);
      seedHead(conn);
      return null;
    });
    logger.info(() -> "Initialized event store schema (" + dialect().name() + ", "
        + statements.size() + " statements)");
  }

  /**
   * Deletes all rows and rewinds the log head to position 0.
   */
  public void reset() {
    inTransaction(conn -> {
      JdbcTemplate.update(conn, "DELETE FROM events");
      JdbcTemplate.update(conn, "DELETE FROM streams");
      JdbcTemplate.update(conn, "DELETE FROM subscriptions");
      JdbcTemplate.update(conn, "DELETE FROM snapshots");
      JdbcTemplate.update(conn, "DELETE FROM log_head");
      seedHead(conn);
      return null;
    });
    logger.warning("Reset event store tables");
  }

  private static void seedHead(Connection conn) {
    long rows = JdbcTemplate.queryOne(conn, "SELECT COUNT(*) FROM log_head", rs -> rs.getLong(1))
        .orElse(0L);
    if (rows == 0) {
      JdbcTemplate.update(conn, "INSERT INTO log_head (id, last_position) VALUES (1, 0)");
    }
  }

  private static void execute(Connection conn, List<String> statements) {
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to execute schema script", e);
    }
  }

  static List<String> loadStatements(String resource) {
    String script;
    try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new StorageException("Schema resource not found: " + resource);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new StorageException("Failed to read schema resource " + resource, e);
    }
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : script.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(trimmed).append(' ');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().strip();
        statements.add(sql.substring(0, sql.length() - 1));
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      statements.add(current.toString().strip());
    }
    return statements;
  }
}
