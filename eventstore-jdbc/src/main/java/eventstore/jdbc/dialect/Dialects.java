package eventstore.jdbc.dialect;

import eventstore.jdbc.StorageException;
import eventstore.jdbc.spi.Dialect;
import eventstore.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Registry of the {@link Dialect}s found on the classpath, with detection by JDBC URL.
 *
 * <p>Dialects are loaded once via {@link ServiceLoader} from
 * {@code META-INF/services/eventstore.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.detect("jdbc:postgresql://localhost/events");
 * Dialect dialect = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME;

  static {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      byName.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
    BY_NAME = Collections.unmodifiableMap(byName);
  }

  private Dialects() {
  }

  /**
   * Returns all registered dialects.
   */
  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect
   * @throws IllegalArgumentException if no dialect is registered under that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  public static Dialect detect(DataSource dataSource) {
    return detect((ConnectionProvider) dataSource::getConnection);
  }

  /**
   * Detects the dialect from the URL of a borrowed connection.
   *
   * @throws StorageException if no connection can be obtained
   */
  public static Dialect detect(ConnectionProvider connectionProvider) {
    try (Connection conn = connectionProvider.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new StorageException("Failed to detect dialect", e);
    }
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected dialect
   * @throws IllegalArgumentException if the URL is empty or no dialect matches it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (Dialect dialect : BY_NAME.values()) {
      if (dialect.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: "
        + BY_NAME.values().stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList());
  }
}
