package eventstore.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific SQL used by the relational stores.
 * Register custom dialects via {@code META-INF/services/eventstore.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see eventstore.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Classpath location of the DDL script creating the tables, with
   * {@code CREATE ... IF NOT EXISTS} statements separated by semicolons.
   */
  default String schemaResource() {
    return "eventstore/schema/" + name() + ".sql";
  }

  /**
   * SQL locking the single log head row for the rest of the transaction.
   *
   * <p>Returns column: last_position
   */
  String lockHeadSql();

  /**
   * SQL reading a stream row and locking it for the rest of the transaction.
   *
   * <p>Parameters: stream_uuid (String). Returns columns: stream_id, stream_version
   */
  String selectStreamForUpdateSql();

  /**
   * SQL inserting a subscription unless one with the same scope and name exists.
   * Implementations may either skip the row or raise a duplicate-key error.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>stream_uuid (String)</li>
   *   <li>subscription_name (String)</li>
   *   <li>last_seen_position (long)</li>
   *   <li>last_seen_stream_version (long)</li>
   *   <li>created_at (Timestamp)</li>
   * </ol>
   */
  String insertSubscriptionSql();

  /**
   * SQL inserting or replacing the snapshot of a source.
   *
   * <p>Parameters (in order): source_uuid (String), source_version (long),
   * source_type (String), data (bytes), metadata (bytes), created_at (Timestamp)
   */
  String upsertSnapshotSql();
}
