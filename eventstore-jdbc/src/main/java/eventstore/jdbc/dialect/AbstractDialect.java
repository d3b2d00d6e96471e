package eventstore.jdbc.dialect;

import eventstore.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String lockHeadSql() {
    return "SELECT last_position FROM log_head WHERE id=1 FOR UPDATE";
  }

  @Override
  public String selectStreamForUpdateSql() {
    return "SELECT stream_id, stream_version FROM streams WHERE stream_uuid=? FOR UPDATE";
  }

  @Override
  public String insertSubscriptionSql() {
    return "INSERT INTO subscriptions (" +
        "stream_uuid, subscription_name, last_seen_position, last_seen_stream_version, created_at" +
        ") VALUES (?,?,?,?,?)";
  }
}
