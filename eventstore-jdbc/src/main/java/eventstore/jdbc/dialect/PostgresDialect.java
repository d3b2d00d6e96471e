package eventstore.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String insertSubscriptionSql() {
    // A failed statement would abort the surrounding transaction, so skip instead
    return super.insertSubscriptionSql() + " ON CONFLICT (stream_uuid, subscription_name) DO NOTHING";
  }

  @Override
  public String upsertSnapshotSql() {
    return "INSERT INTO snapshots (" +
        "source_uuid, source_version, source_type, data, metadata, created_at" +
        ") VALUES (?,?,?,?,?,?) ON CONFLICT (source_uuid) DO UPDATE SET " +
        "source_version=EXCLUDED.source_version, source_type=EXCLUDED.source_type, " +
        "data=EXCLUDED.data, metadata=EXCLUDED.metadata, created_at=EXCLUDED.created_at";
  }
}
