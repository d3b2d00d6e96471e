package eventstore.jdbc;

import eventstore.jdbc.spi.Dialect;
import eventstore.model.Snapshot;
import eventstore.spi.ConnectionProvider;
import eventstore.spi.SnapshotStore;

import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SnapshotStore} stored in the {@code snapshots} table, one row per source.
 */
public final class JdbcSnapshotStore extends AbstractJdbcStore implements SnapshotStore {

  private static final JdbcTemplate.RowMapper<Snapshot> SNAPSHOT_ROW_MAPPER = rs -> new Snapshot(
      rs.getString("source_uuid"),
      rs.getLong("source_version"),
      rs.getString("source_type"),
      rs.getBytes("data"),
      rs.getBytes("metadata"),
      rs.getTimestamp("created_at").toInstant());

  public JdbcSnapshotStore(ConnectionProvider connectionProvider, Dialect dialect) {
    super(connectionProvider, dialect);
  }

  @Override
  public Optional<Snapshot> read(String sourceId) {
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT source_uuid, source_version, source_type, data, metadata, created_at " +
        "FROM snapshots WHERE source_uuid=?", SNAPSHOT_ROW_MAPPER, sourceId));
  }

  @Override
  public void record(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    withConnection(conn -> JdbcTemplate.update(conn, dialect().upsertSnapshotSql(),
        snapshot.sourceId(), snapshot.sourceVersion(), snapshot.sourceType(),
        snapshot.data(), snapshot.metadata(), Timestamp.from(snapshot.createdAt())));
  }

  @Override
  public void delete(String sourceId) {
    withConnection(conn -> JdbcTemplate.update(conn, "DELETE FROM snapshots WHERE source_uuid=?", sourceId));
  }
}
