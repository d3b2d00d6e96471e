package eventstore.jdbc;

import eventstore.AppendResult;
import eventstore.ConcurrencyConflictException;
import eventstore.EventData;
import eventstore.ExpectedVersion;
import eventstore.StreamExistsException;
import eventstore.jdbc.spi.Dialect;
import eventstore.model.RecordedEvent;
import eventstore.model.StreamInfo;
import eventstore.model.SubscriptionScope;
import eventstore.spi.ConnectionProvider;
import eventstore.spi.EventLog;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EventLog} stored in the {@code streams}, {@code events} and {@code log_head} tables.
 *
 * <p>Appends and stream creation run in one transaction that first locks the single
 * {@code log_head} row, so writers are serialized and global positions stay contiguous.
 * The stream row is then locked to check the expected version.
 *
 * @see SchemaInitializer
 */
public final class JdbcEventLog extends AbstractJdbcStore implements EventLog {

  private static final String EVENT_COLUMNS =
      "e.event_position, e.event_id, s.stream_uuid, e.stream_version, e.event_type, " +
      "e.payload, e.metadata, e.created_at";

  private static final JdbcTemplate.RowMapper<RecordedEvent> EVENT_ROW_MAPPER = rs -> new RecordedEvent(
      rs.getString("event_id"),
      rs.getString("stream_uuid"),
      rs.getLong("stream_version"),
      rs.getLong("event_position"),
      rs.getString("event_type"),
      rs.getBytes("payload"),
      rs.getBytes("metadata"),
      rs.getTimestamp("created_at").toInstant());

  private final Clock clock;

  public JdbcEventLog(ConnectionProvider connectionProvider, Dialect dialect) {
    this(connectionProvider, dialect, Clock.systemUTC());
  }

  public JdbcEventLog(ConnectionProvider connectionProvider, Dialect dialect, Clock clock) {
    super(connectionProvider, dialect);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public StreamInfo createStream(String streamId) {
    requireStreamId(streamId);
    return inTransaction(conn -> {
      lockHead(conn);
      if (findStream(conn, streamId).isPresent()) {
        throw new StreamExistsException(streamId);
      }
      return insertStream(conn, streamId);
    });
  }

  @Override
  public AppendResult append(String streamId, long expectedVersion, List<EventData> events) {
    requireStreamId(streamId);
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events cannot be empty");
    }
    return inTransaction(conn -> {
      long head = lockHead(conn);
      StreamInfo stream = findStream(conn, streamId).orElse(null);
      long current = stream == null ? 0L : stream.version();
      if (expectedVersion != ExpectedVersion.ANY && expectedVersion != current) {
        throw new ConcurrencyConflictException(streamId, expectedVersion, current);
      }
      if (stream == null) {
        stream = insertStream(conn, streamId);
      }

      // Stored timestamps may lose sub-millisecond precision
      Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
      Timestamp createdAt = Timestamp.from(now);
      List<RecordedEvent> recorded = new ArrayList<>(events.size());
      List<Object[]> rows = new ArrayList<>(events.size());
      for (EventData data : events) {
        long version = current + recorded.size() + 1;
        long position = head + recorded.size() + 1;
        recorded.add(new RecordedEvent(data.eventId(), streamId, version, position,
            data.eventType(), data.payload(), data.metadata(), now));
        rows.add(new Object[] {position, data.eventId(), stream.internalId(), version,
            data.eventType(), data.payload(), data.metadata(), createdAt});
      }
      JdbcTemplate.batchUpdate(conn,
          "INSERT INTO events (event_position, event_id, stream_id, stream_version, event_type, " +
          "payload, metadata, created_at) VALUES (?,?,?,?,?,?,?,?)", rows);

      long newVersion = current + events.size();
      JdbcTemplate.update(conn, "UPDATE streams SET stream_version=? WHERE stream_id=?",
          newVersion, stream.internalId());
      JdbcTemplate.update(conn, "UPDATE log_head SET last_position=? WHERE id=1",
          head + events.size());
      return new AppendResult(streamId, newVersion, recorded);
    });
  }

  @Override
  public List<RecordedEvent> readStreamForward(String streamId, long startVersion, int maxCount) {
    requirePositive(maxCount);
    String sql = "SELECT " + EVENT_COLUMNS + " FROM events e JOIN streams s ON s.stream_id=e.stream_id " +
        "WHERE s.stream_uuid=? AND e.stream_version>=? ORDER BY e.stream_version LIMIT ?";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER,
        streamId, Math.max(startVersion, 1L), maxCount));
  }

  @Override
  public List<RecordedEvent> readAllForward(long startPosition, int maxCount) {
    requirePositive(maxCount);
    String sql = "SELECT " + EVENT_COLUMNS + " FROM events e JOIN streams s ON s.stream_id=e.stream_id " +
        "WHERE e.event_position>=? ORDER BY e.event_position LIMIT ?";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER,
        Math.max(startPosition, 1L), maxCount));
  }

  @Override
  public long latestPosition() {
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
            "SELECT last_position FROM log_head WHERE id=1", rs -> rs.getLong(1))
        .orElse(0L));
  }

  @Override
  public Optional<StreamInfo> streamInfo(String streamId) {
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT stream_id, stream_version FROM streams WHERE stream_uuid=?",
        rs -> new StreamInfo(streamId, rs.getLong("stream_id"), rs.getLong("stream_version")),
        streamId));
  }

  private long lockHead(Connection conn) {
    return JdbcTemplate.queryOne(conn, dialect().lockHeadSql(), rs -> rs.getLong(1))
        .orElseThrow(() -> new StorageException(
            "log_head row is missing; run SchemaInitializer.initialize() first"));
  }

  private Optional<StreamInfo> findStream(Connection conn, String streamId) {
    return JdbcTemplate.queryOne(conn, dialect().selectStreamForUpdateSql(),
        rs -> new StreamInfo(streamId, rs.getLong("stream_id"), rs.getLong("stream_version")),
        streamId);
  }

  private StreamInfo insertStream(Connection conn, String streamId) {
    JdbcTemplate.update(conn,
        "INSERT INTO streams (stream_uuid, stream_version, created_at) VALUES (?,?,?)",
        streamId, 0L, Timestamp.from(clock.instant()));
    return findStream(conn, streamId)
        .orElseThrow(() -> new StorageException("Stream row not visible after insert: " + streamId));
  }

  private static void requireStreamId(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    if (streamId.isEmpty() || SubscriptionScope.ALL_STREAMS_KEY.equals(streamId)) {
      throw new IllegalArgumentException("Invalid stream id: '" + streamId + "'");
    }
  }

  private static void requirePositive(int maxCount) {
    if (maxCount <= 0) {
      throw new IllegalArgumentException("maxCount must be > 0");
    }
  }
}
