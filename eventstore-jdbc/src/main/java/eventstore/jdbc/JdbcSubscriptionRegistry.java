package eventstore.jdbc;

import eventstore.OutOfOrderAckException;
import eventstore.SubscriptionNotFoundException;
import eventstore.jdbc.spi.Dialect;
import eventstore.model.StartFrom;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;
import eventstore.spi.ConnectionProvider;
import eventstore.spi.SubscriptionRegistry;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link SubscriptionRegistry} stored in the {@code subscriptions} table, one row per
 * (scope, name) pair guarded by a unique key.
 *
 * <p>Concurrent first-time subscribes race on the unique key; the loser reads back the
 * winner's row, so both callers receive the same cursor.
 */
public final class JdbcSubscriptionRegistry extends AbstractJdbcStore implements SubscriptionRegistry {
  private static final Logger logger = Logger.getLogger(JdbcSubscriptionRegistry.class.getName());

  private static final String SELECT_COLUMNS =
      "SELECT stream_uuid, subscription_name, last_seen_position, last_seen_stream_version, created_at " +
      "FROM subscriptions";

  private static final JdbcTemplate.RowMapper<Subscription> SUBSCRIPTION_ROW_MAPPER = rs -> new Subscription(
      SubscriptionScope.fromKey(rs.getString("stream_uuid")),
      rs.getString("subscription_name"),
      rs.getLong("last_seen_position"),
      rs.getLong("last_seen_stream_version"),
      rs.getTimestamp("created_at").toInstant());

  private final Clock clock;

  public JdbcSubscriptionRegistry(ConnectionProvider connectionProvider, Dialect dialect) {
    this(connectionProvider, dialect, Clock.systemUTC());
  }

  public JdbcSubscriptionRegistry(ConnectionProvider connectionProvider, Dialect dialect, Clock clock) {
    super(connectionProvider, dialect);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Subscription subscribe(SubscriptionScope scope, String name, StartFrom startFrom) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(startFrom, "startFrom");
    return withConnection(conn -> {
      Optional<Subscription> existing = find(conn, scope, name);
      if (existing.isPresent()) {
        return existing.get();
      }
      try {
        JdbcTemplate.update(conn, dialect().insertSubscriptionSql(),
            scope.key(), name, startFrom.position(), startFrom.streamVersion(),
            Timestamp.from(clock.instant()));
      } catch (StorageException e) {
        if (!e.isIntegrityViolation()) {
          throw e;
        }
        logger.fine(() -> Subscription.describe(scope, name) + " was created concurrently");
      }
      return find(conn, scope, name).orElseThrow(() -> new StorageException(
          Subscription.describe(scope, name) + " not visible after insert"));
    });
  }

  @Override
  public void ack(SubscriptionScope scope, String name, long lastPosition, long lastStreamVersion) {
    inTransaction(conn -> {
      long current = JdbcTemplate.queryOne(conn,
              "SELECT last_seen_position FROM subscriptions " +
              "WHERE stream_uuid=? AND subscription_name=? FOR UPDATE",
              rs -> rs.getLong(1), scope.key(), name)
          .orElseThrow(() -> new SubscriptionNotFoundException(
              Subscription.describe(scope, name) + " not found"));
      if (lastPosition < current) {
        throw new OutOfOrderAckException(Subscription.describe(scope, name), current, lastPosition);
      }
      if (lastPosition > current) {
        JdbcTemplate.update(conn,
            "UPDATE subscriptions SET last_seen_position=?, last_seen_stream_version=? " +
            "WHERE stream_uuid=? AND subscription_name=?",
            lastPosition, lastStreamVersion, scope.key(), name);
      }
      return null;
    });
  }

  @Override
  public void unsubscribe(SubscriptionScope scope, String name) {
    withConnection(conn -> JdbcTemplate.update(conn,
        "DELETE FROM subscriptions WHERE stream_uuid=? AND subscription_name=?", scope.key(), name));
  }

  @Override
  public List<Subscription> list() {
    return withConnection(conn -> JdbcTemplate.query(conn,
        SELECT_COLUMNS + " ORDER BY subscription_id", SUBSCRIPTION_ROW_MAPPER));
  }

  private static Optional<Subscription> find(Connection conn, SubscriptionScope scope, String name) {
    return JdbcTemplate.queryOne(conn, SELECT_COLUMNS + " WHERE stream_uuid=? AND subscription_name=?",
        SUBSCRIPTION_ROW_MAPPER, scope.key(), name);
  }
}
