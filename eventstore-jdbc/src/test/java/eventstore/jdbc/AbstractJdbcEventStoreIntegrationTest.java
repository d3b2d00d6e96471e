package eventstore.jdbc;

import eventstore.AppendResult;
import eventstore.ConcurrencyConflictException;
import eventstore.EventData;
import eventstore.EventStore;
import eventstore.ExpectedVersion;
import eventstore.OutOfOrderAckException;
import eventstore.StreamExistsException;
import eventstore.SubscriptionNotFoundException;
import eventstore.jdbc.spi.Dialect;
import eventstore.model.RecordedEvent;
import eventstore.model.Snapshot;
import eventstore.model.StartFrom;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;
import eventstore.spi.ConnectionProvider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Storage contract shared by every dialect. Subclasses supply a data source pointing at an
 * empty database.
 */
abstract class AbstractJdbcEventStoreIntegrationTest {

  abstract DataSource dataSource();

  abstract Dialect dialect();

  ConnectionProvider connections;
  JdbcEventLog log;
  JdbcSubscriptionRegistry registry;
  JdbcSnapshotStore snapshots;

  @BeforeEach
  void initSchema() {
    connections = new DataSourceConnectionProvider(dataSource());
    SchemaInitializer schema = new SchemaInitializer(connections, dialect());
    schema.initialize();
    schema.reset();
    log = new JdbcEventLog(connections, dialect());
    registry = new JdbcSubscriptionRegistry(connections, dialect());
    snapshots = new JdbcSnapshotStore(connections, dialect());
  }

  // ── Event log ────────────────────────────────────────────────────

  @Test
  void appendAssignsVersionsAndPositions() {
    log.append("cart-1", ExpectedVersion.NO_STREAM,
        List.of(EventData.of("ItemAdded", "{\"sku\":\"A-1\"}"), EventData.of("ItemAdded", "{}")));
    AppendResult other = log.append("cart-2", ExpectedVersion.ANY, List.of(EventData.of("ItemAdded", "{}")));
    AppendResult more = log.append("cart-1", 2, List.of(EventData.of("CheckedOut", "{}")));

    assertEquals(3, other.firstPosition());
    assertEquals(3, more.streamVersion());
    assertEquals(4, more.lastPosition());
    assertEquals(4, log.latestPosition());

    List<RecordedEvent> cart = log.readStreamForward("cart-1", 0, 10);
    assertEquals(List.of(1L, 2L, 4L), cart.stream().map(RecordedEvent::position).toList());
    assertEquals("{\"sku\":\"A-1\"}", new String(cart.get(0).payload(), StandardCharsets.UTF_8));
    assertEquals("cart-1", cart.get(0).streamId());
    assertEquals(more.events().get(0).eventId(), cart.get(2).eventId());
    assertEquals(more.events().get(0).createdAt(), cart.get(2).createdAt());
  }

  @Test
  void readAllForwardIsBounded() {
    for (int i = 0; i < 5; i++) {
      log.append("s-" + (i % 2), ExpectedVersion.ANY, List.of(EventData.of("E", "{}")));
    }

    List<RecordedEvent> page = log.readAllForward(2, 2);
    assertEquals(List.of(2L, 3L), page.stream().map(RecordedEvent::position).toList());
    assertEquals(List.of("s-1", "s-0"), page.stream().map(RecordedEvent::streamId).toList());
    assertTrue(log.readAllForward(6, 10).isEmpty());
    assertTrue(log.readStreamForward("missing", 0, 10).isEmpty());
  }

  @Test
  void wrongExpectedVersionRollsBack() {
    log.append("cart-1", ExpectedVersion.ANY, List.of(EventData.of("E", "{}")));

    ConcurrencyConflictException ex = assertThrows(ConcurrencyConflictException.class,
        () -> log.append("cart-1", ExpectedVersion.NO_STREAM, List.of(EventData.of("E", "{}"))));
    assertEquals(0, ex.expectedVersion());
    assertEquals(1, ex.actualVersion());
    assertThrows(ConcurrencyConflictException.class,
        () -> log.append("cart-9", 4, List.of(EventData.of("E", "{}"))));

    assertEquals(1, log.latestPosition());
    assertTrue(log.streamInfo("cart-9").isEmpty());
  }

  @Test
  void createStreamOnce() {
    assertEquals(0, log.createStream("cart-1").version());
    assertThrows(StreamExistsException.class, () -> log.createStream("cart-1"));
    assertEquals(1, log.append("cart-1", ExpectedVersion.NO_STREAM,
        List.of(EventData.of("E", "{}"))).streamVersion());
    assertEquals(1, log.latestStreamVersion("cart-1"));
  }

  @Test
  void concurrentAppendsKeepPositionsContiguous() throws Exception {
    int writers = 4;
    int perWriter = 25;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int w = 0; w < writers; w++) {
        String streamId = "writer-" + w;
        futures.add(pool.submit(() -> {
          for (int i = 0; i < perWriter; i++) {
            log.append(streamId, ExpectedVersion.ANY, List.of(EventData.of("E", "{}")));
          }
        }));
      }
      for (Future<?> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    List<RecordedEvent> all = log.readAllForward(1, 1000);
    assertEquals(writers * perWriter, all.size());
    for (int i = 0; i < all.size(); i++) {
      assertEquals(i + 1, all.get(i).position());
    }
    assertEquals(perWriter, log.latestStreamVersion("writer-0"));
  }

  // ── Subscription registry ────────────────────────────────────────

  @Test
  void subscribeIsIdempotent() {
    SubscriptionScope scope = SubscriptionScope.stream("cart-1");
    Subscription first = registry.subscribe(scope, "billing", StartFrom.of(3, 2));
    Subscription second = registry.subscribe(scope, "billing", StartFrom.beginning());

    assertEquals(3, second.lastSeenPosition());
    assertEquals(2, second.lastSeenStreamVersion());
    assertEquals(first.createdAt(), second.createdAt());
    assertEquals(1, registry.list().size());
  }

  @Test
  void concurrentFirstSubscribeCreatesOneRow() throws Exception {
    int callers = 6;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Subscription>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return registry.subscribe(SubscriptionScope.allStreams(), "projector", StartFrom.beginning());
        }));
      }
      start.countDown();
      for (Future<Subscription> f : futures) {
        assertEquals(0, f.get(30, TimeUnit.SECONDS).lastSeenPosition());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, registry.list().size());
  }

  @Test
  void ackIsMonotonic() {
    SubscriptionScope scope = SubscriptionScope.allStreams();
    registry.subscribe(scope, "projector", StartFrom.beginning());

    registry.ack(scope, "projector", 5, 0);
    registry.ack(scope, "projector", 5, 0);
    assertThrows(OutOfOrderAckException.class, () -> registry.ack(scope, "projector", 4, 0));
    assertThrows(SubscriptionNotFoundException.class, () -> registry.ack(scope, "nobody", 1, 0));

    Subscription cursor = registry.list().get(0);
    assertEquals(SubscriptionScope.allStreams(), cursor.scope());
    assertEquals(5, cursor.lastSeenPosition());
  }

  @Test
  void unsubscribeDeletesCursor() {
    SubscriptionScope scope = SubscriptionScope.stream("cart-1");
    registry.subscribe(scope, "billing", StartFrom.beginning());
    registry.ack(scope, "billing", 2, 2);

    registry.unsubscribe(scope, "billing");
    registry.unsubscribe(scope, "billing");

    assertTrue(registry.list().isEmpty());
    assertEquals(0, registry.subscribe(scope, "billing", StartFrom.beginning()).lastSeenPosition());
  }

  // ── Snapshots and schema ─────────────────────────────────────────

  @Test
  void snapshotIsReplaced() {
    snapshots.record(new Snapshot("cart-1", 2, "Cart", new byte[] {1}, null, null));
    snapshots.record(new Snapshot("cart-1", 7, "Cart", new byte[] {2, 3}, new byte[] {9}, null));

    Snapshot read = snapshots.read("cart-1").orElseThrow();
    assertEquals(7, read.sourceVersion());
    assertArrayEquals(new byte[] {2, 3}, read.data());
    assertArrayEquals(new byte[] {9}, read.metadata());

    snapshots.delete("cart-1");
    snapshots.delete("cart-1");
    assertTrue(snapshots.read("cart-1").isEmpty());
  }

  @Test
  void resetClearsEverything() {
    log.append("cart-1", ExpectedVersion.ANY, List.of(EventData.of("E", "{}")));
    registry.subscribe(SubscriptionScope.allStreams(), "projector", StartFrom.beginning());
    snapshots.record(new Snapshot("cart-1", 1, "Cart", new byte[] {1}, null, null));

    SchemaInitializer schema = new SchemaInitializer(connections, dialect());
    schema.initialize();
    schema.reset();

    assertEquals(0, log.latestPosition());
    assertTrue(log.streamInfo("cart-1").isEmpty());
    assertTrue(registry.list().isEmpty());
    assertTrue(snapshots.read("cart-1").isEmpty());
    assertEquals(1, log.append("cart-1", ExpectedVersion.NO_STREAM,
        List.of(EventData.of("E", "{}"))).firstPosition());
  }

  // ── End to end ───────────────────────────────────────────────────

  @Test
  void subscriptionResumesFromStoredCursor() throws Exception {
    for (int i = 0; i < 10; i++) {
      log.append("cart-1", ExpectedVersion.ANY, List.of(EventData.of("E", "{}")));
    }
    List<Long> first = new CopyOnWriteArrayList<>();
    CountDownLatch fourDone = new CountDownLatch(4);
    try (EventStore store = newStore()) {
      store.subscribeToStream("cart-1", "totals", (subscription, event) -> {
        if (first.size() < 4) {
          first.add(event.position());
          subscription.ack(event);
          fourDone.countDown();
        }
      });
      assertTrue(fourDone.await(10, TimeUnit.SECONDS));
    }
    assertEquals(List.of(1L, 2L, 3L, 4L), first);

    List<Long> resumed = new CopyOnWriteArrayList<>();
    CountDownLatch rest = new CountDownLatch(7);
    try (EventStore store = newStore()) {
      store.subscribeToStream("cart-1", "totals", (subscription, event) -> {
        resumed.add(event.position());
        subscription.ack(event);
        rest.countDown();
      });
      store.append("cart-1", ExpectedVersion.ANY, List.of(EventData.of("E", "{}")));
      assertTrue(rest.await(10, TimeUnit.SECONDS));
    }
    assertEquals(List.of(5L, 6L, 7L, 8L, 9L, 10L, 11L), resumed);
    assertEquals(11, registry.list().get(0).lastSeenPosition());
  }

  EventStore newStore() {
    return EventStore.builder()
        .eventLog(log)
        .subscriptionRegistry(registry)
        .snapshotStore(snapshots)
        .maxInFlight(3)
        .catchUpBatchSize(4)
        .build();
  }
}
