package eventstore;

import eventstore.inmemory.InMemoryEventLog;
import eventstore.inmemory.InMemorySnapshotStore;
import eventstore.inmemory.InMemorySubscriptionRegistry;
import eventstore.model.RecordedEvent;
import eventstore.model.Snapshot;
import eventstore.model.StartFrom;
import eventstore.model.StreamInfo;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;
import eventstore.spi.EventLog;
import eventstore.spi.MetricsExporter;
import eventstore.spi.SnapshotStore;
import eventstore.spi.SubscriptionRegistry;
import eventstore.subscription.LiveFeed;
import eventstore.subscription.OutOfOrderAckPolicy;
import eventstore.subscription.Subscriber;
import eventstore.subscription.SubscriptionEngine;
import eventstore.subscription.SubscriptionHandle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires an {@link EventWriter}, a {@link LiveFeed} and a
 * {@link SubscriptionEngine} over one set of storage backends into a single
 * {@link AutoCloseable} unit.
 *
 * <p>All appends go through the writer, which publishes each committed batch to the live
 * feed, so running subscriptions see every event exactly once and in position order.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventStore store = EventStore.builder()
 *     .eventLog(new JdbcEventLog(connectionProvider, dialect))
 *     .subscriptionRegistry(new JdbcSubscriptionRegistry(connectionProvider, dialect))
 *     .snapshotStore(new JdbcSnapshotStore(connectionProvider, dialect))
 *     .build()) {
 *   store.append("order-42", ExpectedVersion.NO_STREAM, List.of(EventData.of("OrderPlaced", "{}")));
 *   store.subscribeToAllStreams("projector", (subscription, event) -> subscription.ack(event));
 * }
 * }</pre>
 *
 * @see EventWriter
 * @see SubscriptionEngine
 */
public final class EventStore implements AutoCloseable {

  private final EventLog eventLog;
  private final SnapshotStore snapshotStore;
  private final EventWriter writer;
  private final LiveFeed liveFeed;
  private final SubscriptionEngine engine;
  private final MetricsExporter metrics;

  private EventStore(Builder builder) {
    this.eventLog = builder.eventLog;
    this.snapshotStore = builder.snapshotStore;
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.liveFeed = new LiveFeed();
    this.writer = new EventWriter(eventLog, liveFeed, metrics);
    SubscriptionEngine.Builder eb = SubscriptionEngine.builder()
        .eventLog(eventLog)
        .registry(builder.subscriptionRegistry)
        .liveFeed(liveFeed)
        .maxInFlight(builder.maxInFlight)
        .catchUpBatchSize(builder.catchUpBatchSize)
        .maxPendingEvents(builder.maxPendingEvents)
        .ackPolicy(builder.ackPolicy)
        .metrics(metrics)
        .drainTimeoutMs(builder.drainTimeoutMs);
    if (builder.executor != null) {
      eb.executor(builder.executor);
    }
    this.engine = eb.build();
  }

  /**
   * Creates a builder; storage backends must be supplied.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a builder preset with in-memory backends, for tests and demos.
   *
   * @return a new builder
   */
  public static Builder inMemory() {
    return new Builder()
        .eventLog(new InMemoryEventLog())
        .subscriptionRegistry(new InMemorySubscriptionRegistry())
        .snapshotStore(new InMemorySnapshotStore());
  }

  // ── Streams ──────────────────────────────────────────────────────

  /**
   * @throws StreamExistsException if the stream already exists
   */
  public StreamInfo createStream(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    if (SubscriptionScope.ALL_STREAMS_KEY.equals(streamId)) {
      throw new IllegalArgumentException(streamId + " is a reserved stream id");
    }
    return eventLog.createStream(streamId);
  }

  /**
   * @see EventWriter#append(String, long, List)
   */
  public AppendResult append(String streamId, long expectedVersion, List<EventData> events) {
    return writer.append(streamId, expectedVersion, events);
  }

  public List<RecordedEvent> readStreamForward(String streamId, long startVersion, int maxCount) {
    return eventLog.readStreamForward(streamId, startVersion, maxCount);
  }

  public List<RecordedEvent> readAllForward(long startPosition, int maxCount) {
    return eventLog.readAllForward(startPosition, maxCount);
  }

  public long latestPosition() {
    return eventLog.latestPosition();
  }

  public Optional<StreamInfo> streamInfo(String streamId) {
    return eventLog.streamInfo(streamId);
  }

  // ── Subscriptions ────────────────────────────────────────────────

  public SubscriptionHandle subscribeToStream(String streamId, String name, Subscriber subscriber) {
    return engine.subscribe(SubscriptionScope.stream(streamId), name, subscriber);
  }

  public SubscriptionHandle subscribeToAllStreams(String name, Subscriber subscriber) {
    return engine.subscribe(SubscriptionScope.allStreams(), name, subscriber);
  }

  /**
   * @see SubscriptionEngine#subscribe(SubscriptionScope, String, StartFrom, Subscriber)
   */
  public SubscriptionHandle subscribe(SubscriptionScope scope, String name, StartFrom startFrom,
      Subscriber subscriber) {
    return engine.subscribe(scope, name, startFrom, subscriber);
  }

  /**
   * @see SubscriptionEngine#ack(SubscriptionScope, String, long, long)
   */
  public void ack(SubscriptionScope scope, String name, long position, long streamVersion) {
    engine.ack(scope, name, position, streamVersion);
  }

  public void unsubscribe(SubscriptionScope scope, String name) {
    engine.unsubscribe(scope, name);
  }

  public void deleteSubscription(SubscriptionScope scope, String name) {
    engine.deleteSubscription(scope, name);
  }

  public List<Subscription> subscriptions() {
    return engine.subscriptions();
  }

  // ── Snapshots ────────────────────────────────────────────────────

  public Optional<Snapshot> readSnapshot(String sourceId) {
    return snapshotStore.read(sourceId);
  }

  public void recordSnapshot(Snapshot snapshot) {
    snapshotStore.record(snapshot);
  }

  public void deleteSnapshot(String sourceId) {
    snapshotStore.delete(sourceId);
  }

  public EventWriter writer() {
    return writer;
  }

  public SubscriptionEngine engine() {
    return engine;
  }

  /**
   * Stops all subscriptions (their durable cursors are kept), then closes the metrics exporter
   * if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      engine.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new EventStoreException("Failed to close metrics", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link EventStore}. */
  public static final class Builder {
    EventLog eventLog;
    SubscriptionRegistry subscriptionRegistry;
    SnapshotStore snapshotStore;
    MetricsExporter metrics;
    Executor executor;
    int maxInFlight = 100;
    int catchUpBatchSize = 500;
    int maxPendingEvents = 10_000;
    OutOfOrderAckPolicy ackPolicy = OutOfOrderAckPolicy.REJECT;
    long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the event log.
     *
     * <p><b>Required.</b>
     *
     * @param eventLog the event log
     * @return this builder
     */
    public Builder eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /**
     * Sets the durable subscription registry.
     *
     * <p><b>Required.</b>
     *
     * @param subscriptionRegistry the registry
     * @return this builder
     */
    public Builder subscriptionRegistry(SubscriptionRegistry subscriptionRegistry) {
      this.subscriptionRegistry = subscriptionRegistry;
      return this;
    }

    /**
     * Sets the snapshot store.
     *
     * <p><b>Required.</b>
     *
     * @param snapshotStore the snapshot store
     * @return this builder
     */
    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /**
     * Sets the metrics exporter. Closed with the store if it is {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** @see SubscriptionEngine.Builder#executor(Executor) */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /** @see SubscriptionEngine.Builder#maxInFlight(int) */
    public Builder maxInFlight(int maxInFlight) {
      this.maxInFlight = maxInFlight;
      return this;
    }

    /** @see SubscriptionEngine.Builder#catchUpBatchSize(int) */
    public Builder catchUpBatchSize(int catchUpBatchSize) {
      this.catchUpBatchSize = catchUpBatchSize;
      return this;
    }

    /** @see SubscriptionEngine.Builder#maxPendingEvents(int) */
    public Builder maxPendingEvents(int maxPendingEvents) {
      this.maxPendingEvents = maxPendingEvents;
      return this;
    }

    /** @see SubscriptionEngine.Builder#ackPolicy(OutOfOrderAckPolicy) */
    public Builder ackPolicy(OutOfOrderAckPolicy ackPolicy) {
      this.ackPolicy = ackPolicy;
      return this;
    }

    /** @see SubscriptionEngine.Builder#drainTimeoutMs(long) */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @throws NullPointerException if a required backend is missing
     * @throws IllegalStateException if build() was already called
     */
    public EventStore build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(eventLog, "eventLog");
      Objects.requireNonNull(subscriptionRegistry, "subscriptionRegistry");
      Objects.requireNonNull(snapshotStore, "snapshotStore");
      return new EventStore(this);
    }
  }
}
