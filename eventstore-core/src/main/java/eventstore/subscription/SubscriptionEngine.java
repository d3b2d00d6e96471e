package eventstore.subscription;

import eventstore.SubscriptionAlreadyActiveException;
import eventstore.SubscriptionNotFoundException;
import eventstore.model.StartFrom;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;
import eventstore.spi.EventLog;
import eventstore.spi.MetricsExporter;
import eventstore.spi.SubscriptionRegistry;
import eventstore.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs persistent subscriptions: each one catches up from its durable cursor, then follows
 * the {@link LiveFeed}, with at most {@code maxInFlight} unacknowledged events outstanding.
 *
 * <p>Every active subscription is a small actor. Its messages run one at a time on a
 * {@link eventstore.util.SerialExecutor} backed by a shared worker pool, so a slow subscriber
 * only holds back its own mailbox.
 *
 * <p>At most one active subscription exists per {@code (scope, name)} on an engine. Closing the
 * engine stops every subscription (state {@link SubscriptionState#STOPPED}) without touching
 * the durable cursors; subscribing again later resumes after the last acknowledged event.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SubscriptionEngine engine = SubscriptionEngine.builder()
 *     .eventLog(log)
 *     .registry(registry)
 *     .liveFeed(feed)
 *     .maxInFlight(50)
 *     .build()) {
 *   engine.subscribe(SubscriptionScope.allStreams(), "projector",
 *       (subscription, event) -> {
 *         project(event);
 *         subscription.ack(event);
 *       });
 * }
 * }</pre>
 */
public final class SubscriptionEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SubscriptionEngine.class.getName());

  private final Settings settings;
  private final ExecutorService ownedExecutor;
  private final long drainTimeoutMs;
  private final ConcurrentHashMap<Key, SubscriptionRuntime> active = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SubscriptionEngine(Builder builder) {
    Objects.requireNonNull(builder.eventLog, "eventLog");
    Objects.requireNonNull(builder.registry, "registry");
    Objects.requireNonNull(builder.liveFeed, "liveFeed");
    if (builder.maxInFlight <= 0) {
      throw new IllegalArgumentException("maxInFlight must be > 0");
    }
    if (builder.catchUpBatchSize <= 0) {
      throw new IllegalArgumentException("catchUpBatchSize must be > 0");
    }
    if (builder.maxPendingEvents <= 0) {
      throw new IllegalArgumentException("maxPendingEvents must be > 0");
    }
    Executor executor = builder.executor;
    if (executor == null) {
      ownedExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("eventstore-subscription-"));
      executor = ownedExecutor;
    } else {
      ownedExecutor = null;
    }
    this.settings = new Settings(
        builder.eventLog,
        builder.registry,
        builder.liveFeed,
        executor,
        builder.maxInFlight,
        builder.catchUpBatchSize,
        builder.maxPendingEvents,
        builder.ackPolicy == null ? OutOfOrderAckPolicy.REJECT : builder.ackPolicy,
        builder.metrics == null ? MetricsExporter.NOOP : builder.metrics);
    this.drainTimeoutMs = builder.drainTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes from the beginning of the scope, or resumes an existing durable cursor.
   *
   * @see #subscribe(SubscriptionScope, String, StartFrom, Subscriber)
   */
  public SubscriptionHandle subscribe(SubscriptionScope scope, String name, Subscriber subscriber) {
    return subscribe(scope, name, StartFrom.beginning(), subscriber);
  }

  /**
   * Creates or locates the durable cursor for {@code (scope, name)} and starts delivery after it.
   * {@code startFrom} only seeds a cursor that does not exist yet.
   *
   * @throws SubscriptionAlreadyActiveException if this engine already runs that subscription
   * @throws IllegalStateException if the engine is closed
   */
  public SubscriptionHandle subscribe(SubscriptionScope scope, String name, StartFrom startFrom,
      Subscriber subscriber) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(startFrom, "startFrom");
    Objects.requireNonNull(subscriber, "subscriber");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    if (closed.get()) {
      throw new IllegalStateException("SubscriptionEngine is closed");
    }

    Key key = new Key(scope, name);
    SubscriptionRuntime runtime = new SubscriptionRuntime(scope, name, subscriber, settings,
        this::terminated);
    if (active.putIfAbsent(key, runtime) != null) {
      throw new SubscriptionAlreadyActiveException(Subscription.describe(scope, name));
    }
    try {
      Subscription cursor = settings.registry().subscribe(scope, name, startFrom);
      runtime.start(cursor);
    } catch (RuntimeException e) {
      active.remove(key, runtime);
      throw e;
    }
    recordActive();
    logger.info(() -> "Subscribed " + Subscription.describe(scope, name));
    return runtime;
  }

  /**
   * Acknowledges on behalf of a subscription running on this engine, releasing its in-flight
   * capacity.
   *
   * @throws SubscriptionNotFoundException if no subscription for {@code (scope, name)} is
   *     running here, including after it was unsubscribed, failed or stopped
   */
  public void ack(SubscriptionScope scope, String name, long position, long streamVersion) {
    SubscriptionRuntime runtime = active.get(new Key(scope, name));
    if (runtime == null) {
      throw new SubscriptionNotFoundException(Subscription.describe(scope, name) + " is not running");
    }
    runtime.ack(position, streamVersion);
  }

  /**
   * Stops the subscription if it runs on this engine, keeping its durable cursor. Idempotent.
   */
  public void unsubscribe(SubscriptionScope scope, String name) {
    SubscriptionRuntime runtime = active.get(new Key(scope, name));
    if (runtime != null) {
      runtime.unsubscribe();
    }
  }

  /**
   * Stops the subscription if it runs here and deletes its durable cursor. Subscribing again
   * afterwards starts a new cursor. Idempotent.
   */
  public void deleteSubscription(SubscriptionScope scope, String name) {
    unsubscribe(scope, name);
    settings.registry().unsubscribe(scope, name);
    logger.info(() -> "Deleted " + Subscription.describe(scope, name));
  }

  /** All durable subscriptions, whether or not they are running on this engine. */
  public List<Subscription> subscriptions() {
    return settings.registry().list();
  }

  /** Returns the running subscription for {@code (scope, name)}, if any. */
  public Optional<SubscriptionHandle> find(SubscriptionScope scope, String name) {
    return Optional.ofNullable(active.get(new Key(scope, name)));
  }

  public int activeCount() {
    return active.size();
  }

  private void terminated(SubscriptionRuntime runtime) {
    active.remove(new Key(runtime.scope(), runtime.name()), runtime);
    recordActive();
  }

  private void recordActive() {
    settings.metrics().recordActiveSubscriptions(active.size());
  }

  /**
   * Stops every running subscription, then shuts down the worker pool if this engine created
   * it, waiting up to {@code drainTimeoutMs} for mailboxes to finish.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (SubscriptionRuntime runtime : List.copyOf(active.values())) {
      runtime.stop();
    }
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing subscription shutdown");
        ownedExecutor.shutdownNow();
        ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  record Settings(
      EventLog eventLog,
      SubscriptionRegistry registry,
      LiveFeed liveFeed,
      Executor executor,
      int maxInFlight,
      int catchUpBatchSize,
      int maxPendingEvents,
      OutOfOrderAckPolicy ackPolicy,
      MetricsExporter metrics) {
  }

  private record Key(SubscriptionScope scope, String name) {
  }

  /** Builder for {@link SubscriptionEngine}. */
  public static final class Builder {
    private EventLog eventLog;
    private SubscriptionRegistry registry;
    private LiveFeed liveFeed;
    private Executor executor;
    private int maxInFlight = 100;
    private int catchUpBatchSize = 500;
    private int maxPendingEvents = 10_000;
    private OutOfOrderAckPolicy ackPolicy = OutOfOrderAckPolicy.REJECT;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the log that catch-up reads from.
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
     * Sets the durable cursor store.
     *
     * <p><b>Required.</b>
     *
     * @param registry the subscription registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the feed of newly appended events. Must be the hook of the writer appending to
     * {@link #eventLog(EventLog)}.
     *
     * <p><b>Required.</b>
     *
     * @param liveFeed the live feed
     * @return this builder
     */
    public Builder liveFeed(LiveFeed liveFeed) {
      this.liveFeed = liveFeed;
      return this;
    }

    /**
     * Sets the pool that runs subscription mailboxes. The caller owns its lifecycle.
     *
     * <p>Optional. Defaults to a cached pool of daemon threads, shut down by {@link #close()}.
     *
     * @param executor the worker pool
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the maximum number of delivered but unacknowledged events per subscription.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @param maxInFlight in-flight limit
     * @return this builder
     */
    public Builder maxInFlight(int maxInFlight) {
      this.maxInFlight = maxInFlight;
      return this;
    }

    /**
     * Sets how many events a catch-up read fetches at a time.
     *
     * <p>Optional. Defaults to {@code 500}.
     *
     * @param catchUpBatchSize events per read
     * @return this builder
     */
    public Builder catchUpBatchSize(int catchUpBatchSize) {
      this.catchUpBatchSize = catchUpBatchSize;
      return this;
    }

    /**
     * Sets how many live events may queue behind a paused subscription before it fails with
     * {@link eventstore.DeliveryStalledException}.
     *
     * <p>Optional. Defaults to {@code 10000}.
     *
     * @param maxPendingEvents pending queue limit
     * @return this builder
     */
    public Builder maxPendingEvents(int maxPendingEvents) {
      this.maxPendingEvents = maxPendingEvents;
      return this;
    }

    /**
     * Sets how an acknowledgment behind the cursor is handled.
     *
     * <p>Optional. Defaults to {@link OutOfOrderAckPolicy#REJECT}.
     *
     * @param ackPolicy the policy
     * @return this builder
     */
    public Builder ackPolicy(OutOfOrderAckPolicy ackPolicy) {
      this.ackPolicy = ackPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter.
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

    /**
     * Sets the maximum time in milliseconds to wait for mailboxes during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @throws NullPointerException if {@code eventLog}, {@code registry} or {@code liveFeed} is null
     * @throws IllegalArgumentException if any limit is &le; 0
     */
    public SubscriptionEngine build() {
      return new SubscriptionEngine(this);
    }
  }
}
