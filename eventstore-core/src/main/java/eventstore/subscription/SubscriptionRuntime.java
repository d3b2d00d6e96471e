package eventstore.subscription;

import eventstore.DeliveryStalledException;
import eventstore.OutOfOrderAckException;
import eventstore.SubscriptionNotFoundException;
import eventstore.model.RecordedEvent;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;
import eventstore.spi.EventLog;
import eventstore.spi.MetricsExporter;
import eventstore.spi.SubscriptionRegistry;
import eventstore.util.SerialExecutor;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory state machine of one running subscription.
 *
 * <p>All transitions run on the subscription's {@link SerialExecutor} mailbox, driven by
 * three kinds of messages: live notifications, capacity releases after an acknowledgment,
 * and shutdown. The catch-up reader, the pending queue and the in-flight queue are only
 * touched from the mailbox. {@link #lock} guards lifecycle transitions. Acknowledgments are
 * validated and persisted on the caller's thread under {@link #ackLock}, then posted to the
 * mailbox. Concurrent acks reach the registry in cursor order, and a slow registry write never
 * holds up a transition.
 *
 * <p>Delivery order is strictly increasing by global position: catch-up events are
 * delivered first, then queued live events whose position is beyond the last delivered one.
 */
final class SubscriptionRuntime implements SubscriptionHandle {
  private static final Logger logger = Logger.getLogger(SubscriptionRuntime.class.getName());

  private final SubscriptionScope scope;
  private final String name;
  private final String description;
  private final Subscriber subscriber;
  private final EventLog eventLog;
  private final SubscriptionRegistry registry;
  private final LiveFeed liveFeed;
  private final SerialExecutor mailbox;
  private final int maxInFlight;
  private final int maxPendingEvents;
  private final int catchUpBatchSize;
  private final OutOfOrderAckPolicy ackPolicy;
  private final MetricsExporter metrics;
  private final Consumer<SubscriptionRuntime> onTerminated;

  private final Object lock = new Object();
  private final Object ackLock = new Object();
  private volatile SubscriptionState state = SubscriptionState.INITIALIZING;
  private volatile Throwable failure;
  private volatile long ackedPosition;

  // Mailbox-confined
  private CatchUpReader catchUp;
  private final ArrayDeque<RecordedEvent> pending = new ArrayDeque<>();
  private final ArrayDeque<RecordedEvent> inFlight = new ArrayDeque<>();
  private LiveFeed.Registration registration;

  private volatile long lastDeliveredPosition;
  private volatile int inFlightCount;
  private volatile int pendingCount;

  SubscriptionRuntime(SubscriptionScope scope, String name, Subscriber subscriber,
      SubscriptionEngine.Settings settings, Consumer<SubscriptionRuntime> onTerminated) {
    this.scope = scope;
    this.name = name;
    this.description = Subscription.describe(scope, name);
    this.subscriber = subscriber;
    this.eventLog = settings.eventLog();
    this.registry = settings.registry();
    this.liveFeed = settings.liveFeed();
    this.mailbox = new SerialExecutor(settings.executor());
    this.maxInFlight = settings.maxInFlight();
    this.maxPendingEvents = settings.maxPendingEvents();
    this.catchUpBatchSize = settings.catchUpBatchSize();
    this.ackPolicy = settings.ackPolicy();
    this.metrics = settings.metrics();
    this.onTerminated = onTerminated;
  }

  /**
   * Registers with the live feed, captures the catch-up head and schedules catch-up.
   * Runs on the subscribing thread so storage failures reach the caller.
   *
   * @param cursor the resolved durable cursor
   */
  void start(Subscription cursor) {
    ackedPosition = cursor.lastSeenPosition();
    lastDeliveredPosition = cursor.lastSeenPosition();

    // Register before the head is captured: anything appended later arrives live
    LiveFeed.Registration live = liveFeed.register(scope, this::onAppended);
    CatchUpReader reader;
    try {
      reader = new CatchUpReader(eventLog, scope,
          cursor.lastSeenPosition(), cursor.lastSeenStreamVersion(), catchUpBatchSize);
    } catch (RuntimeException e) {
      live.close();
      throw e;
    }
    logger.fine(() -> "Starting " + description + " from position " + cursor.lastSeenPosition()
        + ", catch-up head " + reader.headPosition());
    mailbox.execute(() -> {
      registration = live;
      catchUp = reader;
      if (isTerminal()) {
        live.close();
        return;
      }
      transition(SubscriptionState.CATCHING_UP);
      drain();
    });
  }

  // ── Mailbox messages ─────────────────────────────────────────────

  private void onAppended(List<RecordedEvent> events) {
    mailbox.execute(() -> onLive(events));
  }

  private void onLive(List<RecordedEvent> events) {
    if (isTerminal()) {
      return;
    }
    pending.addAll(events);
    pendingCount = pending.size();
    metrics.recordPendingDepth(pending.size());
    if (state == SubscriptionState.MAX_CAPACITY && pending.size() > maxPendingEvents) {
      fail(new DeliveryStalledException(description, pending.size(), maxPendingEvents));
      return;
    }
    if (state == SubscriptionState.INITIALIZING) {
      // Held until the catch-up reader is installed
      return;
    }
    drain();
  }

  private void onAckReleased(long position) {
    if (isTerminal()) {
      return;
    }
    int released = 0;
    while (!inFlight.isEmpty() && inFlight.peek().position() <= position) {
      inFlight.poll();
      released++;
    }
    inFlightCount = inFlight.size();
    if (released > 0) {
      metrics.recordAcknowledged(released);
    }
    drain();
  }

  /**
   * Delivers as many events as capacity allows, then settles the state: paused if events
   * remain at full capacity, otherwise catching up or live.
   */
  private void drain() {
    try {
      while (!isTerminal() && inFlight.size() < maxInFlight) {
        RecordedEvent next = nextEvent();
        if (next == null) {
          break;
        }
        if (!deliver(next)) {
          return;
        }
      }
      if (isTerminal()) {
        return;
      }
      if (inFlight.size() >= maxInFlight && hasMore()) {
        if (state != SubscriptionState.MAX_CAPACITY) {
          metrics.incrementPaused();
          transition(SubscriptionState.MAX_CAPACITY);
        }
      } else {
        transition(catchUp != null ? SubscriptionState.CATCHING_UP : SubscriptionState.SUBSCRIBED);
      }
    } catch (RuntimeException e) {
      fail(e);
    }
  }

  private RecordedEvent nextEvent() {
    if (catchUp != null) {
      if (catchUp.hasNext()) {
        return catchUp.next();
      }
      finishCatchUp();
    }
    RecordedEvent event;
    while ((event = pending.poll()) != null) {
      // Live events already covered by catch-up are dropped here
      if (event.position() > lastDeliveredPosition) {
        pendingCount = pending.size();
        return event;
      }
    }
    pendingCount = 0;
    return null;
  }

  private boolean hasMore() {
    if (catchUp != null) {
      if (catchUp.hasNext()) {
        return true;
      }
      finishCatchUp();
    }
    while (!pending.isEmpty() && pending.peek().position() <= lastDeliveredPosition) {
      pending.poll();
    }
    pendingCount = pending.size();
    return !pending.isEmpty();
  }

  private void finishCatchUp() {
    logger.fine(() -> description + " caught up at position " + lastDeliveredPosition
        + ", " + pending.size() + " live events queued");
    catchUp = null;
  }

  private boolean deliver(RecordedEvent event) {
    lastDeliveredPosition = event.position();
    inFlight.add(event);
    inFlightCount = inFlight.size();
    metrics.incrementDelivered();
    try {
      subscriber.onEvent(this, event);
      return true;
    } catch (Exception e) {
      fail(e);
      return false;
    }
  }

  // ── Lifecycle ────────────────────────────────────────────────────

  private void transition(SubscriptionState next) {
    SubscriptionState previous;
    synchronized (lock) {
      previous = state;
      if (previous.isTerminal() || previous == next) {
        return;
      }
      state = next;
    }
    logger.fine(() -> description + ": " + previous + " -> " + next);
  }

  /**
   * Moves to a terminal state. Returns {@code false} if already terminal.
   */
  private boolean terminate(SubscriptionState terminal, Throwable cause) {
    synchronized (lock) {
      if (state.isTerminal()) {
        return false;
      }
      state = terminal;
      failure = cause;
    }
    mailbox.execute(() -> {
      if (registration != null) {
        registration.close();
      }
      catchUp = null;
      pending.clear();
      inFlight.clear();
      pendingCount = 0;
      inFlightCount = 0;
    });
    onTerminated.accept(this);
    return true;
  }

  private void fail(Throwable cause) {
    if (!terminate(SubscriptionState.FAILED, cause)) {
      return;
    }
    logger.log(Level.SEVERE, "Failed " + description, cause);
    metrics.incrementFailed();
    try {
      subscriber.onError(cause);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Subscriber onError failed for " + description, e);
    }
  }

  /** Stops delivery and keeps the durable cursor. */
  void stop() {
    if (terminate(SubscriptionState.STOPPED, null)) {
      logger.fine(() -> "Stopped " + description);
    }
  }

  private boolean isTerminal() {
    return state.isTerminal();
  }

  // ── SubscriptionHandle ───────────────────────────────────────────

  @Override
  public void ack(RecordedEvent event) {
    ack(event.position(), scope.isAllStreams() ? 0L : event.streamVersion());
  }

  @Override
  public void ack(long position, long streamVersion) {
    synchronized (ackLock) {
      SubscriptionState current = state;
      if (current.isTerminal()) {
        throw new SubscriptionNotFoundException(description + " is " + current);
      }
      if (position < ackedPosition) {
        if (ackPolicy == OutOfOrderAckPolicy.IGNORE) {
          logger.fine(() -> "Ignoring out-of-order ack " + position + " for " + description);
          return;
        }
        throw new OutOfOrderAckException(description, ackedPosition, position);
      }
      if (position == ackedPosition) {
        return;
      }
      if (position > lastDeliveredPosition) {
        throw new IllegalArgumentException("Cannot ack position " + position + " for " + description
            + ": last delivered position is " + lastDeliveredPosition);
      }
      registry.ack(scope, name, position, streamVersion);
      ackedPosition = position;
    }
    mailbox.execute(() -> onAckReleased(position));
  }

  @Override
  public void unsubscribe() {
    if (terminate(SubscriptionState.UNSUBSCRIBED, null)) {
      logger.fine(() -> "Unsubscribed " + description + " at position " + lastAcknowledgedPosition());
    }
  }

  @Override
  public SubscriptionScope scope() {
    return scope;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public SubscriptionState state() {
    return state;
  }

  @Override
  public int inFlight() {
    return inFlightCount;
  }

  @Override
  public int pending() {
    return pendingCount;
  }

  @Override
  public long lastDeliveredPosition() {
    return lastDeliveredPosition;
  }

  @Override
  public long lastAcknowledgedPosition() {
    return ackedPosition;
  }

  @Override
  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return description + " [" + state + "]";
  }
}
