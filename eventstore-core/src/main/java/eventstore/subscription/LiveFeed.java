package eventstore.subscription;

import eventstore.model.RecordedEvent;
import eventstore.model.SubscriptionScope;
import eventstore.spi.AppendHook;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide broadcast of newly appended events to registered listeners.
 *
 * <p>Listeners register for one stream or for all streams
 * ({@link SubscriptionScope#ALL_STREAMS_KEY}). Each published batch is handed to the
 * stream's listeners first, then to all-streams listeners, in registration order.
 *
 * <h2>Thread Safety</h2>
 * <p>Registration, deregistration and publication may run concurrently. A listener whose
 * registration completed before a publish starts receives that publish; one registered
 * afterwards does not. Publication order equals append order as long as publishes are
 * not issued concurrently, which {@link eventstore.EventWriter} guarantees.
 *
 * @see eventstore.EventWriter
 */
public final class LiveFeed implements AppendHook {
  private static final Logger logger = Logger.getLogger(LiveFeed.class.getName());

  private final Map<String, CopyOnWriteArrayList<Listener>> listeners = new ConcurrentHashMap<>();

  /**
   * Registers a listener for a scope.
   *
   * @param scope    stream or all-streams scope
   * @param listener receives every batch appended within the scope
   * @return registration handle; closing it deregisters the listener
   */
  public Registration register(SubscriptionScope scope, Listener listener) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(listener, "listener");
    String key = scope.key();
    listeners.compute(key, (k, list) -> {
      CopyOnWriteArrayList<Listener> result = list == null ? new CopyOnWriteArrayList<>() : list;
      result.add(listener);
      return result;
    });
    return () -> listeners.computeIfPresent(key, (k, list) -> {
      list.remove(listener);
      return list.isEmpty() ? null : list;
    });
  }

  @Override
  public void afterAppend(List<RecordedEvent> events) {
    publish(events);
  }

  /**
   * Publishes one committed append batch. All events of a batch belong to one stream.
   *
   * @param events committed events in append order
   */
  public void publish(List<RecordedEvent> events) {
    if (events == null || events.isEmpty()) {
      return;
    }
    List<RecordedEvent> batch = List.copyOf(events);
    deliver(listeners.get(batch.get(0).streamId()), batch);
    deliver(listeners.get(SubscriptionScope.ALL_STREAMS_KEY), batch);
  }

  /** Number of registered listeners across all scopes. */
  public int listenerCount() {
    int count = 0;
    for (CopyOnWriteArrayList<Listener> list : listeners.values()) {
      count += list.size();
    }
    return count;
  }

  private void deliver(List<Listener> targets, List<RecordedEvent> batch) {
    if (targets == null) {
      return;
    }
    for (Listener listener : targets) {
      try {
        listener.onAppended(batch);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Live feed listener failed", e);
      }
    }
  }

  /** Receiver of appended batches. Must not block. */
  @FunctionalInterface
  public interface Listener {
    void onAppended(List<RecordedEvent> events);
  }

  /** Deregisters a listener when closed. Closing twice is harmless. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
