package eventstore.inmemory;

import eventstore.OutOfOrderAckException;
import eventstore.SubscriptionNotFoundException;
import eventstore.model.StartFrom;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;
import eventstore.spi.SubscriptionRegistry;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SubscriptionRegistry} kept in process memory, in creation order.
 */
public final class InMemorySubscriptionRegistry implements SubscriptionRegistry {
  private final Clock clock;
  private final Map<Key, Subscription> subscriptions = new LinkedHashMap<>();

  public InMemorySubscriptionRegistry() {
    this(Clock.systemUTC());
  }

  public InMemorySubscriptionRegistry(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized Subscription subscribe(SubscriptionScope scope, String name, StartFrom startFrom) {
    return subscriptions.computeIfAbsent(new Key(scope, name), key -> new Subscription(
        scope, name, startFrom.position(), startFrom.streamVersion(), clock.instant()));
  }

  @Override
  public synchronized void ack(SubscriptionScope scope, String name, long lastPosition, long lastStreamVersion) {
    Key key = new Key(scope, name);
    Subscription current = subscriptions.get(key);
    if (current == null) {
      throw new SubscriptionNotFoundException(Subscription.describe(scope, name) + " not found");
    }
    if (lastPosition < current.lastSeenPosition()) {
      throw new OutOfOrderAckException(current.describe(), current.lastSeenPosition(), lastPosition);
    }
    if (lastPosition == current.lastSeenPosition()) {
      return;
    }
    subscriptions.put(key, new Subscription(
        scope, name, lastPosition, lastStreamVersion, current.createdAt()));
  }

  @Override
  public synchronized void unsubscribe(SubscriptionScope scope, String name) {
    subscriptions.remove(new Key(scope, name));
  }

  @Override
  public synchronized List<Subscription> list() {
    return List.copyOf(subscriptions.values());
  }

  private record Key(SubscriptionScope scope, String name) {
  }
}
