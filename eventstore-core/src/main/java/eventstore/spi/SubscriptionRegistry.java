package eventstore.spi;

import eventstore.model.StartFrom;
import eventstore.model.Subscription;
import eventstore.model.SubscriptionScope;

import java.util.List;

/**
 * Durable record of named subscriptions and their last acknowledged positions.
 *
 * <p>Each operation must be atomic with respect to concurrent calls for the same
 * {@code (scope, name)} key.
 */
public interface SubscriptionRegistry {

  /**
   * Creates the cursor seeded at {@code startFrom} if none exists for {@code (scope, name)};
   * otherwise returns the existing cursor untouched. At most one record is ever created
   * per key, even under concurrent calls.
   */
  Subscription subscribe(SubscriptionScope scope, String name, StartFrom startFrom);

  /**
   * Persists a new cursor value.
   *
   * <p>Acknowledging the current position again is a no-op.
   *
   * @throws eventstore.SubscriptionNotFoundException if no such subscription exists
   * @throws eventstore.OutOfOrderAckException if {@code lastPosition} is behind the stored cursor
   */
  void ack(SubscriptionScope scope, String name, long lastPosition, long lastStreamVersion);

  /**
   * Deletes the durable record. Idempotent: unknown subscriptions are ignored.
   */
  void unsubscribe(SubscriptionScope scope, String name);

  /**
   * Returns all known subscriptions, any scope.
   */
  List<Subscription> list();
}
