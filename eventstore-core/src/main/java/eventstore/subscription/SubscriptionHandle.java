package eventstore.subscription;

import eventstore.model.RecordedEvent;
import eventstore.model.SubscriptionScope;

import java.util.Optional;

/**
 * Handle to a running subscription returned by
 * {@link SubscriptionEngine#subscribe(SubscriptionScope, String, Subscriber)}.
 */
public interface SubscriptionHandle {

  SubscriptionScope scope();

  String name();

  SubscriptionState state();

  /**
   * Acknowledges every delivered event up to and including {@code event}.
   *
   * @see #ack(long, long)
   */
  void ack(RecordedEvent event);

  /**
   * Acknowledges every delivered event with position &le; {@code position} and persists the
   * cursor. Batched acknowledgments release all covered in-flight events at once.
   *
   * @param position      global position of the last fully processed event
   * @param streamVersion its stream version (single-stream scopes; {@code 0} otherwise)
   * @throws eventstore.SubscriptionNotFoundException if the subscription has terminated
   * @throws eventstore.OutOfOrderAckException if {@code position} is behind the cursor and
   *     the policy is {@link OutOfOrderAckPolicy#REJECT}
   * @throws IllegalArgumentException if {@code position} was never delivered
   */
  void ack(long position, long streamVersion);

  /**
   * Stops delivery. The durable cursor is kept, so subscribing again under the same name
   * resumes after the last acknowledged event. Idempotent.
   *
   * @see SubscriptionEngine#deleteSubscription(SubscriptionScope, String)
   */
  void unsubscribe();

  /** Delivered but not yet acknowledged events. */
  int inFlight();

  /** Events queued for delivery. */
  int pending();

  long lastDeliveredPosition();

  long lastAcknowledgedPosition();

  /** The error that failed this subscription, if any. */
  Optional<Throwable> failure();
}
