package eventstore.subscription;

import eventstore.model.RecordedEvent;

/**
 * Consumer of a subscription's events.
 *
 * <h2>Execution Model</h2>
 * <p>Events are delivered <b>synchronously</b>, one at a time and in strictly increasing
 * global position, on the subscription's own mailbox. A slow subscriber therefore slows
 * only its own subscription. At most {@code maxInFlight} events are delivered without
 * being acknowledged; after that, delivery pauses until
 * {@link SubscriptionHandle#ack(RecordedEvent)} is called.
 *
 * <h2>Error Handling</h2>
 * <p>If {@link #onEvent} throws, the subscription is failed and {@link #onError} is called.
 * The durable cursor stays at the last acknowledged position, so subscribing again
 * re-delivers every unacknowledged event (at-least-once).
 *
 * <h2>Example</h2>
 * <pre>{@code
 * engine.subscribe(SubscriptionScope.stream("cart-1"), "billing", (subscription, event) -> {
 *   billing.apply(event);
 *   subscription.ack(event);
 * });
 * }</pre>
 */
@FunctionalInterface
public interface Subscriber {

  /**
   * Processes one event.
   *
   * @param subscription handle of the delivering subscription, used to acknowledge
   * @param event        the delivered event
   * @throws Exception if processing fails; the subscription is then failed
   */
  void onEvent(SubscriptionHandle subscription, RecordedEvent event) throws Exception;

  /**
   * Called once when the subscription terminates with an error, such as
   * {@link eventstore.DeliveryStalledException} or a storage failure during catch-up.
   *
   * @param cause the terminating error
   */
  default void onError(Throwable cause) {
  }
}
