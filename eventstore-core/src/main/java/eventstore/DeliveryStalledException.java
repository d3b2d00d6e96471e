package eventstore;

/**
 * Raised when a paused subscription's pending queue grows past its configured bound
 * because the consumer stopped acknowledging. The subscription is failed; its durable
 * cursor stays at the last acknowledged position.
 */
public final class DeliveryStalledException extends EventStoreException {

  public DeliveryStalledException(String subscription, int pending, int maxPending) {
    super("Delivery stalled for " + subscription + ": " + pending
        + " pending events exceed limit of " + maxPending);
  }
}
