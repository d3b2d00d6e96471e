package eventstore;

/**
 * Thrown when acknowledging or otherwise addressing a subscription that has no durable
 * record, or whose runtime has already terminated.
 */
public final class SubscriptionNotFoundException extends EventStoreException {

  public SubscriptionNotFoundException(String message) {
    super(message);
  }
}
