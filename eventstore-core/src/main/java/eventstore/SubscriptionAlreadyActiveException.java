package eventstore;

/**
 * Thrown when subscribing with a (scope, name) pair that already has a running subscription
 * in this engine.
 */
public final class SubscriptionAlreadyActiveException extends EventStoreException {

  public SubscriptionAlreadyActiveException(String subscription) {
    super("Subscription already active: " + subscription);
  }
}
