package eventstore;

/**
 * Base class for all unchecked errors raised by the event store and its subscriptions.
 */
public class EventStoreException extends RuntimeException {

  public EventStoreException(String message) {
    super(message);
  }

  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
