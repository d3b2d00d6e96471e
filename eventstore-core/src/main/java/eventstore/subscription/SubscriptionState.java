package eventstore.subscription;

/**
 * Lifecycle of a running subscription.
 *
 * <p>{@code INITIALIZING -> CATCHING_UP -> SUBSCRIBED}, with {@code MAX_CAPACITY} entered
 * from either of the last two whenever in-flight events reach the capacity limit and left
 * again once acknowledgments free a slot. Every non-terminal state may move to one of the
 * terminal states {@code UNSUBSCRIBED}, {@code FAILED} or {@code STOPPED}.
 */
public enum SubscriptionState {
  /** Cursor resolved, live feed registered, catch-up not yet started. */
  INITIALIZING,
  /** Replaying historical events; live notifications are queued. */
  CATCHING_UP,
  /** Caught up; live notifications are delivered as they arrive. */
  SUBSCRIBED,
  /** Delivery paused until acknowledgments free in-flight capacity. */
  MAX_CAPACITY,
  /** Explicitly unsubscribed; acknowledgments are refused from now on. */
  UNSUBSCRIBED,
  /** Terminated by an error; the durable cursor is kept. */
  FAILED,
  /** Stopped by engine shutdown; the durable cursor is kept. */
  STOPPED;

  public boolean isTerminal() {
    return this == UNSUBSCRIBED || this == FAILED || this == STOPPED;
  }
}
