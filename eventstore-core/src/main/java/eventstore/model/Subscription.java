package eventstore.model;

import java.time.Instant;

/**
 * Durable cursor of a named subscription: the last acknowledged global position and,
 * for single-stream scopes, the last acknowledged stream version. Zero means nothing
 * has been acknowledged yet.
 *
 * @see eventstore.spi.SubscriptionRegistry
 */
public record Subscription(
    SubscriptionScope scope,
    String name,
    long lastSeenPosition,
    long lastSeenStreamVersion,
    Instant createdAt
) {

  /** Human-readable identifier used in log and exception messages. */
  public String describe() {
    return describe(scope, name);
  }

  public static String describe(SubscriptionScope scope, String name) {
    return "subscription '" + name + "' on " + scope;
  }
}
