package eventstore.model;

import java.util.Objects;

/**
 * What a subscription observes: one named stream, or every stream in the log.
 *
 * <p>The all-streams scope is persisted under the reserved key {@value #ALL_STREAMS_KEY};
 * no real stream may use that id.
 */
public final class SubscriptionScope {
  public static final String ALL_STREAMS_KEY = "$all";

  private static final SubscriptionScope ALL = new SubscriptionScope(ALL_STREAMS_KEY);

  private final String key;

  private SubscriptionScope(String key) {
    this.key = key;
  }

  public static SubscriptionScope stream(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    if (streamId.isEmpty()) {
      throw new IllegalArgumentException("streamId cannot be empty");
    }
    if (ALL_STREAMS_KEY.equals(streamId)) {
      throw new IllegalArgumentException(ALL_STREAMS_KEY + " is reserved for the all-streams scope");
    }
    return new SubscriptionScope(streamId);
  }

  public static SubscriptionScope allStreams() {
    return ALL;
  }

  /** Rebuilds a scope from its persisted key. */
  public static SubscriptionScope fromKey(String key) {
    return ALL_STREAMS_KEY.equals(key) ? ALL : stream(key);
  }

  public boolean isAllStreams() {
    return ALL_STREAMS_KEY.equals(key);
  }

  /**
   * Returns the stream id of a single-stream scope.
   *
   * @throws IllegalStateException for the all-streams scope
   */
  public String streamId() {
    if (isAllStreams()) {
      throw new IllegalStateException("All-streams scope has no stream id");
    }
    return key;
  }

  public String key() {
    return key;
  }

  /** Whether an event appended to {@code streamId} belongs to this scope. */
  public boolean includes(String streamId) {
    return isAllStreams() || key.equals(streamId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SubscriptionScope other)) return false;
    return key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }
}
