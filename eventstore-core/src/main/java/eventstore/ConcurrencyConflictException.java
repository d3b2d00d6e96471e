package eventstore;

/**
 * Thrown when an append's expected version does not match the stream's current version.
 * Never retried by the store; resolving the conflict is the appender's concern.
 */
public final class ConcurrencyConflictException extends EventStoreException {
  private final String streamId;
  private final long expectedVersion;
  private final long actualVersion;

  public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
    super("Wrong expected version for stream " + streamId
        + ": expected=" + expectedVersion + ", actual=" + actualVersion);
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String streamId() {
    return streamId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }

  public long actualVersion() {
    return actualVersion;
  }
}
