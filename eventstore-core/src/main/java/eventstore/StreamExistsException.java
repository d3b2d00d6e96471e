package eventstore;

/**
 * Thrown by {@link eventstore.spi.EventLog#createStream} when the stream already exists.
 */
public final class StreamExistsException extends EventStoreException {

  public StreamExistsException(String streamId) {
    super("Stream already exists: " + streamId);
  }
}
