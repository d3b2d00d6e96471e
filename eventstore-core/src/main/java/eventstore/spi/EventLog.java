package eventstore.spi;

import eventstore.AppendResult;
import eventstore.EventData;
import eventstore.model.RecordedEvent;
import eventstore.model.StreamInfo;

import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only storage of events keyed by stream and by global position.
 *
 * <p>The subscription engine depends only on this contract, so backends can be swapped:
 * {@link eventstore.inmemory.InMemoryEventLog} for tests, the JDBC implementations in the
 * {@code eventstore-jdbc} module for production. Implementations must assign stream
 * versions and global positions contiguously and must be safe for concurrent use.
 *
 * @see eventstore.EventWriter
 */
public interface EventLog {

  /**
   * Creates an empty stream.
   *
   * @param streamId caller-supplied unique stream id
   * @return the new stream's info (version 0)
   * @throws eventstore.StreamExistsException if the stream already exists
   */
  StreamInfo createStream(String streamId);

  /**
   * Appends events to a stream after checking its current version.
   *
   * @param streamId        target stream
   * @param expectedVersion concrete version, {@link eventstore.ExpectedVersion#NO_STREAM} or
   *                        {@link eventstore.ExpectedVersion#ANY}
   * @param events          events to append, in order; must not be empty
   * @return the committed events with their assigned versions and positions
   * @throws eventstore.ConcurrencyConflictException on version mismatch
   */
  AppendResult append(String streamId, long expectedVersion, List<EventData> events);

  /**
   * Reads events of one stream with version &ge; {@code startVersion}, oldest first.
   *
   * @return at most {@code maxCount} events; empty if the stream is missing or exhausted
   */
  List<RecordedEvent> readStreamForward(String streamId, long startVersion, int maxCount);

  /**
   * Reads events across all streams with position &ge; {@code startPosition}, ordered by position.
   *
   * @return at most {@code maxCount} events
   */
  List<RecordedEvent> readAllForward(long startPosition, int maxCount);

  /**
   * Returns the highest assigned global position, or {@code 0} if the log is empty.
   */
  long latestPosition();

  /**
   * Looks up a stream's internal id and current version.
   */
  Optional<StreamInfo> streamInfo(String streamId);

  /**
   * Returns the current version of a stream, or {@code 0} if it does not exist.
   */
  default long latestStreamVersion(String streamId) {
    return streamInfo(streamId).map(StreamInfo::version).orElse(0L);
  }
}
