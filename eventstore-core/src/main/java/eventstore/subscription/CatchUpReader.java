package eventstore.subscription;

import eventstore.model.RecordedEvent;
import eventstore.model.SubscriptionScope;
import eventstore.spi.EventLog;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy, finite sequence of historical events after a cursor, up to the log head captured
 * when the reader was created.
 *
 * <p>Events are fetched on demand in batches of {@code batchSize}, so memory stays bounded
 * regardless of backlog size. Events appended after construction are excluded; they reach
 * subscribers through the {@link LiveFeed}. Single-stream scopes read by stream version,
 * the all-streams scope by global position.
 *
 * <p>Not restartable: to read again, create a new reader from the desired cursor.
 * Not thread-safe.
 */
public final class CatchUpReader implements Iterator<RecordedEvent> {
  private final EventLog eventLog;
  private final SubscriptionScope scope;
  private final int batchSize;
  private final long headPosition;
  private final Deque<RecordedEvent> buffer = new ArrayDeque<>();

  private long lastPosition;
  private long lastStreamVersion;
  private boolean exhausted;

  /**
   * Creates a reader and captures the current head of the log.
   *
   * @param eventLog          source of events
   * @param scope             stream or all-streams scope
   * @param afterPosition     last seen global position; only later events are returned
   * @param afterStreamVersion last seen stream version (single-stream scopes)
   * @param batchSize         events fetched per read
   */
  public CatchUpReader(EventLog eventLog, SubscriptionScope scope,
      long afterPosition, long afterStreamVersion, int batchSize) {
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    this.scope = Objects.requireNonNull(scope, "scope");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = batchSize;
    this.lastPosition = afterPosition;
    this.lastStreamVersion = afterStreamVersion;
    this.headPosition = eventLog.latestPosition();
    this.exhausted = headPosition <= afterPosition;
  }

  /** The log head captured at construction; no event beyond it is returned. */
  public long headPosition() {
    return headPosition;
  }

  @Override
  public boolean hasNext() {
    while (buffer.isEmpty() && !exhausted) {
      fetch();
    }
    return !buffer.isEmpty();
  }

  @Override
  public RecordedEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return buffer.poll();
  }

  private void fetch() {
    List<RecordedEvent> batch = scope.isAllStreams()
        ? eventLog.readAllForward(lastPosition + 1, batchSize)
        : eventLog.readStreamForward(scope.streamId(), lastStreamVersion + 1, batchSize);
    if (batch.size() < batchSize) {
      exhausted = true;
    }
    for (RecordedEvent event : batch) {
      if (event.position() > headPosition) {
        exhausted = true;
        return;
      }
      if (!scope.isAllStreams()) {
        lastStreamVersion = event.streamVersion();
      }
      // A cursor seeded by position only still reads the stream from its first version
      if (event.position() <= lastPosition) {
        continue;
      }
      lastPosition = event.position();
      buffer.add(event);
    }
  }
}
