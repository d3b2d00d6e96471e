package eventstore.inmemory;

import eventstore.AppendResult;
import eventstore.ConcurrencyConflictException;
import eventstore.EventData;
import eventstore.ExpectedVersion;
import eventstore.StreamExistsException;
import eventstore.model.RecordedEvent;
import eventstore.model.StreamInfo;
import eventstore.spi.EventLog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EventLog} kept in process memory. Mainly useful for tests and demos; all state is
 * lost when the instance is discarded.
 */
public final class InMemoryEventLog implements EventLog {
  private final Clock clock;
  private final List<RecordedEvent> log = new ArrayList<>();
  private final Map<String, StreamState> streams = new HashMap<>();
  private long nextInternalId = 1;

  public InMemoryEventLog() {
    this(Clock.systemUTC());
  }

  public InMemoryEventLog(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized StreamInfo createStream(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    if (streams.containsKey(streamId)) {
      throw new StreamExistsException(streamId);
    }
    return newStream(streamId).info(streamId);
  }

  @Override
  public synchronized AppendResult append(String streamId, long expectedVersion, List<EventData> events) {
    Objects.requireNonNull(streamId, "streamId");
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events cannot be empty");
    }
    StreamState stream = streams.get(streamId);
    long current = stream == null ? 0L : stream.events.size();
    if (expectedVersion != ExpectedVersion.ANY && expectedVersion != current) {
      throw new ConcurrencyConflictException(streamId, expectedVersion, current);
    }
    if (stream == null) {
      stream = newStream(streamId);
    }

    List<RecordedEvent> appended = new ArrayList<>(events.size());
    for (EventData data : events) {
      RecordedEvent event = new RecordedEvent(
          data.eventId(),
          streamId,
          stream.events.size() + 1L,
          log.size() + 1L,
          data.eventType(),
          data.payload(),
          data.metadata(),
          clock.instant());
      stream.events.add(event);
      log.add(event);
      appended.add(event);
    }
    return new AppendResult(streamId, stream.events.size(), appended);
  }

  @Override
  public synchronized List<RecordedEvent> readStreamForward(String streamId, long startVersion, int maxCount) {
    requirePositive(maxCount);
    StreamState stream = streams.get(streamId);
    if (stream == null) {
      return List.of();
    }
    return slice(stream.events, Math.max(startVersion, 1L) - 1, maxCount);
  }

  @Override
  public synchronized List<RecordedEvent> readAllForward(long startPosition, int maxCount) {
    requirePositive(maxCount);
    return slice(log, Math.max(startPosition, 1L) - 1, maxCount);
  }

  @Override
  public synchronized long latestPosition() {
    return log.size();
  }

  @Override
  public synchronized Optional<StreamInfo> streamInfo(String streamId) {
    StreamState stream = streams.get(streamId);
    return stream == null ? Optional.empty() : Optional.of(stream.info(streamId));
  }

  private StreamState newStream(String streamId) {
    StreamState stream = new StreamState(nextInternalId++);
    streams.put(streamId, stream);
    return stream;
  }

  private static List<RecordedEvent> slice(List<RecordedEvent> events, long from, int maxCount) {
    if (from >= events.size()) {
      return List.of();
    }
    int start = (int) from;
    int end = (int) Math.min(events.size(), from + maxCount);
    return List.copyOf(events.subList(start, end));
  }

  private static void requirePositive(int maxCount) {
    if (maxCount <= 0) {
      throw new IllegalArgumentException("maxCount must be > 0");
    }
  }

  private static final class StreamState {
    final long internalId;
    final List<RecordedEvent> events = new ArrayList<>();

    StreamState(long internalId) {
      this.internalId = internalId;
    }

    StreamInfo info(String streamId) {
      return new StreamInfo(streamId, internalId, events.size());
    }
  }
}
