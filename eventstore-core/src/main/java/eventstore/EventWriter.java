package eventstore;

import eventstore.model.SubscriptionScope;
import eventstore.spi.AppendHook;
import eventstore.spi.EventLog;
import eventstore.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for appending events to the log.
 *
 * <p>Appends made through one writer are serialized. After each committed append the
 * configured {@link AppendHook} is invoked with the committed events before the next
 * append starts, so the hook observes events in exact position order. A failing hook is
 * logged and never fails the append: the log stays the source of truth.
 *
 * @see AppendHook
 * @see eventstore.spi.EventLog
 */
public final class EventWriter {
    private static final Logger logger = Logger.getLogger(EventWriter.class.getName());

    private final EventLog eventLog;
    private final AppendHook appendHook;
    private final MetricsExporter metrics;
    private final ReentrantLock appendLock = new ReentrantLock();

    /**
     * Creates a writer that publishes nothing after appends.
     *
     * @param eventLog the log to append to
     */
    public EventWriter(EventLog eventLog) {
        this(eventLog, AppendHook.NOOP, MetricsExporter.NOOP);
    }

    /**
     * Creates a writer with an append hook, typically the subscription engine's live feed.
     *
     * @param eventLog   the log to append to
     * @param appendHook post-append hook; {@code null} defaults to {@link AppendHook#NOOP}
     * @param metrics    metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
     */
    public EventWriter(EventLog eventLog, AppendHook appendHook, MetricsExporter metrics) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.appendHook = appendHook == null ? AppendHook.NOOP : appendHook;
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Appends a single event without a version check.
     *
     * @return the append result
     */
    public AppendResult append(String streamId, EventData event) {
        Objects.requireNonNull(event, "event");
        return append(streamId, ExpectedVersion.ANY, List.of(event));
    }

    /**
     * Appends events to a stream.
     *
     * @param streamId        target stream; created if missing and {@code expectedVersion} allows it
     * @param expectedVersion concrete version, {@link ExpectedVersion#NO_STREAM} or {@link ExpectedVersion#ANY}
     * @param events          events in append order
     * @return the committed events with their versions and positions
     * @throws ConcurrencyConflictException if the stream's version does not match
     * @throws IllegalArgumentException if {@code events} is empty or the stream id is reserved
     */
    public AppendResult append(String streamId, long expectedVersion, List<EventData> events) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(events, "events");
        if (streamId.isEmpty()) {
            throw new IllegalArgumentException("streamId cannot be empty");
        }
        if (SubscriptionScope.ALL_STREAMS_KEY.equals(streamId)) {
            throw new IllegalArgumentException(streamId + " is a reserved stream id");
        }
        if (expectedVersion < ExpectedVersion.ANY) {
            throw new IllegalArgumentException("Invalid expected version: " + expectedVersion);
        }
        if (events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be empty");
        }
        List<EventData> batch = List.copyOf(events);

        appendLock.lock();
        try {
            AppendResult result = eventLog.append(streamId, expectedVersion, batch);
            metrics.recordAppended(result.events().size());
            logger.fine(() -> "Appended " + result.events().size() + " event(s) to " + streamId
                    + " at positions " + result.firstPosition() + ".." + result.lastPosition());
            runSafely(() -> appendHook.afterAppend(result.events()));
            return result;
        } finally {
            appendLock.unlock();
        }
    }

    private void runSafely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "AppendHook.afterAppend failed", ex);
        }
    }
}
