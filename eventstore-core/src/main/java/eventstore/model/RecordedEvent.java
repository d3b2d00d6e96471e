package eventstore.model;

import java.time.Instant;

/**
 * Read-only record of a persisted event, as returned by reads and delivered to subscribers.
 *
 * <p>{@code streamVersion} is contiguous per stream starting at 1; {@code position} is
 * contiguous across the whole log starting at 1.
 *
 * @see eventstore.spi.EventLog#readStreamForward
 * @see eventstore.spi.EventLog#readAllForward
 */
public record RecordedEvent(
    String eventId,
    String streamId,
    long streamVersion,
    long position,
    String eventType,
    byte[] payload,
    byte[] metadata,
    Instant createdAt
) {}
