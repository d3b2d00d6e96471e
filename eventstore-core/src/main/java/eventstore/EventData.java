package eventstore;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An event to be appended to a stream: type tag, opaque payload and opaque metadata.
 *
 * <p>Each instance is assigned a ULID-based {@code eventId} unless one is supplied. The
 * payload is limited to {@value #MAX_PAYLOAD_BYTES} bytes. Stream version and global
 * position are assigned by the {@link eventstore.spi.EventLog} at append time.
 *
 * @see EventWriter
 * @see eventstore.model.RecordedEvent
 */
public final class EventData {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    private static final byte[] EMPTY = new byte[0];

    private final String eventId;
    private final String eventType;
    private final byte[] payload;
    private final byte[] metadata;

    private EventData(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        if (builder.payload == null) {
            throw new IllegalArgumentException("payload must be set");
        }
        if (builder.payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
        this.metadata = builder.metadata == null
                ? EMPTY : Arrays.copyOf(builder.metadata, builder.metadata.length);
    }

    /**
     * Creates a builder for the given event type.
     *
     * @param eventType the event type tag
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    /**
     * Shorthand for an event with a UTF-8 text payload and no metadata.
     *
     * @param eventType the event type tag
     * @param payload   the payload text
     * @return a new event
     */
    public static EventData of(String eventType, String payload) {
        Objects.requireNonNull(payload, "payload");
        return builder(eventType).payload(payload.getBytes(StandardCharsets.UTF_8)).build();
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    /** Returns a copy of the payload bytes. */
    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    /** Returns a copy of the metadata bytes (empty when none was set). */
    public byte[] metadata() {
        return Arrays.copyOf(metadata, metadata.length);
    }

    @Override
    public String toString() {
        return "EventData{eventId=" + eventId + ", eventType=" + eventType
                + ", payloadBytes=" + payload.length + "}";
    }

    /** Builder for {@link EventData}. */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private byte[] payload;
        private byte[] metadata;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Overrides the generated ULID with a caller-supplied id.
         *
         * @param eventId unique event id
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(byte[] metadata) {
            this.metadata = metadata;
            return this;
        }

        public EventData build() {
            return new EventData(this);
        }
    }
}
