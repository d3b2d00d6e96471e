package eventstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time snapshot of an aggregate's state, keyed by source id.
 *
 * @see eventstore.spi.SnapshotStore
 */
public record Snapshot(
    String sourceId,
    long sourceVersion,
    String sourceType,
    byte[] data,
    byte[] metadata,
    Instant createdAt
) {

  public Snapshot {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(sourceType, "sourceType");
    Objects.requireNonNull(data, "data");
    if (metadata == null) {
      metadata = new byte[0];
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
