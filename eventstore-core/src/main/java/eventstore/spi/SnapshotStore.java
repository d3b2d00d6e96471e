package eventstore.spi;

import eventstore.model.Snapshot;

import java.util.Optional;

/**
 * Storage for aggregate snapshots, one per source id.
 */
public interface SnapshotStore {

  Optional<Snapshot> read(String sourceId);

  /** Inserts the snapshot, replacing any existing snapshot for the same source. */
  void record(Snapshot snapshot);

  /** Deletes the snapshot for a source. No-op if none exists. */
  void delete(String sourceId);
}
