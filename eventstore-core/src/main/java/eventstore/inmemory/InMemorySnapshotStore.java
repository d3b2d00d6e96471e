package eventstore.inmemory;

import eventstore.model.Snapshot;
import eventstore.spi.SnapshotStore;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySnapshotStore implements SnapshotStore {
  private final ConcurrentHashMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

  @Override
  public Optional<Snapshot> read(String sourceId) {
    return Optional.ofNullable(snapshots.get(sourceId));
  }

  @Override
  public void record(Snapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    snapshots.put(snapshot.sourceId(), snapshot);
  }

  @Override
  public void delete(String sourceId) {
    snapshots.remove(sourceId);
  }
}
