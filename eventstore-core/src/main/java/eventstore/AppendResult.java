package eventstore;

import eventstore.model.RecordedEvent;

import java.util.List;

/**
 * Outcome of a successful append: the stream's new version and the committed events
 * with their assigned versions and global positions, in append order.
 */
public record AppendResult(String streamId, long streamVersion, List<RecordedEvent> events) {

  public AppendResult {
    events = List.copyOf(events);
  }

  /** Global position of the first appended event. */
  public long firstPosition() {
    return events.get(0).position();
  }

  /** Global position of the last appended event. */
  public long lastPosition() {
    return events.get(events.size() - 1).position();
  }
}
