package eventstore.spi;

import eventstore.model.RecordedEvent;

import java.util.List;

/**
 * Callback invoked by {@link eventstore.EventWriter} after each committed append, with the
 * committed events in append order. Invocations never overlap.
 */
@FunctionalInterface
public interface AppendHook {
  void afterAppend(List<RecordedEvent> events);

  AppendHook NOOP = events -> {};
}
