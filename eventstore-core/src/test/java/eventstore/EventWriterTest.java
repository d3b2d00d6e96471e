package eventstore;

import eventstore.inmemory.InMemoryEventLog;
import eventstore.model.RecordedEvent;
import eventstore.spi.AppendHook;
import eventstore.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventWriterTest {

  @Test
  void appendHookReceivesCommittedEvents() {
    InMemoryEventLog log = new InMemoryEventLog();
    List<RecordedEvent> published = new ArrayList<>();
    EventWriter writer = new EventWriter(log, published::addAll, null);

    AppendResult result = writer.append("order-1", ExpectedVersion.NO_STREAM,
        List.of(EventData.of("OrderPlaced", "{}"), EventData.of("OrderPaid", "{}")));

    assertEquals(2, result.streamVersion());
    assertEquals(1, result.firstPosition());
    assertEquals(2, result.lastPosition());
    assertEquals(result.events(), published);
  }

  @Test
  void failingHookDoesNotFailAppend() {
    InMemoryEventLog log = new InMemoryEventLog();
    AppendHook hook = events -> { throw new RuntimeException("boom"); };
    EventWriter writer = new EventWriter(log, hook, MetricsExporter.NOOP);

    assertDoesNotThrow(() -> writer.append("order-1", EventData.of("OrderPlaced", "{}")));
    assertEquals(1, log.latestPosition());
  }

  @Test
  void conflictIsNotPublished() {
    InMemoryEventLog log = new InMemoryEventLog();
    AtomicInteger hookCalls = new AtomicInteger();
    EventWriter writer = new EventWriter(log, events -> hookCalls.incrementAndGet(), null);
    writer.append("order-1", ExpectedVersion.NO_STREAM, List.of(EventData.of("OrderPlaced", "{}")));

    ConcurrencyConflictException ex = assertThrows(ConcurrencyConflictException.class, () ->
        writer.append("order-1", ExpectedVersion.NO_STREAM, List.of(EventData.of("OrderPlaced", "{}"))));

    assertEquals(0, ex.expectedVersion());
    assertEquals(1, ex.actualVersion());
    assertEquals(1, hookCalls.get());
  }

  @Test
  void countsAppendedEvents() {
    AtomicInteger appended = new AtomicInteger();
    MetricsExporter metrics = new MetricsExporter() {
      @Override
      public void recordAppended(int count) {
        appended.addAndGet(count);
      }

      @Override
      public void incrementDelivered() {
      }

      @Override
      public void recordAcknowledged(int count) {
      }

      @Override
      public void incrementPaused() {
      }

      @Override
      public void incrementFailed() {
      }
    };
    EventWriter writer = new EventWriter(new InMemoryEventLog(), null, metrics);

    writer.append("s", ExpectedVersion.ANY, List.of(EventData.of("A", "{}"), EventData.of("B", "{}")));
    writer.append("s", EventData.of("C", "{}"));

    assertEquals(3, appended.get());
  }

  @Test
  void rejectsEmptyBatch() {
    EventWriter writer = new EventWriter(new InMemoryEventLog());

    assertThrows(IllegalArgumentException.class, () -> writer.append("s", ExpectedVersion.ANY, List.of()));
  }

  @Test
  void rejectsReservedStreamId() {
    EventWriter writer = new EventWriter(new InMemoryEventLog());

    assertThrows(IllegalArgumentException.class, () -> writer.append("$all", EventData.of("A", "{}")));
  }

  @Test
  void rejectsInvalidExpectedVersion() {
    EventWriter writer = new EventWriter(new InMemoryEventLog());

    assertThrows(IllegalArgumentException.class,
        () -> writer.append("s", -2, List.of(EventData.of("A", "{}"))));
  }
}
