package eventstore.micrometer;

import eventstore.EventData;
import eventstore.EventStore;
import eventstore.ExpectedVersion;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void countersAccumulate() {
    exporter.recordAppended(3);
    exporter.recordAppended(2);
    exporter.incrementDelivered();
    exporter.recordAcknowledged(4);
    exporter.incrementPaused();
    exporter.incrementFailed();

    assertEquals(5.0, counter("eventstore.append.events").count());
    assertEquals(1.0, counter("eventstore.delivery.delivered").count());
    assertEquals(4.0, counter("eventstore.delivery.acknowledged").count());
    assertEquals(1.0, counter("eventstore.delivery.paused").count());
    assertEquals(1.0, counter("eventstore.subscription.failed").count());
  }

  @Test
  void gaugesTrackLatestValue() {
    exporter.recordActiveSubscriptions(3);
    exporter.recordPendingDepth(42);
    assertEquals(3.0, gauge("eventstore.subscriptions.active").value());
    assertEquals(42.0, gauge("eventstore.delivery.pending.depth").value());

    exporter.recordPendingDepth(0);
    assertEquals(0.0, gauge("eventstore.delivery.pending.depth").value());
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "orders.eventstore");
    custom.incrementDelivered();

    assertEquals(1.0, counter("orders.eventstore.delivery.delivered").count());
    assertEquals(0.0, counter("eventstore.delivery.delivered").count());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "orders."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLateUpdates() {
    exporter.close();
    exporter.incrementDelivered();
    exporter.recordPendingDepth(5);

    assertNull(registry.find("eventstore.delivery.delivered").counter());
    assertNull(registry.find("eventstore.delivery.pending.depth").gauge());
  }

  @Test
  void storeReportsThroughExporter() {
    try (EventStore store = EventStore.inMemory().metrics(exporter).executor(Runnable::run).build()) {
      store.subscribeToStream("cart-1", "totals", (subscription, event) -> subscription.ack(event));
      store.append("cart-1", ExpectedVersion.NO_STREAM,
          List.of(EventData.of("ItemAdded", "{}"), EventData.of("ItemAdded", "{}")));

      assertEquals(2.0, counter("eventstore.append.events").count());
      assertEquals(2.0, counter("eventstore.delivery.delivered").count());
      assertEquals(2.0, counter("eventstore.delivery.acknowledged").count());
      assertEquals(1.0, gauge("eventstore.subscriptions.active").value());
    }
    assertNull(registry.find("eventstore.append.events").counter());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge gauge(String name) {
    return registry.get(name).gauge();
  }
}
