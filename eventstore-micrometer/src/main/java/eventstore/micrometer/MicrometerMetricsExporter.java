package eventstore.micrometer;

import eventstore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventstore.append.events}: events appended to the log</li>
 *   <li>{@code eventstore.delivery.delivered}: events handed to subscribers</li>
 *   <li>{@code eventstore.delivery.acknowledged}: in-flight events released by acks</li>
 *   <li>{@code eventstore.delivery.paused}: times a subscription hit its in-flight limit</li>
 *   <li>{@code eventstore.subscription.failed}: subscriptions that moved to FAILED</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventstore.subscriptions.active}: running subscriptions</li>
 *   <li>{@code eventstore.delivery.pending.depth}: live events queued by the last subscription
 *       that reported</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter appended;
  private final Counter delivered;
  private final Counter acknowledged;
  private final Counter paused;
  private final Counter failed;
  private final Gauge activeGauge;
  private final Gauge pendingGauge;

  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger pendingDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventstore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventstore");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventstore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.appended = Counter.builder(namePrefix + ".append.events")
        .description("Events appended to the log")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".delivery.delivered")
        .description("Events delivered to subscribers")
        .register(registry);
    this.acknowledged = Counter.builder(namePrefix + ".delivery.acknowledged")
        .description("In-flight events released by acknowledgments")
        .register(registry);
    this.paused = Counter.builder(namePrefix + ".delivery.paused")
        .description("Times a subscription reached its in-flight limit")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".subscription.failed")
        .description("Subscriptions that failed")
        .register(registry);

    this.activeGauge = Gauge.builder(namePrefix + ".subscriptions.active", active, AtomicInteger::get)
        .register(registry);
    this.pendingGauge = Gauge.builder(namePrefix + ".delivery.pending.depth", pendingDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void recordAppended(int count) {
    if (closed) return;
    appended.increment(count);
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void recordAcknowledged(int count) {
    if (closed) return;
    acknowledged.increment(count);
  }

  @Override
  public void incrementPaused() {
    if (closed) return;
    paused.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void recordActiveSubscriptions(int active) {
    if (closed) return;
    this.active.set(active);
  }

  @Override
  public void recordPendingDepth(int depth) {
    if (closed) return;
    this.pendingDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link eventstore.EventStore#close()} so no stale gauges remain.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(appended, delivered, acknowledged, paused, failed,
        activeGauge, pendingGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
