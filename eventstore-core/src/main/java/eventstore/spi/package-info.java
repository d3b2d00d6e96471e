/**
 * Service Provider Interfaces (SPI) for plugging storage and observability into the event store.
 *
 * <p>Storage backends implement {@link eventstore.spi.EventLog},
 * {@link eventstore.spi.SubscriptionRegistry} and {@link eventstore.spi.SnapshotStore};
 * relational backends obtain connections through {@link eventstore.spi.ConnectionProvider}.
 *
 * @see eventstore.spi.EventLog
 * @see eventstore.spi.SubscriptionRegistry
 * @see eventstore.spi.MetricsExporter
 */
package eventstore.spi;
