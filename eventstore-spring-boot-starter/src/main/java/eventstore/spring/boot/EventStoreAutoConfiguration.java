package eventstore.spring.boot;

import eventstore.EventStore;
import eventstore.EventWriter;
import eventstore.jdbc.DataSourceConnectionProvider;
import eventstore.jdbc.JdbcEventLog;
import eventstore.jdbc.JdbcSnapshotStore;
import eventstore.jdbc.JdbcSubscriptionRegistry;
import eventstore.jdbc.SchemaInitializer;
import eventstore.jdbc.dialect.Dialects;
import eventstore.jdbc.spi.Dialect;
import eventstore.spi.ConnectionProvider;
import eventstore.spi.EventLog;
import eventstore.spi.MetricsExporter;
import eventstore.spi.SnapshotStore;
import eventstore.spi.SubscriptionRegistry;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event store.
 *
 * <p>Wires an {@link EventStore} composite over the JDBC backend from a {@link DataSource}
 * and {@link EventStoreProperties}, creating the tables on startup unless
 * {@code eventstore.initialize-schema=false}. Each backend bean backs off when the
 * application defines its own.
 *
 * @see EventStoreProperties
 * @see EventStoreMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventStore.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventStoreProperties.class)
public class EventStoreAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Dialect eventStoreDialect(DataSource dataSource, EventStoreProperties props) {
    String name = props.getDialect();
    return name == null || name.isEmpty() ? Dialects.detect(dataSource) : Dialects.get(name);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public SchemaInitializer schemaInitializer(ConnectionProvider connectionProvider, Dialect dialect,
      EventStoreProperties props) {
    SchemaInitializer initializer = new SchemaInitializer(connectionProvider, dialect);
    if (props.isInitializeSchema()) {
      initializer.initialize();
    }
    return initializer;
  }

  @Bean
  @ConditionalOnMissingBean(EventLog.class)
  public JdbcEventLog eventLog(ConnectionProvider connectionProvider, Dialect dialect,
      SchemaInitializer schemaInitializer) {
    return new JdbcEventLog(connectionProvider, dialect);
  }

  @Bean
  @ConditionalOnMissingBean(SubscriptionRegistry.class)
  public JdbcSubscriptionRegistry subscriptionRegistry(ConnectionProvider connectionProvider,
      Dialect dialect, SchemaInitializer schemaInitializer) {
    return new JdbcSubscriptionRegistry(connectionProvider, dialect);
  }

  @Bean
  @ConditionalOnMissingBean(SnapshotStore.class)
  public JdbcSnapshotStore snapshotStore(ConnectionProvider connectionProvider, Dialect dialect,
      SchemaInitializer schemaInitializer) {
    return new JdbcSnapshotStore(connectionProvider, dialect);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventStore eventStore(EventStoreProperties props,
      EventLog eventLog,
      SubscriptionRegistry subscriptionRegistry,
      SnapshotStore snapshotStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    EventStoreProperties.Subscription sub = props.getSubscription();
    EventStore.Builder builder = EventStore.builder()
        .eventLog(eventLog)
        .subscriptionRegistry(subscriptionRegistry)
        .snapshotStore(snapshotStore)
        .maxInFlight(sub.getMaxInFlight())
        .catchUpBatchSize(sub.getCatchUpBatchSize())
        .maxPendingEvents(sub.getMaxPendingEvents())
        .ackPolicy(sub.getAckPolicy())
        .drainTimeoutMs(sub.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventWriter eventWriter(EventStore eventStore) {
    return eventStore.writer();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriptionRegistrar eventSubscriptionRegistrar(ListableBeanFactory beanFactory,
      EventStore eventStore) {
    return new EventSubscriptionRegistrar(beanFactory, eventStore);
  }
}
