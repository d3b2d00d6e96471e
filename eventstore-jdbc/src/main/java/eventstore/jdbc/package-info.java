/**
 * Relational backend: {@link eventstore.jdbc.JdbcEventLog},
 * {@link eventstore.jdbc.JdbcSubscriptionRegistry} and {@link eventstore.jdbc.JdbcSnapshotStore}
 * over any {@link eventstore.spi.ConnectionProvider}.
 *
 * <p>Database differences are isolated in {@link eventstore.jdbc.spi.Dialect}; H2 and
 * PostgreSQL are built in and found through {@link java.util.ServiceLoader}.
 *
 * <pre>{@code
 * ConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
 * Dialect dialect = Dialects.detect(dataSource);
 * new SchemaInitializer(connections, dialect).initialize();
 * EventStore store = EventStore.builder()
 *     .eventLog(new JdbcEventLog(connections, dialect))
 *     .subscriptionRegistry(new JdbcSubscriptionRegistry(connections, dialect))
 *     .snapshotStore(new JdbcSnapshotStore(connections, dialect))
 *     .build();
 * }</pre>
 */
package eventstore.jdbc;
