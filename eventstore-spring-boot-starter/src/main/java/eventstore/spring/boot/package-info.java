/**
 * Spring Boot auto-configuration for the event store.
 *
 * <p>Registers an {@link eventstore.EventStore} backed by the application's
 * {@link javax.sql.DataSource}, starts beans annotated with
 * {@link eventstore.spring.boot.EventSubscription}, and exports metrics through Micrometer
 * when a {@code MeterRegistry} is present.
 */
package eventstore.spring.boot;
