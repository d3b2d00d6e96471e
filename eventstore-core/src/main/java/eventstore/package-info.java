/**
 * Root API of the event store: an append-only log of events grouped into streams, with
 * persistent subscriptions that catch up from a durable cursor and then follow new appends.
 *
 * <h2>Core Design</h2>
 * <p>Every event has a stream version (contiguous per stream, from 1) and a global position
 * (contiguous across the log, from 1). Appends go through {@link eventstore.EventWriter},
 * which checks the expected stream version and, after commit, publishes the batch to the
 * {@linkplain eventstore.subscription.LiveFeed live feed}.
 *
 * <p>A {@linkplain eventstore.subscription.SubscriptionEngine subscription} replays history
 * after its last acknowledged position, then switches to live events without gaps or
 * duplicates. Delivery is at-least-once: unacknowledged events are re-delivered after a
 * restart. Each subscription has at most {@code maxInFlight} unacknowledged events.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventstore-core</b>: API, subscription engine, in-memory backend</li>
 *   <li><b>eventstore-jdbc</b>: relational backend (H2, PostgreSQL)</li>
 *   <li><b>eventstore-micrometer</b>: Micrometer metrics bridge</li>
 *   <li><b>eventstore-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (EventStore store = EventStore.inMemory().maxInFlight(10).build()) {
 *   store.subscribeToStream("cart-1", "totals", (subscription, event) -> {
 *     System.out.println(event.eventType() + " @ " + event.position());
 *     subscription.ack(event);
 *   });
 *   store.append("cart-1", ExpectedVersion.NO_STREAM,
 *       List.of(EventData.of("ItemAdded", "{\"sku\":\"A-1\"}")));
 * }
 * }</pre>
 *
 * @see eventstore.EventStore
 * @see eventstore.EventWriter
 * @see eventstore.subscription.SubscriptionEngine
 */
package eventstore;
