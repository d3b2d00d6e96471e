/**
 * Persistent subscriptions with catch-up, live delivery and acknowledgment-based backpressure.
 *
 * <p>{@link eventstore.subscription.SubscriptionEngine} starts a subscription from its durable
 * cursor: a {@link eventstore.subscription.CatchUpReader} replays the log up to the head
 * captured at start, while events appended meanwhile are queued from the
 * {@link eventstore.subscription.LiveFeed}. Delivery pauses once {@code maxInFlight} events
 * are unacknowledged and resumes as acknowledgments arrive.
 *
 * @see eventstore.subscription.SubscriptionEngine
 * @see eventstore.subscription.Subscriber
 * @see eventstore.subscription.SubscriptionHandle
 */
package eventstore.subscription;
