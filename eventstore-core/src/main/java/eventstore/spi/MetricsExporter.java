package eventstore.spi;

/**
 * Observability hook for exporting event store counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. See
 * {@code eventstore.micrometer.MicrometerMetricsExporter} for a Micrometer bridge.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds the number of events committed by one append.
     *
     * @param count events in the batch
     */
    void recordAppended(int count);

    /**
     * Increments the count of events delivered to subscribers.
     */
    void incrementDelivered();

    /**
     * Adds the number of in-flight events released by an acknowledgment.
     *
     * @param count released events
     */
    void recordAcknowledged(int count);

    /**
     * Increments the count of transitions into the paused (max capacity) state.
     */
    void incrementPaused();

    /**
     * Increments the count of subscriptions that terminated with an error.
     */
    void incrementFailed();

    /**
     * Records the number of subscriptions currently running.
     *
     * @param active running subscriptions
     */
    default void recordActiveSubscriptions(int active) {
    }

    /**
     * Records the depth of a subscription's pending queue after it changed.
     *
     * @param depth events waiting to be delivered
     */
    default void recordPendingDepth(int depth) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordAppended(int count) {
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
    }
}
