package eventstore.spring.boot;

import eventstore.subscription.OutOfOrderAckPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event store.
 *
 * @see EventStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventstore")
public class EventStoreProperties {

    /**
     * Dialect name ("h2", "postgresql"). Detected from the DataSource URL when empty.
     */
    private String dialect;

    /**
     * Whether to create the tables on startup.
     */
    private boolean initializeSchema = true;

    private final Subscription subscription = new Subscription();
    private final Metrics metrics = new Metrics();

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Subscription {
        private int maxInFlight = 100;
        private int catchUpBatchSize = 500;
        private int maxPendingEvents = 10_000;
        private OutOfOrderAckPolicy ackPolicy = OutOfOrderAckPolicy.REJECT;
        private long drainTimeoutMs = 5000;

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        public int getCatchUpBatchSize() {
            return catchUpBatchSize;
        }

        public void setCatchUpBatchSize(int catchUpBatchSize) {
            this.catchUpBatchSize = catchUpBatchSize;
        }

        public int getMaxPendingEvents() {
            return maxPendingEvents;
        }

        public void setMaxPendingEvents(int maxPendingEvents) {
            this.maxPendingEvents = maxPendingEvents;
        }

        public OutOfOrderAckPolicy getAckPolicy() {
            return ackPolicy;
        }

        public void setAckPolicy(OutOfOrderAckPolicy ackPolicy) {
            this.ackPolicy = ackPolicy;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventstore";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
