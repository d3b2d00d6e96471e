package eventstore.subscription;

import eventstore.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

final class RecordingMetrics implements MetricsExporter {
    final AtomicInteger appended = new AtomicInteger();
    final AtomicInteger delivered = new AtomicInteger();
    final AtomicInteger acknowledged = new AtomicInteger();
    final AtomicInteger paused = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();
    final AtomicInteger active = new AtomicInteger();

    @Override
    public void recordAppended(int count) {
        appended.addAndGet(count);
    }

    @Override
    public void incrementDelivered() {
        delivered.incrementAndGet();
    }

    @Override
    public void recordAcknowledged(int count) {
        acknowledged.addAndGet(count);
    }

    @Override
    public void incrementPaused() {
        paused.incrementAndGet();
    }

    @Override
    public void incrementFailed() {
        failed.incrementAndGet();
    }

    @Override
    public void recordActiveSubscriptions(int active) {
        this.active.set(active);
    }
}
