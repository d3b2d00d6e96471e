package eventstore.subscription;

import eventstore.model.RecordedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Test subscriber that records deliveries and optionally acknowledges each event.
 */
final class RecordingSubscriber implements Subscriber {
    private final boolean autoAck;
    private final List<RecordedEvent> received = new CopyOnWriteArrayList<>();
    private final AtomicReference<Throwable> error = new AtomicReference<>();
    private volatile CountDownLatch latch = new CountDownLatch(0);

    private RecordingSubscriber(boolean autoAck) {
        this.autoAck = autoAck;
    }

    static RecordingSubscriber manualAck() {
        return new RecordingSubscriber(false);
    }

    static RecordingSubscriber autoAck() {
        return new RecordingSubscriber(true);
    }

    RecordingSubscriber expect(int count) {
        latch = new CountDownLatch(count);
        return this;
    }

    boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    @Override
    public void onEvent(SubscriptionHandle subscription, RecordedEvent event) {
        received.add(event);
        if (autoAck) {
            subscription.ack(event);
        }
        latch.countDown();
    }

    @Override
    public void onError(Throwable cause) {
        error.set(cause);
    }

    List<RecordedEvent> received() {
        return received;
    }

    List<Long> positions() {
        List<Long> positions = new ArrayList<>();
        for (RecordedEvent event : received) {
            positions.add(event.position());
        }
        return positions;
    }

    RecordedEvent last() {
        return received.get(received.size() - 1);
    }

    Throwable error() {
        return error.get();
    }
}
