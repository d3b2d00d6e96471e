package eventstore.subscription;

import eventstore.EventData;
import eventstore.EventWriter;
import eventstore.ExpectedVersion;
import eventstore.inmemory.InMemoryEventLog;
import eventstore.inmemory.InMemorySubscriptionRegistry;
import eventstore.model.SubscriptionScope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Appends racing with catch-up, on real worker threads.
 */
class SubscriptionEngineConcurrencyTest {

    private static final int HISTORY = 200;
    private static final int LIVE_PER_WRITER = 150;
    private static final int WRITERS = 2;

    @Test
    void concurrentAppendsDuringCatchUpAreDeliveredWithoutGapsOrDuplicates() throws Exception {
        InMemoryEventLog log = new InMemoryEventLog();
        LiveFeed feed = new LiveFeed();
        EventWriter writer = new EventWriter(log, feed, null);
        for (int i = 0; i < HISTORY; i++) {
            writer.append(i % 2 == 0 ? "even" : "odd", ExpectedVersion.ANY, List.of(EventData.of("Seed", "{}")));
        }
        int total = HISTORY + WRITERS * LIVE_PER_WRITER;
        RecordingSubscriber subscriber = RecordingSubscriber.autoAck().expect(total);

        ExecutorService writers = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch go = new CountDownLatch(1);
        try (SubscriptionEngine engine = SubscriptionEngine.builder()
                .eventLog(log)
                .registry(new InMemorySubscriptionRegistry())
                .liveFeed(feed)
                .maxInFlight(5)
                .catchUpBatchSize(7)
                .build()) {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < WRITERS; w++) {
                String stream = "writer-" + w;
                futures.add(writers.submit(() -> {
                    go.await();
                    for (int i = 0; i < LIVE_PER_WRITER; i++) {
                        writer.append(stream, ExpectedVersion.ANY, List.of(EventData.of("Live", "{}")));
                    }
                    return null;
                }));
            }
            go.countDown();
            engine.subscribe(SubscriptionScope.allStreams(), "projector", subscriber);
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            assertTrue(subscriber.await(10, TimeUnit.SECONDS), "received " + subscriber.received().size());
        } finally {
            writers.shutdownNow();
        }

        List<Long> positions = subscriber.positions();
        assertEquals(total, positions.size());
        assertEquals(total, new HashSet<>(positions).size());
        for (int i = 0; i < positions.size(); i++) {
            assertEquals(i + 1L, positions.get(i));
        }
    }

    @Test
    void slowSubscriberDoesNotBlockOthers() throws Exception {
        InMemoryEventLog log = new InMemoryEventLog();
        LiveFeed feed = new LiveFeed();
        EventWriter writer = new EventWriter(log, feed, null);
        CountDownLatch release = new CountDownLatch(1);
        RecordingSubscriber fast = RecordingSubscriber.autoAck().expect(3);

        try (SubscriptionEngine engine = SubscriptionEngine.builder()
                .eventLog(log)
                .registry(new InMemorySubscriptionRegistry())
                .liveFeed(feed)
                .drainTimeoutMs(100)
                .build()) {
            engine.subscribe(SubscriptionScope.allStreams(), "slow", (subscription, event) -> release.await());
            engine.subscribe(SubscriptionScope.allStreams(), "fast", fast);
            for (int i = 0; i < 3; i++) {
                writer.append("s", ExpectedVersion.ANY, List.of(EventData.of("Evt", "{}")));
            }

            assertTrue(fast.await(5, TimeUnit.SECONDS));
            release.countDown();
        }
        assertEquals(List.of(1L, 2L, 3L), fast.positions());
    }
}
