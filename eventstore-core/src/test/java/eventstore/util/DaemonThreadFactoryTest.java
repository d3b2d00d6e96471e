package eventstore.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsSequentiallyNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("eventstore-subscription-");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertTrue(first.isDaemon());
        assertNotSame(first.getThreadGroup(), first.getUncaughtExceptionHandler());
        assertEquals("eventstore-subscription-1", first.getName());
        assertEquals("eventstore-subscription-2", second.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
