package eventstore.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon worker threads that run subscription mailboxes, named
 * {@code <prefix>1}, {@code <prefix>2}, and so on.
 *
 * <p>Anything escaping a mailbox task (normally only an {@link Error} thrown by a subscriber)
 * is logged at SEVERE instead of going to {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER = (thread, error) ->
            logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
        return thread;
    }
}
