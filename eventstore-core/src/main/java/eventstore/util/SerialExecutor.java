package eventstore.util;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mailbox that runs submitted tasks one at a time, in submission order, on a shared
 * delegate executor.
 *
 * <p>At most one task of a given mailbox is running at any moment, so state touched only
 * from inside tasks needs no further synchronization. Tasks submitted from inside a
 * running task are queued behind it rather than run re-entrantly, which also holds when
 * the delegate runs tasks on the calling thread.
 *
 * <p>A task that throws is logged and does not stop the mailbox.
 */
public final class SerialExecutor implements Executor {
  private static final Logger logger = Logger.getLogger(SerialExecutor.class.getName());

  private final Executor delegate;
  private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean scheduled = new AtomicBoolean(false);

  public SerialExecutor(Executor delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public void execute(Runnable task) {
    tasks.add(Objects.requireNonNull(task, "task"));
    scheduleIfIdle();
  }

  /** Number of tasks waiting to run. */
  public int backlog() {
    return tasks.size();
  }

  private void scheduleIfIdle() {
    if (!tasks.isEmpty() && scheduled.compareAndSet(false, true)) {
      try {
        delegate.execute(this::drain);
      } catch (RuntimeException e) {
        scheduled.set(false);
        throw e;
      }
    }
  }

  private void drain() {
    try {
      Runnable task;
      while ((task = tasks.poll()) != null) {
        try {
          task.run();
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Mailbox task failed", e);
        }
      }
    } finally {
      scheduled.set(false);
    }
    // A task may have been added after the last poll but before the flag was cleared
    scheduleIfIdle();
  }
}
