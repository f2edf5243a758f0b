package io.pagesync.client;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delayed task execution for reconnection timers.
 */
public interface Scheduler extends AutoCloseable {

    Cancellable schedule(Duration delay, Runnable task);

    /** Releases the scheduler's threads, if it has any. Pending tasks are dropped. */
    @Override
    default void close() {
    }

    interface Cancellable {
        void cancel();
    }

    /**
     * Scheduler on a single daemon thread, stopped by {@link #close()}.
     */
    static Scheduler daemon(String threadName) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        return new Scheduler() {
            @Override
            public Cancellable schedule(Duration delay, Runnable task) {
                ScheduledFuture<?> f = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
                return () -> f.cancel(false);
            }

            @Override
            public void close() {
                executor.shutdownNow();
            }
        };
    }
}
