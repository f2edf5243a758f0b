package io.pagesync.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default executor for outbox drains.
 *
 * <p>A drain blocks on its socket for as long as a write takes, so threads are created on demand
 * rather than capped, and reaped after sitting idle. Threads are daemons named
 * {@code <prefix>-<n>}; a drain that dies with an exception is logged, not lost.
 */
final class DrainThreads implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(DrainThreads.class);

    static final long IDLE_SECONDS = 30;

    private final String prefix;
    private final AtomicInteger created = new AtomicInteger();

    private DrainThreads(String prefix) {
        this.prefix = prefix;
    }

    static ExecutorService newPool(String prefix) {
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, IDLE_SECONDS, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new DrainThreads(prefix));
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread t = new Thread(task, prefix + "-" + created.incrementAndGet());
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, e) -> log.error("Outbox drain on {} failed", thread.getName(), e));
        return t;
    }
}
