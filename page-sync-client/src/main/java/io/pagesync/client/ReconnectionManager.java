package io.pagesync.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Owns the retry timer. Knows nothing about messages.
 */
final class ReconnectionManager {

    private final Backoff backoff;
    private final Scheduler scheduler;
    private final int maxAttempts;
    private Scheduler.Cancellable pending;

    /**
     * @param maxAttempts consecutive failures tolerated before giving up; 0 means unlimited
     */
    ReconnectionManager(Backoff backoff, Scheduler scheduler, int maxAttempts) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Schedules {@code reconnect} after the next backoff delay.
     *
     * @return the delay, or {@code null} if the attempt budget is spent
     */
    Duration scheduleRetry(Runnable reconnect) {
        cancel();
        if (maxAttempts > 0 && backoff.attempts() >= maxAttempts) {
            return null;
        }
        Duration delay = backoff.next();
        pending = scheduler.schedule(delay, reconnect);
        return delay;
    }

    int attempts() {
        return backoff.attempts();
    }

    /** A socket opened: the next failure starts from the initial delay again. */
    void connected() {
        backoff.reset();
    }

    void cancel() {
        Scheduler.Cancellable p = pending;
        pending = null;
        if (p != null) {
            p.cancel();
        }
    }
}
