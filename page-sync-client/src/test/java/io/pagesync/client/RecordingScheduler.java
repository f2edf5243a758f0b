package io.pagesync.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Scheduler that records timers and fires them on demand. */
final class RecordingScheduler implements Scheduler {

    final List<Timer> timers = new ArrayList<>();
    boolean closed;

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        Timer t = new Timer(delay, task);
        timers.add(t);
        return t;
    }

    @Override
    public void close() {
        closed = true;
    }

    List<Duration> delays() {
        return timers.stream().map(t -> t.delay).toList();
    }

    void fireLast() {
        Timer t = timers.get(timers.size() - 1);
        if (!t.cancelled) {
            t.task.run();
        }
    }

    static final class Timer implements Cancellable {
        final Duration delay;
        final Runnable task;
        boolean cancelled;

        Timer(Duration delay, Runnable task) {
            this.delay = delay;
            this.task = task;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }
    }
}
