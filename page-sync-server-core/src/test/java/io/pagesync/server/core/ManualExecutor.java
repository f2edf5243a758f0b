package io.pagesync.server.core;

import java.util.ArrayDeque;
import java.util.concurrent.AbstractExecutorService;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Runs tasks immediately, or queues them while paused. */
final class ManualExecutor extends AbstractExecutorService {
    private final ArrayDeque<Runnable> pending = new ArrayDeque<>();
    private boolean paused;
    private boolean shutdown;

    void pause() {
        paused = true;
    }

    void resume() {
        paused = false;
        Runnable r;
        while ((r = pending.poll()) != null) {
            r.run();
        }
    }

    @Override
    public void execute(Runnable command) {
        if (paused) {
            pending.add(command);
        } else {
            command.run();
        }
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    @Override
    public List<Runnable> shutdownNow() {
        shutdown = true;
        return List.copyOf(pending);
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        return shutdown;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return true;
    }
}
