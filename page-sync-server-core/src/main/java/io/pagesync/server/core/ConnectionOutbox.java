package io.pagesync.server.core;

import io.pagesync.server.spi.PageConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Bounded queue of encoded frames for one connection, drained by at most one task at a time.
 *
 * <p>Offers never block. A multi-frame offer is taken whole or not at all; when it does not fit the
 * connection is closed with {@link #CLOSE_TRY_AGAIN_LATER} so the client re-hydrates. The close itself
 * runs on the executor.
 */
final class ConnectionOutbox {

    private static final Logger log = LoggerFactory.getLogger(ConnectionOutbox.class);

    /** WebSocket close code 1013 (try again later). */
    static final int CLOSE_TRY_AGAIN_LATER = 1013;

    private final PageConnection connection;
    private final int capacity;
    private final Executor executor;
    private final Consumer<ConnectionOutbox> onClosed;
    private final ArrayDeque<String> queue = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    ConnectionOutbox(PageConnection connection, int capacity, Executor executor, Consumer<ConnectionOutbox> onClosed) {
        this.connection = Objects.requireNonNull(connection, "connection");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed");
    }

    String connectionId() {
        return connection.id();
    }

    boolean offer(String frame) {
        return offerAll(List.of(frame));
    }

    /**
     * Enqueues all frames contiguously.
     *
     * @return {@code false} if the outbox is closed or overflowed (and is now closed)
     */
    boolean offerAll(List<String> frames) {
        boolean overflow;
        synchronized (this) {
            if (closed) return false;
            overflow = queue.size() + frames.size() > capacity;
            if (!overflow) {
                queue.addAll(frames);
                if (!draining) {
                    draining = true;
                    executor.execute(this::drain);
                }
                return true;
            }
            closed = true;
            queue.clear();
        }
        log.warn("Outbox for connection {} overflowed ({} frames); closing", connection.id(), capacity);
        // Callers hold the document lock; the socket close must not run under it.
        executor.execute(() -> connection.close(CLOSE_TRY_AGAIN_LATER, "outbox overflow"));
        onClosed.accept(this);
        return false;
    }

    /** Stops accepting frames and discards what is queued. Does not close the socket. */
    synchronized void discard() {
        closed = true;
        queue.clear();
    }

    private void drain() {
        while (true) {
            String frame;
            synchronized (this) {
                frame = closed ? null : queue.poll();
                if (frame == null) {
                    draining = false;
                    return;
                }
            }
            try {
                connection.send(frame);
            } catch (Exception e) {
                log.debug("Send to connection {} failed: {}", connection.id(), e.toString());
                synchronized (this) {
                    closed = true;
                    queue.clear();
                    draining = false;
                }
                onClosed.accept(this);
                return;
            }
        }
    }
}
