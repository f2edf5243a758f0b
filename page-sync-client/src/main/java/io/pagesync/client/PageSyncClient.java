package io.pagesync.client;

import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.MessageCodecs;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ProtocolError;
import io.pagesync.core.PageSyncException.TransportError;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.core.state.PropValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps a {@link PageReplica} in step with one page on the server.
 *
 * <p>On every (re)connection the server sends a full snapshot that replaces the replica; live
 * operations are then applied in commit order. Socket failures schedule a reconnection with
 * exponential backoff until {@link #close()}.
 *
 * <pre>{@code
 * PageSyncClient client = PageSyncClient.builder(URI.create("ws://localhost:7070/ws/page/groceries"))
 *     .listener(myListener)
 *     .build();
 * client.connect();
 * }</pre>
 */
public final class PageSyncClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PageSyncClient.class);

    /** WebSocket close code 1000 (normal closure). */
    static final int CLOSE_NORMAL = 1000;

    static final String RECONNECT_THREAD = "page-sync-reconnect";

    private final URI uri;
    private final PageSyncTransport transport;
    private final MessageCodec codec;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final ReconnectionManager reconnection;
    private final List<PageSyncListener> listeners = new CopyOnWriteArrayList<>();
    private final PageReplica replica = new PageReplica();
    private final MessageReceiver receiver;

    private SyncState state = SyncState.DISCONNECTED;
    private TransportSession session;
    private long generation;
    private boolean closed;

    public static Builder builder(URI uri) {
        return new Builder(uri);
    }

    private PageSyncClient(Builder builder) {
        this.uri = Objects.requireNonNull(builder.uri, "uri");
        this.transport = builder.transport != null ? builder.transport : new JdkWebSocketTransport();
        this.codec = builder.codec != null ? builder.codec : MessageCodecs.load();
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = builder.scheduler != null ? builder.scheduler : Scheduler.daemon(RECONNECT_THREAD);
        Backoff backoff = builder.backoff != null ? builder.backoff : new Backoff();
        this.reconnection = new ReconnectionManager(backoff, scheduler, builder.maxReconnectAttempts);
        this.receiver = new MessageReceiver(codec, new Dispatch());
        this.listeners.addAll(builder.listeners);
    }

    public void addListener(PageSyncListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PageSyncListener listener) {
        listeners.remove(listener);
    }

    public synchronized SyncState state() {
        return state;
    }

    public PageReplica replica() {
        return replica;
    }

    public PageSnapshot snapshot() {
        return replica.snapshot();
    }

    /**
     * Starts connecting. No-op unless {@link SyncState.Disconnected}.
     *
     * @throws IllegalStateException after {@link #close()}
     */
    public synchronized void connect() {
        if (closed) {
            throw new IllegalStateException("client is closed");
        }
        if (!(state instanceof SyncState.Disconnected)) return;
        attempt();
    }

    /**
     * Sends an operation for the server to validate and apply. Rejections are silent; the replica only
     * changes when the server broadcasts the committed operation.
     */
    public CompletableFuture<Void> send(Operation operation) {
        return sendMessage(operation);
    }

    /**
     * Requests {@code entity_id.field = value}. A rejection arrives as
     * {@link PageSyncListener#onDirectEditError(String)}.
     */
    public CompletableFuture<Void> directEdit(String entityId, String field, PropValue value) {
        return sendMessage(new Message.DirectEdit(entityId, field, value));
    }

    private CompletableFuture<Void> sendMessage(Message message) {
        TransportSession s;
        synchronized (this) {
            s = session;
        }
        if (s == null) {
            return CompletableFuture.failedFuture(
                    new TransportError(TransportError.Kind.SOCKET_CLOSED, "not connected"));
        }
        String frame;
        try {
            frame = codec.encode(message);
        } catch (ProtocolError e) {
            return CompletableFuture.failedFuture(e);
        }
        return s.send(frame);
    }

    /**
     * Closes the socket and cancels any pending reconnection. Final. A scheduler passed to the builder
     * is left running; the default one is shut down.
     */
    @Override
    public void close() {
        TransportSession s;
        synchronized (this) {
            if (closed) return;
            closed = true;
            generation++;
            reconnection.cancel();
            receiver.reset();
            s = session;
            session = null;
            setState(SyncState.DISCONNECTED);
        }
        if (ownsScheduler) {
            scheduler.close();
        }
        if (s != null) {
            s.close(CLOSE_NORMAL, "client closed");
        }
    }

    // Guarded by this.
    private void attempt() {
        long gen = ++generation;
        setState(SyncState.CONNECTING);
        CompletableFuture<TransportSession> opening;
        try {
            opening = transport.open(uri, new SocketListener(gen));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((s, err) -> {
            if (err != null) {
                failed(gen, err);
            }
        });
    }

    private void reconnect() {
        synchronized (this) {
            if (closed) return;
            attempt();
        }
    }

    private synchronized void opened(long gen, TransportSession s) {
        if (gen != generation || closed) {
            s.close(CLOSE_NORMAL, "stale connection");
            return;
        }
        session = s;
        reconnection.connected();
        receiver.reset();
        setState(SyncState.HYDRATING);
    }

    private synchronized void received(long gen, String text) {
        if (gen != generation || closed) return;
        receiver.receive(text);
    }

    private synchronized void failed(long gen, Throwable error) {
        if (gen != generation || closed) return;
        generation++;
        TransportSession s = session;
        session = null;
        receiver.reset();
        if (s != null) {
            s.close(CLOSE_NORMAL, "reconnecting");
        }
        Duration delay = reconnection.scheduleRetry(this::reconnect);
        if (delay == null) {
            log.warn("Giving up on {} after {} attempts: {}", uri, reconnection.attempts(), error.toString());
            setState(SyncState.DISCONNECTED);
            return;
        }
        log.info("Connection to {} lost ({}); retrying in {} ms", uri, error.getMessage(), delay.toMillis());
        setState(new SyncState.Reconnecting(delay, reconnection.attempts()));
    }

    // Guarded by this.
    private void setState(SyncState next) {
        if (next.equals(state)) return;
        state = next;
        for (PageSyncListener l : listeners) {
            l.onStateChange(next);
        }
    }

    private final class SocketListener implements TransportListener {
        private final long gen;

        private SocketListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(TransportSession session) {
            opened(gen, session);
        }

        @Override
        public void onText(String text) {
            received(gen, text);
        }

        @Override
        public void onClosed(int code, String reason) {
            failed(gen, new TransportError(TransportError.Kind.SOCKET_CLOSED, "closed " + code + " " + reason));
        }

        @Override
        public void onError(Throwable error) {
            failed(gen, error);
        }
    }

    // Invoked under the client lock from received().
    private final class Dispatch implements MessageReceiver.Sink {

        @Override
        public void hydrationStarted() {
            setState(SyncState.HYDRATING);
        }

        @Override
        public void snapshot(List<Operation> operations) {
            PageSnapshot s = replica.replace(operations);
            setState(SyncState.LIVE);
            for (PageSyncListener l : listeners) {
                l.onSnapshot(operations, s);
            }
        }

        @Override
        public void operation(Operation operation) {
            PageSnapshot s = replica.apply(List.of(operation));
            for (PageSyncListener l : listeners) {
                l.onOperation(operation, s);
            }
        }

        @Override
        public void batch(List<Operation> operations) {
            PageSnapshot s = replica.apply(operations);
            for (PageSyncListener l : listeners) {
                l.onBatch(operations, s);
            }
        }

        @Override
        public void signal(Message signal) {
            for (PageSyncListener l : listeners) {
                if (signal instanceof Message.Voice voice) {
                    l.onVoice(voice.text());
                } else if (signal instanceof Message.StreamStart) {
                    l.onStreamStart();
                } else if (signal instanceof Message.StreamEnd) {
                    l.onStreamEnd();
                } else if (signal instanceof Message.DirectEditError err) {
                    l.onDirectEditError(err.error());
                }
            }
        }
    }

    /**
     * Builder for {@link PageSyncClient}.
     */
    public static final class Builder {
        private final URI uri;
        private PageSyncTransport transport;
        private MessageCodec codec;
        private Scheduler scheduler;
        private Backoff backoff;
        private int maxReconnectAttempts;
        private final List<PageSyncListener> listeners = new CopyOnWriteArrayList<>();

        private Builder(URI uri) {
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        /** Sets the socket transport. Default: {@link JdkWebSocketTransport}. */
        public Builder transport(PageSyncTransport transport) {
            this.transport = transport;
            return this;
        }

        /** Sets the message codec. Default: the one found by {@link MessageCodecs#load()}. */
        public Builder codec(MessageCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the timer used for reconnection delays. The client never closes a scheduler set here.
         * Default: a single daemon thread owned by the client.
         */
        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /** Sets the backoff policy. Default: 1000 ms doubling to 30000 ms. */
        public Builder backoff(Backoff backoff) {
            this.backoff = backoff;
            return this;
        }

        /** Consecutive failed attempts before giving up. Default: 0 (retry forever). */
        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder listener(PageSyncListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public PageSyncClient build() {
            return new PageSyncClient(this);
        }
    }
}
