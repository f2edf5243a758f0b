package io.pagesync.server.core;

import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.MessageCodecs;
import io.pagesync.core.PageSyncException.ProtocolError;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.json.jackson.JsonlMessageReader;
import io.pagesync.server.spi.InMemoryOperationLog;
import io.pagesync.server.spi.OperationLog;
import io.pagesync.server.spi.PageConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;

/**
 * Framework-neutral server side of the synchronization channel.
 *
 * <p>Bindings forward socket lifecycle events ({@link #onOpen}, {@link #onMessage}, {@link #onClose})
 * and producer uploads ({@link #ingest}). Persistence is delegated to an {@link OperationLog}.
 *
 * <pre>{@code
 * PageSyncHandler handler = PageSyncHandler.builder()
 *     .operationLog(myLog)
 *     .outboxCapacity(512)
 *     .build();
 * }</pre>
 */
public final class PageSyncHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PageSyncHandler.class);

    /** Default per-connection outbox bound, in frames. */
    public static final int DEFAULT_OUTBOX_CAPACITY = 1024;

    /** WebSocket close code 1008 (policy violation), used for unusable page ids. */
    public static final int CLOSE_POLICY_VIOLATION = 1008;

    static final String OUTBOX_THREADS = "page-sync-outbox";

    private final SessionRegistry sessions;
    private final MessageCodec codec;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final ConcurrentMap<String, Attachment> connections = new ConcurrentHashMap<>();

    public static Builder builder() {
        return new Builder();
    }

    public PageSyncHandler() {
        this(builder());
    }

    private PageSyncHandler(Builder builder) {
        this.codec = builder.codec != null ? builder.codec : MessageCodecs.load();
        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null ? builder.executor : DrainThreads.newPool(OUTBOX_THREADS);
        OperationLog operationLog = builder.operationLog != null ? builder.operationLog : new InMemoryOperationLog();
        int capacity = builder.outboxCapacity > 0 ? builder.outboxCapacity : DEFAULT_OUTBOX_CAPACITY;
        this.sessions = new SessionRegistry(operationLog, codec, capacity, executor);
    }

    /**
     * A socket for {@code pageId} opened: hydrate it and start delivering commits.
     */
    public void onOpen(PageConnection connection, String pageId) {
        Objects.requireNonNull(connection, "connection");
        if (pageId == null || pageId.isBlank()) {
            connection.close(CLOSE_POLICY_VIOLATION, "missing page id");
            return;
        }
        DocumentSession session = sessions.session(pageId);
        connections.put(connection.id(), new Attachment(session, new ProducerFeed(session)));
        if (!session.attach(connection)) {
            connections.remove(connection.id());
        }
    }

    /**
     * A text frame arrived. Malformed frames are dropped without affecting the connection.
     */
    public void onMessage(String connectionId, String text) {
        Attachment attachment = connections.get(connectionId);
        if (attachment == null) {
            log.debug("Message from unknown connection {}", connectionId);
            return;
        }
        Message message;
        try {
            message = codec.decode(text);
        } catch (ProtocolError e) {
            log.debug("Dropping malformed frame from {}: {}", connectionId, e.getMessage());
            return;
        }
        if (message instanceof Message.DirectEdit edit) {
            attachment.session.directEdit(connectionId, edit);
            return;
        }
        synchronized (attachment) {
            attachment.feed.accept(message);
        }
    }

    public void onClose(String connectionId) {
        Attachment attachment = connections.remove(connectionId);
        if (attachment == null) return;
        attachment.session.detach(connectionId);
        synchronized (attachment) {
            attachment.feed.finish();
        }
    }

    /**
     * Applies a JSONL producer upload to a page.
     */
    public FeedResult ingest(String pageId, Reader jsonl) throws IOException {
        JsonlMessageReader reader = new JsonlMessageReader(codec);
        List<Message> messages = reader.readAll(jsonl);
        ProducerFeed feed = new ProducerFeed(sessions.session(pageId));
        for (Message m : messages) {
            feed.accept(m);
        }
        FeedResult result = feed.finish();
        log.info("Producer feed for page {}: {} accepted, {} rejected, {} malformed",
                pageId, result.accepted(), result.rejected(), reader.skipped());
        return new FeedResult(result.accepted(), result.rejected(), reader.skipped());
    }

    public PageSnapshot snapshot(String pageId) {
        return sessions.session(pageId).snapshot();
    }

    /** The live session for a page; created (and replayed) on first use. */
    public DocumentSession session(String pageId) {
        return sessions.session(pageId);
    }

    public MessageCodec codec() {
        return codec;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static final class Attachment {
        final DocumentSession session;
        final ProducerFeed feed;

        Attachment(DocumentSession session, ProducerFeed feed) {
            this.session = session;
            this.feed = feed;
        }
    }

    /**
     * Builder for {@link PageSyncHandler}.
     */
    public static final class Builder {
        private OperationLog operationLog;
        private MessageCodec codec;
        private ExecutorService executor;
        private int outboxCapacity;

        private Builder() {}

        /** Sets the operation log. Default: {@link InMemoryOperationLog}. */
        public Builder operationLog(OperationLog operationLog) {
            this.operationLog = operationLog;
            return this;
        }

        /** Sets the message codec. Default: the one found by {@link MessageCodecs#load()}. */
        public Builder codec(MessageCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the executor running outbox drain tasks. Default: an on-demand pool of daemon threads named {@code page-sync-outbox-<n>}.
         * A supplied executor is not shut down by {@link PageSyncHandler#close()}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /** Sets the per-connection outbox bound in frames. Default: 1024. */
        public Builder outboxCapacity(int outboxCapacity) {
            this.outboxCapacity = outboxCapacity;
            return this;
        }

        public PageSyncHandler build() {
            return new PageSyncHandler(this);
        }
    }
}
