package io.pagesync.server.core;

import io.pagesync.core.MessageCodec;
import io.pagesync.core.Operation;
import io.pagesync.core.state.EntityStore;
import io.pagesync.core.state.Replay;
import io.pagesync.server.spi.OperationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * One {@link DocumentSession} per page id, bootstrapped by replaying the page's operation log.
 */
final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, DocumentSession> sessions = new ConcurrentHashMap<>();
    private final OperationLog operationLog;
    private final MessageCodec codec;
    private final int outboxCapacity;
    private final Executor executor;

    SessionRegistry(OperationLog operationLog, MessageCodec codec, int outboxCapacity, Executor executor) {
        this.operationLog = Objects.requireNonNull(operationLog, "operationLog");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.outboxCapacity = outboxCapacity;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    DocumentSession session(String pageId) {
        return sessions.computeIfAbsent(pageId, this::open);
    }

    private DocumentSession open(String pageId) {
        List<Operation> history = operationLog.load(pageId);
        EntityStore store = Replay.replayInto(new EntityStore(), history);
        log.info("Opened page {} from {} logged operations (sequence {})", pageId, history.size(), store.sequence());
        return new DocumentSession(pageId, store, operationLog, codec, outboxCapacity, executor);
    }
}
