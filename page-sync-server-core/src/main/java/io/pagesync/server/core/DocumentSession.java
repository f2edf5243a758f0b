package io.pagesync.server.core;

import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ProtocolError;
import io.pagesync.core.PageSyncException.ValidationError;
import io.pagesync.core.Protocol;
import io.pagesync.core.state.Cardinality;
import io.pagesync.core.state.EntityStore;
import io.pagesync.core.state.Hydration;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.core.state.Props;
import io.pagesync.server.spi.OperationLog;
import io.pagesync.server.spi.PageConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single writer for one page.
 *
 * <p>Every state change and every hydration runs under one lock, so committed operations reach each
 * connection in commit order and never interleave a hydration. Socket writes happen later, on the
 * connection's outbox drain task.
 */
public final class DocumentSession {

    private static final Logger log = LoggerFactory.getLogger(DocumentSession.class);

    private final String pageId;
    private final EntityStore store;
    private final OperationLog operationLog;
    private final MessageCodec codec;
    private final int outboxCapacity;
    private final Executor executor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ConnectionOutbox> outboxes = new LinkedHashMap<>();

    DocumentSession(String pageId, EntityStore store, OperationLog operationLog, MessageCodec codec,
                    int outboxCapacity, Executor executor) {
        this.pageId = Objects.requireNonNull(pageId, "pageId");
        this.store = Objects.requireNonNull(store, "store");
        this.operationLog = Objects.requireNonNull(operationLog, "operationLog");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.outboxCapacity = outboxCapacity;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public String pageId() {
        return pageId;
    }

    /**
     * Registers a connection and queues its hydration as one unit.
     *
     * @return {@code false} if the hydration alone did not fit the outbox (the connection is closed)
     */
    public boolean attach(PageConnection connection) {
        lock.lock();
        try {
            ConnectionOutbox outbox = new ConnectionOutbox(connection, outboxCapacity, executor, this::outboxClosed);
            List<String> frames = encodeAll(Hydration.messages(store.snapshot()));
            if (!outbox.offerAll(frames)) {
                return false;
            }
            ConnectionOutbox previous = outboxes.put(connection.id(), outbox);
            if (previous != null) {
                previous.discard();
            }
            log.debug("Connection {} attached to page {} ({} hydration frames)", connection.id(), pageId, frames.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void detach(String connectionId) {
        lock.lock();
        try {
            ConnectionOutbox outbox = outboxes.remove(connectionId);
            if (outbox != null) {
                outbox.discard();
                log.debug("Connection {} detached from page {}", connectionId, pageId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validates, applies, logs and broadcasts one operation.
     */
    public SubmitOutcome submit(Operation op) {
        lock.lock();
        try {
            Staged staged = stage(op);
            if (staged.frame() == null) {
                return staged.outcome();
            }
            operationLog.append(pageId, List.of(staged.op()));
            broadcast(List.of(staged.frame()));
            return staged.outcome();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a bracketed run of operations in one critical section and broadcasts the effective ones
     * between {@code batch.start} and {@code batch.end}. Rejected operations are dropped.
     *
     * @return one outcome per input operation, in order
     */
    public List<SubmitOutcome> submitBatch(List<Operation> ops) {
        lock.lock();
        try {
            List<SubmitOutcome> outcomes = new ArrayList<>(ops.size());
            List<Operation> committed = new ArrayList<>();
            List<String> frames = new ArrayList<>(ops.size() + 2);
            frames.add(codec.encode(Message.BATCH_START));
            for (Operation op : ops) {
                Staged staged = stage(op);
                outcomes.add(staged.outcome());
                if (staged.frame() != null) {
                    committed.add(staged.op());
                    frames.add(staged.frame());
                }
            }
            if (!committed.isEmpty()) {
                operationLog.append(pageId, committed);
                frames.add(codec.encode(Message.BATCH_END));
                broadcast(frames);
            }
            return outcomes;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Encodes and applies one operation. The frame is only set when state changed; an operation
     * that cannot be encoded is rejected before it touches state.
     */
    private Staged stage(Operation op) {
        Operation normalized = withEffectiveCardinality(op);
        String frame;
        try {
            frame = codec.encode(normalized);
        } catch (ProtocolError e) {
            return rejected(normalized, new ValidationError(ValidationError.Kind.INVALID_VALUE, e.getMessage()));
        }
        try {
            if (!store.apply(normalized)) {
                return new Staged(normalized, null, SubmitOutcome.unchanged());
            }
        } catch (ValidationError e) {
            return rejected(normalized, e);
        }
        return new Staged(normalized, frame, SubmitOutcome.applied());
    }

    private Staged rejected(Operation op, ValidationError e) {
        log.debug("Rejected {} on page {}: {}", op.wireType(), pageId, e.getMessage());
        return new Staged(op, null, SubmitOutcome.rejected(e));
    }

    // Replicas apply the frame with their own registry, so it must name the cardinality the server used.
    private Operation withEffectiveCardinality(Operation op) {
        if (op instanceof Operation.RelSet rel && rel.cardinality() == null && rel.type() != null) {
            Cardinality registered = store.cardinalityOf(rel.type());
            return new Operation.RelSet(rel.from(), rel.to(), rel.type(),
                    registered != null ? registered : Cardinality.MANY_TO_MANY);
        }
        return op;
    }

    private record Staged(Operation op, String frame, SubmitOutcome outcome) {}

    /**
     * Turns a direct edit into {@code entity.update{ref, p:{field: value}}}. On success the update is
     * broadcast to everyone, the requester included; on failure only the requester gets a
     * {@code direct_edit.error} and canonical state is untouched.
     */
    public SubmitOutcome directEdit(String connectionId, Message.DirectEdit edit) {
        ValidationError missing = checkDirectEdit(edit);
        if (missing != null) {
            replyError(connectionId, missing);
            return SubmitOutcome.rejected(missing);
        }
        Operation update = new Operation.EntityUpdate(edit.entityId(), Props.of(edit.field(), edit.value()));
        SubmitOutcome outcome = submit(update);
        if (!outcome.accepted()) {
            replyError(connectionId, outcome.error());
        }
        return outcome;
    }

    private static ValidationError checkDirectEdit(Message.DirectEdit edit) {
        String field = edit.entityId() == null ? Protocol.F_ENTITY_ID
                : edit.field() == null ? Protocol.F_FIELD
                : edit.value() == null ? Protocol.F_VALUE
                : null;
        if (field == null) return null;
        return new ValidationError(ValidationError.Kind.MISSING_FIELD, "direct_edit requires '" + field + "'");
    }

    private void replyError(String connectionId, ValidationError error) {
        lock.lock();
        try {
            ConnectionOutbox outbox = outboxes.get(connectionId);
            if (outbox != null) {
                outbox.offer(codec.encode(new Message.DirectEditError(error.getMessage())));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Relays a signal that does not touch state ({@code voice}, {@code stream.start}, ...) to every connection.
     */
    public void relay(Message signal) {
        if (signal instanceof Operation) {
            throw new IllegalArgumentException("operations must be submitted, not relayed");
        }
        lock.lock();
        try {
            broadcast(List.of(codec.encode(signal)));
        } finally {
            lock.unlock();
        }
    }

    public PageSnapshot snapshot() {
        lock.lock();
        try {
            return store.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return outboxes.size();
        } finally {
            lock.unlock();
        }
    }

    private void broadcast(List<String> frames) {
        for (ConnectionOutbox outbox : new ArrayList<>(outboxes.values())) {
            outbox.offerAll(frames);
        }
    }

    private List<String> encodeAll(List<Message> messages) {
        List<String> frames = new ArrayList<>(messages.size());
        for (Message m : messages) {
            frames.add(codec.encode(m));
        }
        return frames;
    }

    private void outboxClosed(ConnectionOutbox outbox) {
        lock.lock();
        try {
            outboxes.remove(outbox.connectionId(), outbox);
        } finally {
            lock.unlock();
        }
    }
}
