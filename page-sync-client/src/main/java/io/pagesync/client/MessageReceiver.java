package io.pagesync.client;

import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ProtocolError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the raw frame stream into atomic units.
 *
 * <p>Everything between {@code snapshot.start} and {@code snapshot.end} is buffered and handed over
 * as one list; everything between {@code batch.start} and {@code batch.end} likewise. Malformed
 * frames are dropped. Not thread-safe.
 */
final class MessageReceiver {

    private static final Logger log = LoggerFactory.getLogger(MessageReceiver.class);

    interface Sink {
        void hydrationStarted();

        void snapshot(List<Operation> operations);

        void operation(Operation operation);

        void batch(List<Operation> operations);

        void signal(Message signal);
    }

    private final MessageCodec codec;
    private final Sink sink;
    private final List<Operation> hydration = new ArrayList<>();
    private final List<Operation> batch = new ArrayList<>();
    private boolean hydrating;
    private boolean inBatch;

    MessageReceiver(MessageCodec codec, Sink sink) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    void receive(String text) {
        Message message;
        try {
            message = codec.decode(text);
        } catch (ProtocolError e) {
            log.debug("Dropping malformed frame: {}", e.getMessage());
            return;
        }
        receive(message);
    }

    void receive(Message message) {
        if (message instanceof Message.SnapshotStart) {
            reset();
            hydrating = true;
            sink.hydrationStarted();
        } else if (message instanceof Message.SnapshotEnd) {
            if (!hydrating) {
                log.debug("snapshot.end without snapshot.start; ignoring");
                return;
            }
            List<Operation> ops = List.copyOf(hydration);
            hydration.clear();
            hydrating = false;
            sink.snapshot(ops);
        } else if (message instanceof Operation op) {
            if (hydrating) {
                hydration.add(op);
            } else if (inBatch) {
                batch.add(op);
            } else {
                sink.operation(op);
            }
        } else if (message instanceof Message.BatchStart) {
            inBatch = true;
        } else if (message instanceof Message.BatchEnd) {
            if (!inBatch) return;
            List<Operation> ops = List.copyOf(batch);
            batch.clear();
            inBatch = false;
            sink.batch(ops);
        } else {
            sink.signal(message);
        }
    }

    /** Drops any partial hydration or batch; used when the socket goes away. */
    void reset() {
        hydration.clear();
        batch.clear();
        hydrating = false;
        inBatch = false;
    }
}
