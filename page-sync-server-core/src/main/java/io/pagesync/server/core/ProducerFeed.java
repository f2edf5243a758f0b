package io.pagesync.server.core;

import io.pagesync.core.Message;
import io.pagesync.core.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Routes one producer's messages into a {@link DocumentSession}.
 *
 * <p>Operations outside a batch are submitted one by one. Operations between {@code batch.start} and
 * {@code batch.end} are held and submitted as one unit. {@code voice} and {@code stream.*} markers are
 * relayed to every connection. Rejected operations are dropped. Not thread-safe; one feed per producer.
 */
public final class ProducerFeed {

    private static final Logger log = LoggerFactory.getLogger(ProducerFeed.class);

    private final DocumentSession session;
    private final List<Operation> batch = new ArrayList<>();
    private boolean inBatch;
    private int accepted;
    private int rejected;

    public ProducerFeed(DocumentSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    public void accept(Message message) {
        if (message instanceof Operation op) {
            if (inBatch) {
                batch.add(op);
            } else {
                count(List.of(session.submit(op)));
            }
        } else if (message instanceof Message.BatchStart) {
            if (inBatch) {
                log.debug("Nested batch.start on page {}; continuing the open batch", session.pageId());
            }
            inBatch = true;
        } else if (message instanceof Message.BatchEnd) {
            flushBatch();
        } else if (message instanceof Message.Voice
                || message instanceof Message.StreamStart
                || message instanceof Message.StreamEnd) {
            session.relay(message);
        } else {
            log.debug("Ignoring {} from producer on page {}", message.wireType(), session.pageId());
        }
    }

    /**
     * Ends the feed. An unterminated batch is submitted as if {@code batch.end} had arrived.
     */
    public FeedResult finish() {
        if (inBatch) {
            log.warn("Producer on page {} ended inside a batch of {} operations; committing it", session.pageId(), batch.size());
            flushBatch();
        }
        return new FeedResult(accepted, rejected, 0);
    }

    private void flushBatch() {
        inBatch = false;
        if (batch.isEmpty()) return;
        List<Operation> ops = new ArrayList<>(batch);
        batch.clear();
        count(session.submitBatch(ops));
    }

    private void count(List<SubmitOutcome> outcomes) {
        for (SubmitOutcome o : outcomes) {
            if (o.accepted()) {
                accepted++;
            } else {
                rejected++;
            }
        }
    }
}
