package io.pagesync.client;

import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ValidationError;
import io.pagesync.core.state.EntityStore;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.core.state.Replay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Local copy of the page, rebuilt wholesale on every hydration and advanced by the same store logic
 * the server runs.
 *
 * <p>Live operations mutate one {@link EntityStore} in place; a snapshot is taken once per delivered
 * unit (an operation or a whole batch). Mutators are called under the client lock.
 */
public final class PageReplica {

    private static final Logger log = LoggerFactory.getLogger(PageReplica.class);

    private EntityStore store = new EntityStore();
    private volatile PageSnapshot snapshot = store.snapshot();

    public PageSnapshot snapshot() {
        return snapshot;
    }

    /** Replaces state with the hydrated operations. Nothing from the previous state survives. */
    PageSnapshot replace(List<Operation> hydration) {
        store = Replay.replayInto(new EntityStore(), hydration);
        return publish();
    }

    PageSnapshot apply(List<Operation> operations) {
        for (Operation op : operations) {
            try {
                store.apply(op);
            } catch (ValidationError e) {
                log.warn("Replica rejected {}: {}", op.wireType(), e.getMessage());
            }
        }
        return publish();
    }

    private PageSnapshot publish() {
        PageSnapshot s = store.snapshot();
        snapshot = s;
        return s;
    }
}
