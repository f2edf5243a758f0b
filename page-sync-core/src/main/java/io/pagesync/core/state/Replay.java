package io.pagesync.core.state;

import io.pagesync.core.Message;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ValidationError;

/**
 * Rebuilds page state from an operation log. Rejected operations are skipped, so replaying the
 * same log always yields an equal snapshot.
 */
public final class Replay {

    private Replay() {}

    public static PageSnapshot replay(Iterable<? extends Message> log) {
        return replayInto(new EntityStore(), log).snapshot();
    }

    /**
     * Applies {@code log} on top of {@code store} and returns it.
     */
    public static EntityStore replayInto(EntityStore store, Iterable<? extends Message> log) {
        for (Message m : log) {
            if (!(m instanceof Operation op)) continue;
            try {
                store.apply(op);
            } catch (ValidationError ignored) {
                // rejected operations never reached the canonical state
            }
        }
        return store;
    }
}
