package io.pagesync.core.state;

import io.pagesync.core.Message;
import io.pagesync.core.Operation;
import io.pagesync.core.PageSyncException.ValidationError;

import java.util.Objects;

/**
 * Pure application of messages to snapshots. No I/O, clock or randomness.
 */
public final class Reducer {

    private Reducer() {}

    /**
     * Applies {@code message} to {@code snapshot}. Signals (anything that is not an {@link Operation})
     * are accepted and leave the snapshot untouched.
     */
    public static ApplyResult apply(PageSnapshot snapshot, Message message) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(message, "message");
        if (!(message instanceof Operation op)) {
            return new ApplyResult.Unchanged(snapshot);
        }
        EntityStore store = EntityStore.from(snapshot);
        try {
            if (!store.apply(op)) {
                return new ApplyResult.Unchanged(snapshot);
            }
        } catch (ValidationError e) {
            return new ApplyResult.Rejected(snapshot, e);
        }
        return new ApplyResult.Applied(store.snapshot());
    }
}
