package io.pagesync.core.state;

import io.pagesync.core.PageSyncException.ValidationError;

import java.util.Objects;

/**
 * Outcome of applying one operation to a snapshot.
 */
public sealed interface ApplyResult permits ApplyResult.Applied, ApplyResult.Unchanged, ApplyResult.Rejected {

    PageSnapshot snapshot();

    default boolean accepted() {
        return !(this instanceof Rejected);
    }

    /** The operation changed state; {@code snapshot} is the new value. */
    record Applied(PageSnapshot snapshot) implements ApplyResult {
        public Applied {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    /** The operation was valid but had no effect; {@code snapshot} is the input reference. */
    record Unchanged(PageSnapshot snapshot) implements ApplyResult {
        public Unchanged {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    /** The operation was invalid; {@code snapshot} is the untouched input. */
    record Rejected(PageSnapshot snapshot, ValidationError error) implements ApplyResult {
        public Rejected {
            Objects.requireNonNull(snapshot, "snapshot");
            Objects.requireNonNull(error, "error");
        }
    }
}
