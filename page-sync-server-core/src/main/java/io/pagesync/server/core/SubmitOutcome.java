package io.pagesync.server.core;

import io.pagesync.core.PageSyncException.ValidationError;

import java.util.Objects;

/**
 * Result of submitting one operation to a {@link DocumentSession}.
 */
public final class SubmitOutcome {

    public enum Status {
        /** State changed; the operation was logged and broadcast. */
        APPLIED,
        /** Valid but no effect; nothing was logged or broadcast. */
        UNCHANGED,
        REJECTED
    }

    private static final SubmitOutcome APPLIED = new SubmitOutcome(Status.APPLIED, null);
    private static final SubmitOutcome UNCHANGED = new SubmitOutcome(Status.UNCHANGED, null);

    private final Status status;
    private final ValidationError error;

    private SubmitOutcome(Status status, ValidationError error) {
        this.status = Objects.requireNonNull(status, "status");
        this.error = error;
    }

    static SubmitOutcome applied() {
        return APPLIED;
    }

    static SubmitOutcome unchanged() {
        return UNCHANGED;
    }

    static SubmitOutcome rejected(ValidationError error) {
        return new SubmitOutcome(Status.REJECTED, Objects.requireNonNull(error, "error"));
    }

    public Status status() {
        return status;
    }

    public boolean accepted() {
        return status != Status.REJECTED;
    }

    /** The validation failure, or {@code null} unless {@link Status#REJECTED}. */
    public ValidationError error() {
        return error;
    }
}
