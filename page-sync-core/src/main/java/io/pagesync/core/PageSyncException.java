package io.pagesync.core;

import java.util.Objects;

/**
 * Base class for Page Sync related exceptions.
 *
 * <p>Three families exist: validation failures raised by the entity store, transport failures
 * raised by the synchronization channel, and protocol failures raised while decoding messages.
 * Each carries a {@code Kind} so callers can branch without parsing messages.
 */
public abstract class PageSyncException extends RuntimeException {

    protected PageSyncException(String message) {
        super(message);
    }

    protected PageSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised (or returned inside an {@code ApplyResult}) when an operation would break a store invariant.
     */
    public static class ValidationError extends PageSyncException {

        public enum Kind {
            UNKNOWN_PARENT,
            DUPLICATE_ID,
            UNKNOWN_ENTITY,
            INVALID_REORDER,
            INVALID_CARDINALITY,
            INVALID_MOVE,
            DUPLICATE_PAGE,
            INVALID_ID,
            MISSING_FIELD,
            CONSTRAINT_VIOLATED,
            /** A value the wire format cannot carry. */
            INVALID_VALUE
        }

        private final Kind kind;

        public ValidationError(Kind kind, String message) {
            super(kind + ": " + message);
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Kind kind() {
            return kind;
        }
    }

    /**
     * Raised by the channel when a socket cannot be opened or goes away.
     */
    public static class TransportError extends PageSyncException {

        public enum Kind {
            CONNECT_FAILED,
            SOCKET_CLOSED
        }

        private final Kind kind;

        public TransportError(Kind kind, String message) {
            super(kind + ": " + message);
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public TransportError(Kind kind, String message, Throwable cause) {
            super(kind + ": " + message, cause);
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Kind kind() {
            return kind;
        }
    }

    /**
     * Raised when an incoming message cannot be decoded.
     */
    public static class ProtocolError extends PageSyncException {

        public enum Kind {
            MALFORMED_MESSAGE
        }

        private final Kind kind;

        public ProtocolError(String message) {
            super(Kind.MALFORMED_MESSAGE + ": " + message);
            this.kind = Kind.MALFORMED_MESSAGE;
        }

        public ProtocolError(String message, Throwable cause) {
            super(Kind.MALFORMED_MESSAGE + ": " + message, cause);
            this.kind = Kind.MALFORMED_MESSAGE;
        }

        public Kind kind() {
            return kind;
        }
    }
}
