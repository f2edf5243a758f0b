package io.pagesync.core;

import io.pagesync.core.state.PropValue;

import java.util.Objects;

/**
 * Every frame exchanged over the synchronization channel or read from a producer feed.
 *
 * <p>State-changing messages are {@link Operation}s. The remaining members are signals that never
 * touch the store on their own.
 */
public sealed interface Message permits Operation, Message.SnapshotStart, Message.SnapshotEnd, Message.BatchStart,
        Message.BatchEnd, Message.Voice, Message.StreamStart, Message.StreamEnd, Message.DirectEdit,
        Message.DirectEditError {

    /** Wire discriminator of this message. */
    String wireType();

    /** Shared instances for the field-less signals. */
    SnapshotStart SNAPSHOT_START = new SnapshotStart();
    SnapshotEnd SNAPSHOT_END = new SnapshotEnd();
    BatchStart BATCH_START = new BatchStart();
    BatchEnd BATCH_END = new BatchEnd();
    StreamStart STREAM_START = new StreamStart();
    StreamEnd STREAM_END = new StreamEnd();

    record SnapshotStart() implements Message {
        @Override
        public String wireType() {
            return Protocol.SNAPSHOT_START;
        }
    }

    record SnapshotEnd() implements Message {
        @Override
        public String wireType() {
            return Protocol.SNAPSHOT_END;
        }
    }

    record BatchStart() implements Message {
        @Override
        public String wireType() {
            return Protocol.BATCH_START;
        }
    }

    record BatchEnd() implements Message {
        @Override
        public String wireType() {
            return Protocol.BATCH_END;
        }
    }

    record StreamStart() implements Message {
        @Override
        public String wireType() {
            return Protocol.STREAM_START;
        }
    }

    record StreamEnd() implements Message {
        @Override
        public String wireType() {
            return Protocol.STREAM_END;
        }
    }

    /**
     * Narration text relayed from a producer.
     */
    record Voice(String text) implements Message {
        public Voice {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String wireType() {
            return Protocol.VOICE;
        }
    }

    /**
     * Single-field edit requested by a human through a client.
     *
     * <p>Fields are nullable because a malformed request must still reach the server so it can be
     * answered with a {@link DirectEditError}.
     */
    record DirectEdit(String entityId, String field, PropValue value) implements Message {
        @Override
        public String wireType() {
            return Protocol.DIRECT_EDIT;
        }
    }

    /**
     * Sent to the requester only when a {@link DirectEdit} was rejected.
     */
    record DirectEditError(String error) implements Message {
        public DirectEditError {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String wireType() {
            return Protocol.DIRECT_EDIT_ERROR;
        }
    }
}
