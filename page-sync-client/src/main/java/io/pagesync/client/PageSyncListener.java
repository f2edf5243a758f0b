package io.pagesync.client;

import io.pagesync.core.Operation;
import io.pagesync.core.state.PageSnapshot;

import java.util.List;

/**
 * Callbacks from a {@link PageSyncClient}. All methods default to no-ops and run on the transport
 * thread, one at a time.
 */
public interface PageSyncListener {

    default void onStateChange(SyncState state) {
    }

    /**
     * A full hydration arrived. Fires exactly once per connection, after {@code snapshot.end};
     * {@code snapshot} has replaced any previous state.
     */
    default void onSnapshot(List<Operation> operations, PageSnapshot snapshot) {
    }

    /** One live operation, in server commit order. */
    default void onOperation(Operation operation, PageSnapshot snapshot) {
    }

    /** A {@code batch.start ... batch.end} bracket, delivered whole. */
    default void onBatch(List<Operation> operations, PageSnapshot snapshot) {
    }

    default void onVoice(String text) {
    }

    default void onStreamStart() {
    }

    default void onStreamEnd() {
    }

    /** The server rejected this client's direct edit. The connection stays live. */
    default void onDirectEditError(String error) {
    }
}
