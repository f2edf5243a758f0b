package io.pagesync.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection state of a {@link PageSyncClient}.
 *
 * <pre>
 * Disconnected -> Connecting -> Hydrating -> Live
 * Connecting | Hydrating | Live -> Reconnecting(delay) -> Connecting
 * </pre>
 */
public sealed interface SyncState permits SyncState.Disconnected, SyncState.Connecting, SyncState.Hydrating,
        SyncState.Live, SyncState.Reconnecting {

    Disconnected DISCONNECTED = new Disconnected();
    Connecting CONNECTING = new Connecting();
    Hydrating HYDRATING = new Hydrating();
    Live LIVE = new Live();

    record Disconnected() implements SyncState {}

    record Connecting() implements SyncState {}

    /** Socket open; buffering the snapshot until {@code snapshot.end}. */
    record Hydrating() implements SyncState {}

    record Live() implements SyncState {}

    /**
     * Waiting {@code delay} before the next connection attempt.
     *
     * @param attempt 1 for the first retry after a failure, counting up until a connection opens
     */
    record Reconnecting(Duration delay, int attempt) implements SyncState {
        public Reconnecting {
            Objects.requireNonNull(delay, "delay");
        }
    }
}
