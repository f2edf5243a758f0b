package io.pagesync.client;

/**
 * Socket callbacks. Implementations of {@link PageSyncTransport} deliver them sequentially.
 */
public interface TransportListener {

    /** Called once, before any {@link #onText}. */
    void onOpen(TransportSession session);

    /** One complete text frame. */
    void onText(String text);

    void onClosed(int code, String reason);

    void onError(Throwable error);
}
