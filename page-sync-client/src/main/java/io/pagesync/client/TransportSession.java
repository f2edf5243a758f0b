package io.pagesync.client;

import java.util.concurrent.CompletableFuture;

/**
 * An open socket.
 */
public interface TransportSession {

    /**
     * Sends one text frame. Frames are written in call order.
     */
    CompletableFuture<Void> send(String text);

    void close(int code, String reason);
}
