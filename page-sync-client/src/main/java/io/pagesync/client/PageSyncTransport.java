package io.pagesync.client;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens sockets for {@link PageSyncClient}. The default is {@link JdkWebSocketTransport}.
 */
public interface PageSyncTransport {

    /**
     * Opens a socket to {@code uri}. The returned future fails if the socket cannot be opened.
     */
    CompletableFuture<TransportSession> open(URI uri, TransportListener listener);
}
