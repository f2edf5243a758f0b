package io.pagesync.client;

import io.pagesync.core.PageSyncException.TransportError;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link PageSyncTransport} on {@link java.net.http.WebSocket}.
 */
public final class JdkWebSocketTransport implements PageSyncTransport {

    private final HttpClient client;
    private final Duration connectTimeout;

    public JdkWebSocketTransport() {
        this(HttpClient.newHttpClient(), Duration.ofSeconds(10));
    }

    public JdkWebSocketTransport(HttpClient client, Duration connectTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public CompletableFuture<TransportSession> open(URI uri, TransportListener listener) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");
        Adapter adapter = new Adapter(listener);
        return client.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, adapter)
                .handle((ws, err) -> {
                    if (err != null) {
                        throw new TransportError(TransportError.Kind.CONNECT_FAILED, "cannot open " + uri, err);
                    }
                    return (TransportSession) adapter.session;
                });
    }

    private static final class Session implements TransportSession {
        private final WebSocket ws;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private Session(WebSocket ws) {
            this.ws = ws;
        }

        // the JDK WebSocket rejects a send while the previous one is still pending
        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            CompletableFuture<Void> next = tail
                    .exceptionally(e -> null)
                    .thenCompose(v -> ws.sendText(text, true))
                    .thenApply(w -> (Void) null);
            tail = next;
            return next;
        }

        @Override
        public synchronized void close(int code, String reason) {
            tail = tail.exceptionally(e -> null)
                    .thenCompose(v -> ws.isOutputClosed()
                            ? CompletableFuture.completedFuture(ws)
                            : ws.sendClose(code, reason == null ? "" : reason))
                    .handle((w, e) -> {
                        ws.abort();
                        return null;
                    });
        }
    }

    private static final class Adapter implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder partial = new StringBuilder();
        private volatile Session session;

        private Adapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            session = new Session(webSocket);
            listener.onOpen(session);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(new TransportError(TransportError.Kind.SOCKET_CLOSED, "socket error", error));
        }
    }
}
