package io.pagesync.client;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Transport whose sockets are opened, fed and failed by the test. */
final class FakeTransport implements PageSyncTransport {

    final List<Attempt> attempts = new ArrayList<>();

    @Override
    public CompletableFuture<TransportSession> open(URI uri, TransportListener listener) {
        Attempt a = new Attempt(listener);
        attempts.add(a);
        return a.future;
    }

    Attempt last() {
        return attempts.get(attempts.size() - 1);
    }

    static final class Attempt implements TransportSession {
        final TransportListener listener;
        final CompletableFuture<TransportSession> future = new CompletableFuture<>();
        final List<String> sent = new ArrayList<>();
        Integer closeCode;

        Attempt(TransportListener listener) {
            this.listener = listener;
        }

        void open() {
            listener.onOpen(this);
            future.complete(this);
        }

        void fail() {
            future.completeExceptionally(new RuntimeException("connection refused"));
        }

        void receive(String... frames) {
            for (String f : frames) {
                listener.onText(f);
            }
        }

        void drop() {
            listener.onClosed(1006, "gone");
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
        }
    }
}
