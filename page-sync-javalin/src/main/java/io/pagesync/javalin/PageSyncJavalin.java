package io.pagesync.javalin;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.websocket.WsContext;
import io.pagesync.core.state.PageSnapshot;
import io.pagesync.json.jackson.SnapshotHasher;
import io.pagesync.json.jackson.SnapshotJson;
import io.pagesync.server.core.FeedResult;
import io.pagesync.server.core.PageSyncHandler;
import io.pagesync.server.spi.PageConnection;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binds a {@link PageSyncHandler} to Javalin routes:
 * <ul>
 *   <li>{@code WS /ws/page/{pageId}}: the synchronization channel</li>
 *   <li>{@code POST /pages/{pageId}/operations}: JSONL producer feed</li>
 *   <li>{@code GET /pages/{pageId}/snapshot}: canonical snapshot and its hash</li>
 * </ul>
 */
public final class PageSyncJavalin {

    public static final String WS_PATH = "/ws/page/{pageId}";
    public static final String OPERATIONS_PATH = "/pages/{pageId}/operations";
    public static final String SNAPSHOT_PATH = "/pages/{pageId}/snapshot";
    static final String PAGE_ID = "pageId";

    private PageSyncJavalin() {}

    public static Javalin register(Javalin app, PageSyncHandler handler) {
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(handler, "handler");
        app.ws(WS_PATH, ws -> {
            ws.onConnect(ctx -> handler.onOpen(new JavalinConnection(ctx), ctx.pathParam(PAGE_ID)));
            ws.onMessage(ctx -> handler.onMessage(ctx.sessionId(), ctx.message()));
            ws.onClose(ctx -> handler.onClose(ctx.sessionId()));
            ws.onError(ctx -> handler.onClose(ctx.sessionId()));
        });
        app.post(OPERATIONS_PATH, ctx -> ingest(ctx, handler));
        app.get(SNAPSHOT_PATH, ctx -> snapshot(ctx, handler));
        return app;
    }

    private static void ingest(Context ctx, PageSyncHandler handler) throws IOException {
        FeedResult result;
        try (Reader body = new InputStreamReader(ctx.bodyInputStream(), StandardCharsets.UTF_8)) {
            result = handler.ingest(ctx.pathParam(PAGE_ID), body);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("accepted", result.accepted());
        out.put("rejected", result.rejected());
        out.put("malformed", result.malformed());
        ctx.status(HttpStatus.OK).json(out);
    }

    private static void snapshot(Context ctx, PageSyncHandler handler) {
        PageSnapshot s = handler.snapshot(ctx.pathParam(PAGE_ID));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hash", SnapshotHasher.hash(s));
        out.put("snapshot", SnapshotJson.toMap(s));
        ctx.json(out);
    }

    /** Adapts a Javalin WebSocket context to {@link PageConnection}. */
    static final class JavalinConnection implements PageConnection {
        private final WsContext ctx;

        JavalinConnection(WsContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public String id() {
            return ctx.sessionId();
        }

        @Override
        public void send(String text) {
            ctx.send(text);
        }

        @Override
        public void close(int code, String reason) {
            ctx.closeSession(code, reason);
        }
    }
}
