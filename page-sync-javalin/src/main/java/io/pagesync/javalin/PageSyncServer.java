package io.pagesync.javalin;

import io.javalin.Javalin;
import io.pagesync.server.core.PageSyncHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Standalone page sync server.
 */
public final class PageSyncServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PageSyncServer.class);

    private final Javalin app;
    private final PageSyncHandler handler;

    private PageSyncServer(Javalin app, PageSyncHandler handler) {
        this.app = app;
        this.handler = handler;
    }

    public static void main(String[] args) {
        PageSyncServer server = start(PageSyncServerConfig.load());
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "page-sync-shutdown"));
    }

    public static PageSyncServer start(PageSyncServerConfig config) {
        Objects.requireNonNull(config, "config");
        PageSyncHandler handler = PageSyncHandler.builder()
                .outboxCapacity(config.getOutboxCapacity())
                .build();
        return start(config, handler);
    }

    public static PageSyncServer start(PageSyncServerConfig config, PageSyncHandler handler) {
        Javalin app = PageSyncJavalin.register(Javalin.create(), handler);
        app.start(config.getHost(), config.getPort());
        log.info("Page sync server listening on http://{}:{}", config.getHost(), app.port());
        return new PageSyncServer(app, handler);
    }

    public int port() {
        return app.port();
    }

    public PageSyncHandler handler() {
        return handler;
    }

    @Override
    public void close() {
        app.stop();
        handler.close();
        log.info("Page sync server stopped");
    }
}
