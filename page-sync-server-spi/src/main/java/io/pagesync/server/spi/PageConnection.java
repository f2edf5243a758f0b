package io.pagesync.server.spi;

/**
 * One live client socket as seen by the server core.
 *
 * <p>Framework bindings adapt their WebSocket session to this interface. {@link #send(String)} is
 * only ever called from one drain task at a time per connection.
 */
public interface PageConnection {

    /** Stable id, unique among live connections. */
    String id();

    /**
     * Writes one text frame. May block until the frame is handed to the socket.
     */
    void send(String text) throws Exception;

    /**
     * Closes the socket with a WebSocket close code.
     */
    void close(int code, String reason);
}
