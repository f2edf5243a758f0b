package io.pagesync.core;

/**
 * Converts {@link Message}s to and from their textual wire form.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; see {@link MessageCodecs}.
 */
public interface MessageCodec {

    /**
     * Encodes one message as a single JSON object (no trailing newline).
     *
     * @throws PageSyncException.ProtocolError if the message holds a value the wire format cannot carry
     */
    String encode(Message message);

    /**
     * Decodes one JSON object.
     *
     * @throws PageSyncException.ProtocolError if the text is not a well-formed message
     */
    Message decode(String text);
}
