package io.pagesync.json.jackson;

import io.pagesync.core.Message;
import io.pagesync.core.MessageCodec;
import io.pagesync.core.PageSyncException.ProtocolError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental JSONL parser for producer feeds.
 *
 * <p>Chunks may split lines anywhere; complete lines are decoded as they arrive and the trailing
 * partial line is kept until more input or {@link #flush()}. Blank and malformed lines are skipped.
 */
public final class JsonlMessageReader {

    private static final Logger log = LoggerFactory.getLogger(JsonlMessageReader.class);

    private final MessageCodec codec;
    private final StringBuilder pending = new StringBuilder();
    private long skipped;

    public JsonlMessageReader(MessageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Feeds a chunk and returns the messages completed by it.
     */
    public List<Message> feed(CharSequence chunk) {
        pending.append(chunk);
        List<Message> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < pending.length(); i++) {
            if (pending.charAt(i) == '\n') {
                decodeLine(pending.substring(start, i), out);
                start = i + 1;
            }
        }
        pending.delete(0, start);
        return out;
    }

    /**
     * Decodes whatever remains buffered as a final line.
     */
    public List<Message> flush() {
        List<Message> out = new ArrayList<>(1);
        if (pending.length() > 0) {
            decodeLine(pending.toString(), out);
            pending.setLength(0);
        }
        return out;
    }

    /** Number of malformed lines skipped so far. */
    public long skipped() {
        return skipped;
    }

    /**
     * Reads a whole JSONL document.
     */
    public List<Message> readAll(Reader reader) throws IOException {
        List<Message> out = new ArrayList<>();
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            decodeLine(line, out);
        }
        return out;
    }

    private void decodeLine(String line, List<Message> out) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) return;
        try {
            out.add(codec.decode(trimmed));
        } catch (ProtocolError e) {
            skipped++;
            log.warn("Skipping malformed JSONL line: {}", e.getMessage());
        }
    }
}
