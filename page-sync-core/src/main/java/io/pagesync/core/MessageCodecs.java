package io.pagesync.core;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Locates the {@link MessageCodec} on the classpath.
 */
public final class MessageCodecs {

    private MessageCodecs() {}

    /**
     * Returns the first registered codec.
     *
     * @throws IllegalStateException if no implementation is registered
     */
    public static MessageCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static MessageCodec load(ClassLoader classLoader) {
        Iterator<MessageCodec> it = ServiceLoader.load(MessageCodec.class, classLoader).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("no " + MessageCodec.class.getName()
                    + " registered; add page-sync-json-jackson to the classpath");
        }
        return it.next();
    }
}
