package io.pagesync.javalin;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings for the standalone server.
 *
 * <p>Read from {@code page-sync.properties} on the classpath; system properties with the same keys win:
 * <pre>
 * page-sync.host=0.0.0.0
 * page-sync.port=7070
 * page-sync.outbox-capacity=1024
 * </pre>
 */
public class PageSyncServerConfig {

    public static final String PREFIX = "page-sync.";
    static final String RESOURCE = "page-sync.properties";

    private String host = "0.0.0.0";
    private int port = 7070;
    private int outboxCapacity = 1024;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getOutboxCapacity() {
        return outboxCapacity;
    }

    public void setOutboxCapacity(int outboxCapacity) {
        this.outboxCapacity = outboxCapacity;
    }

    public static PageSyncServerConfig load() {
        Properties merged = new Properties();
        try (InputStream in = PageSyncServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                merged.setProperty(key, System.getProperty(key));
            }
        }
        return from(merged);
    }

    public static PageSyncServerConfig from(Properties props) {
        PageSyncServerConfig config = new PageSyncServerConfig();
        String host = props.getProperty(PREFIX + "host");
        if (host != null && !host.isBlank()) {
            config.setHost(host.trim());
        }
        config.setPort(intValue(props, "port", config.getPort()));
        config.setOutboxCapacity(intValue(props, "outbox-capacity", config.getOutboxCapacity()));
        return config;
    }

    private static int intValue(Properties props, String name, int fallback) {
        String raw = props.getProperty(PREFIX + name);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + name + " must be an integer, got '" + raw + "'", e);
        }
    }
}
