package io.pagesync.json.jackson;

import io.pagesync.core.state.PageSnapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short fingerprint of a snapshot so replicas and replays can be compared cheaply.
 */
public final class SnapshotHasher {

    private static final int HEX_CHARS = 16;

    private SnapshotHasher() {}

    /**
     * First 16 hex characters of the SHA-256 of {@link SnapshotJson#toJson(PageSnapshot)}.
     */
    public static String hash(PageSnapshot snapshot) {
        byte[] digest = sha256(SnapshotJson.toJson(snapshot).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest).substring(0, HEX_CHARS);
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
