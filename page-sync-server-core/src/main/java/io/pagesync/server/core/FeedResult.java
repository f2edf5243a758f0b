package io.pagesync.server.core;

/**
 * Counts for one producer feed: operations that were valid, operations that were rejected, and
 * lines that could not be decoded.
 */
public record FeedResult(int accepted, int rejected, long malformed) {
}
