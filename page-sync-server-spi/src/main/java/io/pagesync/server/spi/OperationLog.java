package io.pagesync.server.spi;

import io.pagesync.core.Operation;

import java.util.List;

/**
 * Append-only log of accepted operations per page.
 *
 * <p>Only operations that changed canonical state are appended, in commit order. Replaying
 * {@link #load(String)} from the empty state must reproduce the page. Implementations must be
 * thread-safe across pages; appends for one page are already serialized by the caller.
 */
public interface OperationLog {

    /**
     * Appends committed operations for a page.
     */
    void append(String pageId, List<Operation> operations);

    /**
     * Returns every operation appended for a page, in order; empty for an unknown page.
     */
    List<Operation> load(String pageId);
}
