package io.pagesync.server.spi;

import io.pagesync.core.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference {@link OperationLog} kept in memory. Contents are lost with the process.
 */
public final class InMemoryOperationLog implements OperationLog {

    private final Map<String, List<Operation>> logs = new ConcurrentHashMap<>();

    @Override
    public void append(String pageId, List<Operation> operations) {
        Objects.requireNonNull(pageId, "pageId");
        Objects.requireNonNull(operations, "operations");
        if (operations.isEmpty()) return;
        List<Operation> log = logs.computeIfAbsent(pageId, k -> new ArrayList<>());
        synchronized (log) {
            log.addAll(operations);
        }
    }

    @Override
    public List<Operation> load(String pageId) {
        List<Operation> log = logs.get(pageId);
        if (log == null) return List.of();
        synchronized (log) {
            return List.copyOf(log);
        }
    }
}
