package com.analysiswatch.core.registry;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * The interval between issuing a snapshot request and merging its result.
 * <p>
 * Terminal removals applied while the window is open are remembered so the snapshot,
 * which enumerated job states at or before {@link #openedAt()}, cannot resurrect them.
 * Guarded by the owning {@link TaskRegistry}'s monitor.
 */
public final class SnapshotWindow {

    private final long id;
    private final Instant openedAt;
    private final Set<String> terminated = new HashSet<>();
    private boolean open = true;

    SnapshotWindow(long id, Instant openedAt) {
        this.id = id;
        this.openedAt = openedAt;
    }

    public long id() {
        return id;
    }

    public Instant openedAt() {
        return openedAt;
    }

    boolean isOpen() {
        return open;
    }

    void close() {
        open = false;
        terminated.clear();
    }

    void markTerminated(String entityId) {
        terminated.add(entityId);
    }

    void clearTerminated(String entityId) {
        terminated.remove(entityId);
    }

    boolean wasTerminated(String entityId) {
        return terminated.contains(entityId);
    }

    @Override
    public String toString() {
        return "SnapshotWindow[id=" + id + ", openedAt=" + openedAt + ", open=" + open + "]";
    }
}
