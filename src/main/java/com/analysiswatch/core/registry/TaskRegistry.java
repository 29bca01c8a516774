package com.analysiswatch.core.registry;

import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Authoritative in-memory map of entity id to unfinished analysis job for one session.
 * <p>
 * Every operation is atomic with respect to every other: the registry's monitor guards the
 * records, the open snapshot windows and listener delivery, so listeners observe mutations
 * in application order. Listeners are called while the monitor is held and must not block.
 * <p>
 * Two producers feed the registry. Stream events use {@link #upsert} and
 * {@link #removeIfPresent}; snapshot results go through {@link #mergeSnapshot}, which
 * applies each row with the same merge rule as {@code upsert}: a record observed before the
 * one already held only refreshes the label, and at equal instants a stream record outranks
 * a snapshot row. A terminal removal always beats a snapshot row whose request was in flight
 * when the removal happened.
 * <p>
 * Once {@link #close()} has been called the registry ignores further mutations.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Clock clock;
    private final Map<String, JobRecord> records = new LinkedHashMap<>();
    private final List<SnapshotWindow> openWindows = new ArrayList<>();
    private final CopyOnWriteArrayList<Consumer<List<JobRecord>>> listeners = new CopyOnWriteArrayList<>();
    private long nextWindowId = 1;
    private boolean closed;

    public TaskRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Inserts a record or merges it into the one already held for the key.
     * <p>
     * An incoming record observed at or after the held one replaces its phase and task id.
     * One observed earlier keeps the held phase and task id and only refreshes a non-blank
     * label. A blank label never overwrites the known one. A terminal tombstone recorded for the key in an open snapshot window is cleared,
     * because a new job has started since.
     *
     * @return the record now stored, or empty when the registry is closed
     */
    public synchronized Optional<JobRecord> upsert(String entityId, JobRecord record) {
        requireMatchingKey(entityId, record);
        if (closed) {
            log.debug("Ignoring upsert for {} on closed registry", entityId);
            return Optional.empty();
        }
        for (SnapshotWindow window : openWindows) {
            window.clearTerminated(entityId);
        }
        JobRecord stored = merge(records.get(entityId), record, false);
        records.put(entityId, stored);
        notifyListeners();
        return Optional.of(stored);
    }

    /**
     * Atomically tests whether the entity is tracked and removes it.
     * <p>
     * The returned value is the record held immediately before the removal; callers decide
     * on notifications from it, never from a later read. The removal is also recorded in
     * every open snapshot window, whether or not a record was present.
     *
     * @return the removed record, or empty when the entity was not tracked
     */
    public synchronized Optional<JobRecord> removeIfPresent(String entityId) {
        Objects.requireNonNull(entityId, "entityId");
        if (closed) {
            log.debug("Ignoring removal for {} on closed registry", entityId);
            return Optional.empty();
        }
        for (SnapshotWindow window : openWindows) {
            window.markTerminated(entityId);
        }
        JobRecord removed = records.remove(entityId);
        if (removed != null) {
            notifyListeners();
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Opens a window to be passed to {@link #mergeSnapshot} once the snapshot request resolves.
     * Call it before the request is issued.
     */
    public synchronized SnapshotWindow openSnapshotWindow() {
        SnapshotWindow window = new SnapshotWindow(nextWindowId++, clock.instant());
        if (!closed) {
            openWindows.add(window);
        } else {
            window.close();
        }
        log.debug("Opened {}", window);
        return window;
    }

    /**
     * Closes a window without merging anything, e.g. when its request was superseded.
     */
    public synchronized void discardSnapshotWindow(SnapshotWindow window) {
        openWindows.remove(window);
        window.close();
    }

    /**
     * Merges snapshot rows fetched through the given window and closes it.
     * <p>
     * Rows for entities that received a terminal event while the window was open are
     * skipped. Every other row is stamped with the window's opening instant and merged with
     * the {@link #upsert} rule, so a record tracked since the window opened keeps its phase
     * and task id. When
     * {@code pruneMissing} is set, tracked records that predate the window and are absent
     * from the rows are removed without notification.
     *
     * @param window       the window opened before the request
     * @param rows         the snapshot rows
     * @param pruneMissing whether to drop records the snapshot no longer lists
     */
    public synchronized MergeResult mergeSnapshot(SnapshotWindow window, List<JobRecord> rows,
                                                  boolean pruneMissing) {
        if (closed || !window.isOpen()) {
            log.debug("Rejecting snapshot merge for {} (registry closed={})", window, closed);
            return MergeResult.rejected();
        }

        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> pruned = new ArrayList<>();
        Set<String> listed = new HashSet<>();

        for (JobRecord row : rows) {
            String entityId = row.entityId();
            listed.add(entityId);
            if (window.wasTerminated(entityId)) {
                skipped.add(entityId);
                continue;
            }
            records.put(entityId, merge(records.get(entityId), row.withObservedAt(window.openedAt()), true));
            applied.add(entityId);
        }

        if (pruneMissing) {
            Iterator<Map.Entry<String, JobRecord>> it = records.entrySet().iterator();
            while (it.hasNext()) {
                JobRecord record = it.next().getValue();
                if (!listed.contains(record.entityId()) && record.observedAt().isBefore(window.openedAt())) {
                    it.remove();
                    pruned.add(record.entityId());
                }
            }
        }

        openWindows.remove(window);
        window.close();

        if (!applied.isEmpty() || !pruned.isEmpty()) {
            notifyListeners();
        }
        return new MergeResult(List.copyOf(applied), List.copyOf(skipped), List.copyOf(pruned), true);
    }

    /**
     * Current contents, reflecting every mutation applied so far.
     */
    public synchronized List<JobRecord> snapshot() {
        return List.copyOf(records.values());
    }

    public synchronized Optional<JobRecord> get(String entityId) {
        return Optional.ofNullable(records.get(entityId));
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Subscribe to registry changes. The listener receives the full contents after every
     * mutation that changed them.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<List<JobRecord>> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Clears the registry, discards open snapshot windows and rejects all later mutations.
     * Listeners receive one final empty list and are then dropped.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        boolean hadRecords = !records.isEmpty();
        records.clear();
        for (SnapshotWindow window : openWindows) {
            window.close();
        }
        openWindows.clear();
        closed = true;
        if (hadRecords) {
            notifyListeners();
        }
        listeners.clear();
        log.debug("Registry closed");
    }

    private static JobRecord merge(JobRecord existing, JobRecord incoming, boolean fromSnapshot) {
        if (existing == null) {
            return incoming;
        }
        int age = incoming.observedAt().compareTo(existing.observedAt());
        boolean incomingIsNewer = age > 0 || (age == 0 && !fromSnapshot);
        String label = incoming.entityLabel() == null || incoming.entityLabel().isBlank()
                ? existing.entityLabel()
                : incoming.entityLabel();
        if (incomingIsNewer) {
            return incoming.withLabel(label);
        }
        return existing.withLabel(label);
    }

    private static void requireMatchingKey(String entityId, JobRecord record) {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(record, "record");
        if (!entityId.equals(record.entityId())) {
            throw new IllegalArgumentException(
                    "Record for %s stored under key %s".formatted(record.entityId(), entityId));
        }
    }

    private void notifyListeners() {
        List<JobRecord> contents = List.copyOf(records.values());
        for (Consumer<List<JobRecord>> listener : listeners) {
            try {
                listener.accept(contents);
            } catch (Exception e) {
                log.warn("Registry listener threw exception: {}", e.getMessage(), e);
            }
        }
    }
}
