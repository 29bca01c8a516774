package com.analysiswatch.core.registry;

import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.model.JobPhase;
import com.analysiswatch.core.model.JobRecord;
import com.analysiswatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TaskRegistry}.
 */
class TaskRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new TaskRegistry(clock);
    }

    private JobRecord running(String id, String label, String taskId) {
        return new JobRecord(id, label, taskId, JobPhase.RUNNING, clock.instant());
    }

    private JobRecord queued(String id, String label) {
        return new JobRecord(id, label, null, JobPhase.QUEUED, clock.instant());
    }

    // -- upsert ----------------------------------------------------------------

    @Nested
    @DisplayName("upsert")
    class Upsert {

        @Test
        @DisplayName("keeps at most one record per entity")
        void oneRecordPerEntity() {
            registry.upsert("42", running("42", "Acme", "t-1"));
            registry.upsert("42", running("42", "Acme", "t-1"));
            registry.upsert("42", running("42", "Acme", "t-2"));

            assertEquals(1, registry.size());
            assertEquals("t-2", registry.get("42").orElseThrow().taskId());
        }

        @Test
        @DisplayName("incoming phase replaces the tracked phase")
        void phaseReplaced() {
            registry.upsert("42", queued("42", "Acme"));
            registry.upsert("42", running("42", "Acme", "t-1"));

            assertEquals(JobPhase.RUNNING, registry.get("42").orElseThrow().phase());
        }

        @Test
        @DisplayName("blank incoming label keeps the known label")
        void blankLabelKeepsKnownLabel() {
            registry.upsert("42", running("42", "Acme", "t-1"));
            registry.upsert("42", running("42", " ", "t-1"));

            assertEquals("Acme", registry.get("42").orElseThrow().entityLabel());
        }

        @Test
        @DisplayName("an earlier-observed record keeps the tracked phase and task id")
        void olderRecordDoesNotRegress() {
            JobRecord older = queued("42", "Acme");
            clock.advance(Duration.ofSeconds(10));
            registry.upsert("42", running("42", "Acme", "t-2"));

            registry.upsert("42", new JobRecord("42", "Acme Corp", "t-1", JobPhase.QUEUED, older.observedAt()));

            JobRecord record = registry.get("42").orElseThrow();
            assertEquals(JobPhase.RUNNING, record.phase());
            assertEquals("t-2", record.taskId());
            assertEquals("Acme Corp", record.entityLabel());
            assertEquals(T0.plusSeconds(10), record.observedAt());
        }

        @Test
        @DisplayName("a record observed at the same instant replaces the tracked one")
        void sameInstantReplaces() {
            registry.upsert("42", queued("42", "Acme"));
            registry.upsert("42", running("42", "Acme", "t-1"));
            registry.upsert("42", queued("42", "Acme"));

            assertEquals(JobPhase.QUEUED, registry.get("42").orElseThrow().phase());
        }

        @Test
        @DisplayName("rejects a record stored under a different key")
        void rejectsMismatchedKey() {
            assertThrows(IllegalArgumentException.class,
                    () -> registry.upsert("42", running("43", "Other", null)));
        }

        @Test
        @DisplayName("notifies listeners with the full contents in application order")
        void notifiesListeners() {
            List<List<JobRecord>> seen = new ArrayList<>();
            registry.subscribe(seen::add);

            registry.upsert("1", running("1", "A", null));
            registry.upsert("2", running("2", "B", null));

            assertEquals(2, seen.size());
            assertEquals(1, seen.get(0).size());
            assertEquals(2, seen.get(1).size());
        }
    }

    // -- removeIfPresent -------------------------------------------------------

    @Nested
    @DisplayName("removeIfPresent")
    class RemoveIfPresent {

        @Test
        @DisplayName("returns the removed record exactly once")
        void returnsRemovedOnce() {
            registry.upsert("42", running("42", "Acme", "t-1"));

            var first = registry.removeIfPresent("42");
            var second = registry.removeIfPresent("42");

            assertTrue(first.isPresent());
            assertEquals("Acme", first.get().entityLabel());
            assertTrue(second.isEmpty());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("removes regardless of phase")
        void removesQueuedToo() {
            registry.upsert("42", queued("42", "Acme"));

            assertTrue(registry.removeIfPresent("42").isPresent());
        }

        @Test
        @DisplayName("does not notify listeners when nothing was removed")
        void noNotificationWhenAbsent() {
            List<List<JobRecord>> seen = new ArrayList<>();
            registry.subscribe(seen::add);

            registry.removeIfPresent("missing");

            assertTrue(seen.isEmpty());
        }
    }

    // -- mergeSnapshot ---------------------------------------------------------

    @Nested
    @DisplayName("mergeSnapshot")
    class MergeSnapshot {

        @Test
        @DisplayName("inserts rows into an empty registry")
        void insertsRows() {
            SnapshotWindow window = registry.openSnapshotWindow();

            MergeResult result = registry.mergeSnapshot(window,
                    List.of(running("1", "A", "t-1"), queued("2", "B")), true);

            assertTrue(result.accepted());
            assertEquals(List.of("1", "2"), result.applied());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("skips a row whose entity completed while the request was in flight")
        void terminalEventWins() {
            registry.upsert("42", running("42", "Acme", "t-1"));
            SnapshotWindow window = registry.openSnapshotWindow();
            registry.removeIfPresent("42");

            MergeResult result = registry.mergeSnapshot(window, List.of(running("42", "Acme", "t-1")), true);

            assertEquals(List.of("42"), result.skipped());
            assertTrue(registry.get("42").isEmpty());
        }

        @Test
        @DisplayName("skips a row for an untracked entity that completed during the window")
        void terminalForUntrackedEntityWins() {
            SnapshotWindow window = registry.openSnapshotWindow();
            registry.removeIfPresent("42");

            registry.mergeSnapshot(window, List.of(running("42", "Acme", "t-1")), true);

            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("a started event after the terminal clears the tombstone")
        void restartClearsTombstone() {
            SnapshotWindow window = registry.openSnapshotWindow();
            registry.removeIfPresent("42");
            registry.upsert("42", running("42", "Acme", "t-2"));

            MergeResult result = registry.mergeSnapshot(window, List.of(queued("42", "Acme")), true);

            assertEquals(List.of("42"), result.applied());
            JobRecord record = registry.get("42").orElseThrow();
            assertEquals(JobPhase.RUNNING, record.phase());
            assertEquals("t-2", record.taskId());
        }

        @Test
        @DisplayName("a row does not regress a record observed after the window opened")
        void rowDoesNotRegressFresherRecord() {
            SnapshotWindow window = registry.openSnapshotWindow();
            clock.advance(Duration.ofSeconds(1));
            registry.upsert("42", running("42", null, "t-9"));

            registry.mergeSnapshot(window, List.of(queued("42", "Acme")), true);

            JobRecord record = registry.get("42").orElseThrow();
            assertEquals(JobPhase.RUNNING, record.phase());
            assertEquals("t-9", record.taskId());
            assertEquals("Acme", record.entityLabel(), "label is refreshed from the row");
        }

        @Test
        @DisplayName("a row replaces a record observed before the window opened")
        void rowReplacesOlderRecord() {
            registry.upsert("42", queued("42", "Acme"));
            clock.advance(Duration.ofSeconds(5));
            SnapshotWindow window = registry.openSnapshotWindow();

            registry.mergeSnapshot(window, List.of(running("42", "Acme Corp", "t-1")), true);

            JobRecord record = registry.get("42").orElseThrow();
            assertEquals(JobPhase.RUNNING, record.phase());
            assertEquals("t-1", record.taskId());
            assertEquals(window.openedAt(), record.observedAt());
        }

        @Test
        @DisplayName("prunes stale records the snapshot no longer lists")
        void prunesMissing() {
            registry.upsert("1", running("1", "A", null));
            registry.upsert("2", running("2", "B", null));
            clock.advance(Duration.ofSeconds(5));
            SnapshotWindow window = registry.openSnapshotWindow();
            clock.advance(Duration.ofSeconds(1));
            registry.upsert("3", running("3", "C", null));

            MergeResult result = registry.mergeSnapshot(window, List.of(running("1", "A", null)), true);

            assertEquals(List.of("2"), result.pruned());
            assertTrue(registry.get("1").isPresent());
            assertTrue(registry.get("2").isEmpty());
            assertTrue(registry.get("3").isPresent(), "records newer than the window are kept");
        }

        @Test
        @DisplayName("keeps unlisted records when pruning is disabled")
        void noPruneWhenDisabled() {
            registry.upsert("1", running("1", "A", null));
            clock.advance(Duration.ofSeconds(5));
            SnapshotWindow window = registry.openSnapshotWindow();

            MergeResult result = registry.mergeSnapshot(window, List.of(), false);

            assertTrue(result.pruned().isEmpty());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("a window merges at most once")
        void windowMergesOnce() {
            SnapshotWindow window = registry.openSnapshotWindow();
            registry.mergeSnapshot(window, List.of(running("1", "A", null)), true);
            registry.removeIfPresent("1");

            MergeResult again = registry.mergeSnapshot(window, List.of(running("1", "A", null)), true);

            assertFalse(again.accepted());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("a discarded window rejects its merge")
        void discardedWindowRejected() {
            SnapshotWindow window = registry.openSnapshotWindow();
            registry.discardSnapshotWindow(window);

            assertFalse(registry.mergeSnapshot(window, List.of(running("1", "A", null)), true).accepted());
            assertEquals(0, registry.size());
        }
    }

    // -- close -----------------------------------------------------------------

    @Nested
    @DisplayName("close")
    class Close {

        @Test
        @DisplayName("clears contents and ignores later mutations")
        void clearsAndRejects() {
            registry.upsert("1", running("1", "A", null));
            SnapshotWindow window = registry.openSnapshotWindow();

            registry.close();

            assertTrue(registry.isClosed());
            assertEquals(0, registry.size());
            assertTrue(registry.upsert("2", running("2", "B", null)).isEmpty());
            assertTrue(registry.removeIfPresent("1").isEmpty());
            assertFalse(registry.mergeSnapshot(window, List.of(running("3", "C", null)), true).accepted());
            assertTrue(registry.snapshot().isEmpty());
        }

        @Test
        @DisplayName("sends a final empty list then drops listeners")
        void finalEmptyNotification() {
            List<List<JobRecord>> seen = new ArrayList<>();
            registry.upsert("1", running("1", "A", null));
            registry.subscribe(seen::add);

            registry.close();
            registry.close();

            assertEquals(1, seen.size());
            assertTrue(seen.get(0).isEmpty());
        }

        @Test
        @DisplayName("windows opened after close are already closed")
        void windowAfterClose() {
            registry.close();

            SnapshotWindow window = registry.openSnapshotWindow();

            assertFalse(registry.mergeSnapshot(window, List.of(running("1", "A", null)), true).accepted());
        }
    }

    @Test
    @DisplayName("unsubscribed listeners receive nothing further")
    void unsubscribe() {
        List<List<JobRecord>> seen = new ArrayList<>();
        Subscription sub = registry.subscribe(seen::add);

        sub.unsubscribe();
        registry.upsert("1", running("1", "A", null));

        assertTrue(seen.isEmpty());
    }

    @Test
    @DisplayName("a throwing listener does not block other listeners or the mutation")
    void throwingListenerIsolated() {
        List<List<JobRecord>> seen = new ArrayList<>();
        registry.subscribe(list -> { throw new IllegalStateException("boom"); });
        registry.subscribe(seen::add);

        registry.upsert("1", running("1", "A", null));

        assertEquals(1, registry.size());
        assertEquals(1, seen.size());
    }
}
