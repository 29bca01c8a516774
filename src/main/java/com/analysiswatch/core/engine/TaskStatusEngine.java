package com.analysiswatch.core.engine;

import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.ingress.EventIngress;
import com.analysiswatch.core.ingress.EventStream;
import com.analysiswatch.core.logging.MdcContext;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.analysiswatch.core.model.AnalysisNotification;
import com.analysiswatch.core.model.JobRecord;
import com.analysiswatch.core.model.SessionStatus;
import com.analysiswatch.core.notification.NotificationPolicy;
import com.analysiswatch.core.registry.MergeResult;
import com.analysiswatch.core.registry.SnapshotWindow;
import com.analysiswatch.core.registry.TaskRegistry;
import com.analysiswatch.core.session.SessionGate;
import com.analysiswatch.core.snapshot.SnapshotLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns the session lifecycle of the task-status reconciliation engine.
 * <p>
 * {@link #activate()} probes the {@link SessionGate}; on success it constructs a fresh
 * {@link TaskRegistry}, loads a snapshot into it and installs {@link EventIngress} whenever
 * the {@link EventStream} is connected. A reconnect within the session starts a new
 * activation cycle: a new generation and a fresh snapshot, without clearing the registry.
 * {@link #teardown()} uninstalls ingress, clears and discards the registry and cancels
 * notifications.
 * <p>
 * All state changes run on the engine executor, which must execute tasks one at a time in
 * submission order. The exception is the ingress subscription on a stream connection change:
 * it is swapped on the stream's own thread, before that connection delivers its first event.
 * Snapshot fetches and identity probes run on the I/O executor. Every
 * activation cycle is tagged with a generation; results carrying a superseded generation are
 * discarded.
 */
public class TaskStatusEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskStatusEngine.class);

    private final SessionGate sessionGate;
    private final SnapshotLoader snapshotLoader;
    private final EventStream eventStream;
    private final NotificationPolicy notificationPolicy;
    private final AnalysisWatchMetrics metrics;
    private final Clock clock;
    private final Executor engineExecutor;
    private final Executor ioExecutor;
    private final String topicPrefix;
    private final boolean pruneMissing;

    private final AtomicLong generation = new AtomicLong();
    private final CopyOnWriteArrayList<Consumer<List<JobRecord>>> jobListeners = new CopyOnWriteArrayList<>();

    /** Written only on the engine executor. */
    private volatile Session current;

    public TaskStatusEngine(SessionGate sessionGate, SnapshotLoader snapshotLoader, EventStream eventStream,
                            NotificationPolicy notificationPolicy, AnalysisWatchMetrics metrics, Clock clock,
                            Executor engineExecutor, Executor ioExecutor,
                            String topicPrefix, boolean pruneMissing) {
        this.sessionGate = sessionGate;
        this.snapshotLoader = snapshotLoader;
        this.eventStream = eventStream;
        this.notificationPolicy = notificationPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.engineExecutor = engineExecutor;
        this.ioExecutor = ioExecutor;
        this.topicPrefix = topicPrefix;
        this.pruneMissing = pruneMissing;
    }

    // -- Lifecycle -------------------------------------------------------------

    /**
     * Starts a session if the identity probe authorizes it. Does nothing when a session is
     * already active. A {@link #teardown()} issued while the probe is in flight wins.
     *
     * @return the probe outcome once the activation has been applied
     */
    public CompletableFuture<SessionStatus> activate() {
        long token = generation.get();
        return CompletableFuture.supplyAsync(sessionGate::check, ioExecutor)
                .thenApplyAsync(status -> {
                    startSession(token, status);
                    return status;
                }, engineExecutor);
    }

    /**
     * Ends the session: uninstalls ingress, clears the registry, cancels notifications and
     * disconnects the stream. Results of in-flight requests are discarded when they arrive.
     */
    public CompletableFuture<Void> teardown() {
        long stale = generation.incrementAndGet();
        return CompletableFuture.runAsync(() -> endSession(stale), engineExecutor);
    }

    public boolean isActive() {
        return current != null;
    }

    public long generation() {
        return generation.get();
    }

    boolean isCurrentGeneration(long candidate) {
        return generation.get() == candidate;
    }

    // -- Consumer contract -----------------------------------------------------

    /**
     * Jobs currently queued or running, as far as this session knows. Empty when no session
     * is active.
     */
    public List<JobRecord> currentJobs() {
        Session session = current;
        return session == null ? List.of() : session.registry.snapshot();
    }

    public List<AnalysisNotification> activeNotifications() {
        return notificationPolicy.active();
    }

    /**
     * Subscribe to fired notifications. The subscription survives session changes.
     */
    public Subscription onNotification(Consumer<AnalysisNotification> callback) {
        return notificationPolicy.onNotification(callback);
    }

    /**
     * Subscribe to job list changes. The callback receives the full list after every
     * registry mutation and an empty list when the session ends. The subscription survives
     * session changes.
     */
    public Subscription onJobsChanged(Consumer<List<JobRecord>> callback) {
        jobListeners.add(callback);
        return () -> jobListeners.remove(callback);
    }

    public boolean isStreamConnected() {
        return eventStream.isConnected();
    }

    // -- Engine executor tasks -------------------------------------------------

    private void startSession(long token, SessionStatus status) {
        if (!isCurrentGeneration(token)) {
            log.info("Activation superseded by teardown; not starting");
            return;
        }
        if (status != SessionStatus.AUTHORIZED) {
            log.info("Session not authorized ({}); engine stays idle", status);
            return;
        }
        if (current != null) {
            log.debug("Session already active (generation {})", generation.get());
            return;
        }

        long gen = generation.incrementAndGet();
        var registry = new TaskRegistry(clock);
        var ingress = new EventIngress(topicPrefix, registry, notificationPolicy, metrics, clock,
                engineExecutor, this::isCurrentGeneration);
        var session = new Session(registry, ingress, gen);
        session.registrySubscription = registry.subscribe(this::publishJobs);
        session.connectionSubscription = eventStream.onConnectionChange(
                connected -> onConnectionChange(session, connected));
        current = session;

        MdcContext.setGeneration(gen);
        try {
            log.info("Session activated (generation {})", gen);
            ingress.install(eventStream, gen);
            startSnapshot(session, gen);
            if (!eventStream.isConnected()) {
                eventStream.connect();
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void endSession(long staleGeneration) {
        Session session = current;
        current = null;
        notificationPolicy.clear();
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.ingress.uninstall();
            session.connectionSubscription.unsubscribe();
        }
        session.registry.close();
        session.registrySubscription.unsubscribe();
        eventStream.disconnect();
        metrics.recordTrackedJobs(0);
        log.info("Session torn down (generation {} retired)", staleGeneration - 1);
    }

    /**
     * Runs on the stream's thread. Ingress is reinstalled here, under a new generation, so
     * the subscriptions exist before the reconnected stream delivers anything; the snapshot
     * resync is queued on the engine executor ahead of those events.
     */
    private void onConnectionChange(Session session, boolean connected) {
        long resyncGeneration;
        synchronized (session) {
            if (current != session) {
                return;
            }
            if (!connected) {
                session.ingress.uninstall();
                session.sawDisconnect = true;
                log.info("Stream disconnected; event ingress suspended");
                return;
            }
            if (!session.sawDisconnect) {
                if (!session.ingress.isInstalled()) {
                    session.ingress.install(eventStream, session.generation);
                }
                return;
            }
            long previous = session.generation;
            if (!generation.compareAndSet(previous, previous + 1)) {
                log.debug("Reconnect after generation {} was retired; not resynchronising", previous);
                return;
            }
            resyncGeneration = previous + 1;
            session.generation = resyncGeneration;
            session.sawDisconnect = false;
            session.ingress.install(eventStream, resyncGeneration);
        }
        engineExecutor.execute(() -> resync(session, resyncGeneration));
    }

    private void resync(Session session, long gen) {
        if (current != session || !isCurrentGeneration(gen)) {
            return;
        }
        MdcContext.setGeneration(gen);
        try {
            log.info("Stream reconnected; resynchronising (generation {})", gen);
            startSnapshot(session, gen);
        } finally {
            MdcContext.clear();
        }
    }

    private void startSnapshot(Session session, long gen) {
        SnapshotWindow window = session.registry.openSnapshotWindow();
        CompletableFuture.supplyAsync(snapshotLoader::loadSnapshot, ioExecutor)
                .thenAcceptAsync(rows -> applySnapshot(session, gen, window, rows), engineExecutor)
                .exceptionally(ex -> {
                    log.warn("Snapshot cycle failed (generation {}): {}", gen, ex.getMessage(), ex);
                    session.registry.discardSnapshotWindow(window);
                    return null;
                });
    }

    private void applySnapshot(Session session, long gen, SnapshotWindow window, List<JobRecord> rows) {
        if (current != session || !isCurrentGeneration(gen)) {
            session.registry.discardSnapshotWindow(window);
            metrics.recordSnapshotDiscarded();
            log.debug("Discarding snapshot from superseded generation {}", gen);
            return;
        }
        MergeResult result = session.registry.mergeSnapshot(window, rows, pruneMissing);
        log.info("Snapshot merged (generation {}): {} applied, {} superseded by terminal events, {} pruned",
                gen, result.applied().size(), result.skipped().size(), result.pruned().size());
    }

    private void publishJobs(List<JobRecord> jobs) {
        metrics.recordTrackedJobs(jobs.size());
        for (Consumer<List<JobRecord>> listener : jobListeners) {
            try {
                listener.accept(jobs);
            } catch (Exception e) {
                log.warn("Job listener threw exception: {}", e.getMessage(), e);
            }
        }
    }

    private static final class Session {
        final TaskRegistry registry;
        final EventIngress ingress;
        Subscription registrySubscription;
        Subscription connectionSubscription;
        /** Guarded by the session's monitor. */
        long generation;
        boolean sawDisconnect;

        Session(TaskRegistry registry, EventIngress ingress, long generation) {
            this.registry = registry;
            this.ingress = ingress;
            this.generation = generation;
        }
    }
}
