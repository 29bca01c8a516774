package com.analysiswatch.core.ingress;

import com.analysiswatch.core.events.AnalysisEvent;
import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.logging.MdcContext;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.analysiswatch.core.model.JobPhase;
import com.analysiswatch.core.model.JobRecord;
import com.analysiswatch.core.notification.NotificationPolicy;
import com.analysiswatch.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.LongPredicate;

/**
 * Applies lifecycle events from an {@link EventStream} to one session's {@link TaskRegistry}.
 * <p>
 * Installed only while the stream is connected. Each installation is tagged with the
 * engine generation current at install time; events are handed to the engine executor and
 * dropped there if that generation is no longer current. Reinstalling never clears or
 * duplicates registry contents, since every mutation is an idempotent upsert or an atomic
 * test-and-remove.
 */
public class EventIngress {

    private static final Logger log = LoggerFactory.getLogger(EventIngress.class);

    enum Kind {
        STARTED("started"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String suffix;

        Kind(String suffix) {
            this.suffix = suffix;
        }
    }

    private final String topicPrefix;
    private final TaskRegistry registry;
    private final NotificationPolicy notificationPolicy;
    private final AnalysisWatchMetrics metrics;
    private final Clock clock;
    private final Executor engineExecutor;
    private final LongPredicate isCurrentGeneration;

    private final List<Subscription> subscriptions = new ArrayList<>();
    private long installedGeneration = -1;

    public EventIngress(String topicPrefix, TaskRegistry registry, NotificationPolicy notificationPolicy,
                        AnalysisWatchMetrics metrics, Clock clock, Executor engineExecutor,
                        LongPredicate isCurrentGeneration) {
        this.topicPrefix = topicPrefix;
        this.registry = registry;
        this.notificationPolicy = notificationPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.engineExecutor = engineExecutor;
        this.isCurrentGeneration = isCurrentGeneration;
    }

    /**
     * Subscribes to the started, completed and failed topics. Any previous installation is
     * removed first.
     *
     * @param stream     the connected stream
     * @param generation the engine generation this installation belongs to
     */
    public synchronized void install(EventStream stream, long generation) {
        uninstall();
        for (Kind kind : Kind.values()) {
            String topic = topicPrefix + "." + kind.suffix;
            subscriptions.add(stream.subscribe(topic,
                    event -> engineExecutor.execute(() -> apply(kind, event, generation))));
        }
        installedGeneration = generation;
        log.info("Event ingress installed (generation {})", generation);
    }

    /**
     * Cancels all topic subscriptions. Safe to call when not installed.
     */
    public synchronized void uninstall() {
        if (subscriptions.isEmpty()) {
            return;
        }
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
        log.info("Event ingress uninstalled (generation {})", installedGeneration);
        installedGeneration = -1;
    }

    public synchronized boolean isInstalled() {
        return !subscriptions.isEmpty();
    }

    void apply(Kind kind, AnalysisEvent event, long generation) {
        if (!isCurrentGeneration.test(generation)) {
            log.debug("Dropping {} from stale generation {}", event.eventType(), generation);
            metrics.recordEventDropped("stale");
            return;
        }
        String entityId = event.payloadString("customer_id");
        if (entityId == null || entityId.isBlank()) {
            log.warn("Dropping {} without customer_id: {}", event.eventType(), event.payload());
            metrics.recordEventDropped("malformed");
            return;
        }

        metrics.recordEventReceived(kind.suffix);
        MdcContext.setEntity(generation, entityId);
        try {
            switch (kind) {
                case STARTED -> onStarted(entityId, event);
                case COMPLETED -> onCompleted(entityId, event);
                case FAILED -> onFailed(entityId, event);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void onStarted(String entityId, AnalysisEvent event) {
        var record = new JobRecord(entityId, event.payloadString("customer_name"),
                event.payloadString("task_id"), JobPhase.RUNNING, clock.instant());
        registry.upsert(entityId, record);
        log.debug("Analysis started for {} (task {})", entityId, record.taskId());
    }

    private void onCompleted(String entityId, AnalysisEvent event) {
        Optional<JobRecord> removed = registry.removeIfPresent(entityId);
        log.debug("Analysis completed for {} (tracked={})", entityId, removed.isPresent());
        notificationPolicy.onRemoved(entityId, removed.isPresent(), label(event, removed));
    }

    private void onFailed(String entityId, AnalysisEvent event) {
        Optional<JobRecord> removed = registry.removeIfPresent(entityId);
        log.debug("Analysis failed for {} (tracked={})", entityId, removed.isPresent());
        notificationPolicy.onFailed(entityId, removed.isPresent(), label(event, removed));
    }

    private static String label(AnalysisEvent event, Optional<JobRecord> removed) {
        String name = event.payloadString("customer_name");
        if (name != null && !name.isBlank()) {
            return name;
        }
        return removed.map(JobRecord::entityLabel).orElse(null);
    }
}
