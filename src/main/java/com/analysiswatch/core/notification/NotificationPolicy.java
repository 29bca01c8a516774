package com.analysiswatch.core.notification;

import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.analysiswatch.core.model.AnalysisNotification;
import com.analysiswatch.core.model.NotificationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Decides which registry removals produce a user-facing notification.
 * <p>
 * A completion notifies only when the registry actually held a record for the entity at
 * the moment of removal. Each notification expires after its kind's display duration; a
 * new notification for the same entity replaces the live one and cancels its timer. The
 * expiry timer is the only timer the engine runs.
 */
public class NotificationPolicy {

    private static final Logger log = LoggerFactory.getLogger(NotificationPolicy.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration successDuration;
    private final Duration infoDuration;
    private final boolean notifyOnFailure;
    private final AnalysisWatchMetrics metrics;

    private final ConcurrentHashMap<String, LiveNotification> live = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<AnalysisNotification>> listeners = new CopyOnWriteArrayList<>();

    public NotificationPolicy(ScheduledExecutorService scheduler, Clock clock,
                              Duration successDuration, Duration infoDuration,
                              boolean notifyOnFailure, AnalysisWatchMetrics metrics) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.successDuration = successDuration;
        this.infoDuration = infoDuration;
        this.notifyOnFailure = notifyOnFailure;
        this.metrics = metrics;
    }

    /**
     * Handles a completion removal.
     *
     * @param entityId   the entity whose job completed
     * @param wasPresent whether the registry held a record for it at the moment of removal
     * @param label      display name for the notification
     * @return the notification fired, or empty when suppressed
     */
    public Optional<AnalysisNotification> onRemoved(String entityId, boolean wasPresent, String label) {
        if (!wasPresent) {
            log.debug("Suppressing completion notification for untracked entity {}", entityId);
            return Optional.empty();
        }
        String name = displayName(entityId, label);
        return Optional.of(fire(entityId, name, NotificationKind.SUCCESS,
                "AI analysis completed for " + name, successDuration));
    }

    /**
     * Handles a failure removal. Fires an informational notice only when failure notices are
     * enabled and the entity was tracked.
     */
    public Optional<AnalysisNotification> onFailed(String entityId, boolean wasPresent, String label) {
        if (!wasPresent || !notifyOnFailure) {
            return Optional.empty();
        }
        String name = displayName(entityId, label);
        return Optional.of(fire(entityId, name, NotificationKind.INFO,
                "AI analysis failed for " + name, infoDuration));
    }

    /**
     * Notifications that have fired and not yet expired, oldest first.
     */
    public List<AnalysisNotification> active() {
        return live.values().stream()
                .map(LiveNotification::notification)
                .sorted(Comparator.comparing(AnalysisNotification::firedAt))
                .toList();
    }

    /**
     * Subscribe to fired notifications.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription onNotification(Consumer<AnalysisNotification> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Cancels every pending expiry and forgets all live notifications.
     */
    public void clear() {
        for (LiveNotification entry : live.values()) {
            entry.expiry().cancel(false);
        }
        live.clear();
    }

    private AnalysisNotification fire(String entityId, String label, NotificationKind kind,
                                      String message, Duration duration) {
        Instant now = clock.instant();
        var notification = new AnalysisNotification(entityId, label, kind, message, now, now.plus(duration));

        // Every live entry owns a scheduled expiry
        ScheduledFuture<?> expiry = scheduler.schedule(
                () -> expire(entityId, notification), duration.toMillis(), TimeUnit.MILLISECONDS);
        LiveNotification previous = live.put(entityId, new LiveNotification(notification, expiry));
        if (previous != null) {
            previous.expiry().cancel(false);
            log.debug("Replaced live notification for {}", entityId);
        }

        metrics.recordNotificationFired(kind.name().toLowerCase());
        log.info("Notification fired for {}: {}", entityId, message);
        for (Consumer<AnalysisNotification> listener : listeners) {
            try {
                listener.accept(notification);
            } catch (Exception e) {
                log.warn("Notification listener threw exception: {}", e.getMessage(), e);
            }
        }
        return notification;
    }

    private void expire(String entityId, AnalysisNotification notification) {
        live.computeIfPresent(entityId, (key, current) ->
                current.notification() == notification ? null : current);
        log.debug("Notification for {} expired", entityId);
    }

    private static String displayName(String entityId, String label) {
        return label == null || label.isBlank() ? entityId : label;
    }

    private record LiveNotification(AnalysisNotification notification, ScheduledFuture<?> expiry) {}
}
