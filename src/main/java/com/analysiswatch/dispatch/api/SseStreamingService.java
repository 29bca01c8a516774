package com.analysiswatch.dispatch.api;

import com.analysiswatch.core.engine.TaskStatusEngine;
import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.model.AnalysisNotification;
import com.analysiswatch.core.model.JobRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bridges {@link TaskStatusEngine} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connected client first receives a {@code jobs} event with the current job list, then
 * a {@code jobs} event after every registry change and a {@code notification} event for every
 * fired notification. Emitter completion, timeout and error cancel the engine subscriptions.
 * <p>
 * Heartbeats are sent as SSE comments (lines starting with ':') every 30 seconds so idle
 * connections survive proxies; EventSource clients ignore them.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final TaskStatusEngine engine;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(TaskStatusEngine engine) {
        this(engine, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(TaskStatusEngine engine, long timeoutMs) {
        this.engine = engine;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed (connection likely closed): {}", e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped (emitter not active)");
            }
        }
    }

    /**
     * Creates an SSE emitter streaming job list changes and notifications.
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        var feed = new JobsFeed(list -> sendJobs(emitter, list));
        Subscription jobs = engine.onJobsChanged(feed::onChange);
        Subscription notifications = engine.onNotification(n -> sendNotification(emitter, n));

        var registration = new EmitterRegistration(emitter, jobs, notifications);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed");
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out");
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error: {}", ex.getMessage());
            cleanup(registration);
        });

        feed.sendInitial(engine.currentJobs());

        log.info("SSE emitter created (timeout={}ms)", timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendJobs(SseEmitter emitter, List<JobRecord> jobs) {
        try {
            emitter.send(SseEmitter.event()
                    .name("jobs")
                    .data(jobs.stream().map(SseStreamingService::toMap).toList()));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send jobs event: {}", e.getMessage());
        }
    }

    private void sendNotification(SseEmitter emitter, AnalysisNotification notification) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("entityId", notification.entityId());
            data.put("entityLabel", notification.entityLabel());
            data.put("kind", notification.kind().name());
            data.put("message", notification.message());
            data.put("firedAt", notification.firedAt().toString());
            data.put("expiresAt", notification.expiresAt().toString());
            emitter.send(SseEmitter.event()
                    .name("notification")
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send notification event for {}: {}", notification.entityId(), e.getMessage());
        }
    }

    /**
     * Orders the initial job list against change events racing with it: once a change has
     * been sent, the initial list is older than what the client already has and is dropped.
     */
    static final class JobsFeed {

        private final Consumer<List<JobRecord>> sink;
        private boolean changed;

        JobsFeed(Consumer<List<JobRecord>> sink) {
            this.sink = sink;
        }

        synchronized void onChange(List<JobRecord> jobs) {
            changed = true;
            sink.accept(jobs);
        }

        synchronized void sendInitial(List<JobRecord> jobs) {
            if (!changed) {
                sink.accept(jobs);
            }
        }
    }

    static Map<String, Object> toMap(JobRecord job) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entityId", job.entityId());
        data.put("entityLabel", job.displayLabel());
        if (job.taskId() != null) {
            data.put("taskId", job.taskId());
        }
        data.put("phase", job.phase().name());
        data.put("observedAt", job.observedAt().toString());
        return data;
    }

    private void cleanup(EmitterRegistration registration) {
        registration.jobs.unsubscribe();
        registration.notifications.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            SseEmitter emitter,
            Subscription jobs,
            Subscription notifications
    ) {}
}
