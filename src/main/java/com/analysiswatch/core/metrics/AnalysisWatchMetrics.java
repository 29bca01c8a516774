package com.analysiswatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for the task-status engine.
 */
@Service
public class AnalysisWatchMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger trackedJobs = new AtomicInteger();

    public AnalysisWatchMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("analysiswatch.jobs.tracked", trackedJobs, AtomicInteger::get)
                .description("Analysis jobs currently tracked as queued or running")
                .register(registry);
    }

    public void recordEventReceived(String eventType) {
        Counter.builder("analysiswatch.events.received")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * Records an event that was not applied.
     *
     * @param reason "malformed", "stale" or "foreign_tenant"
     */
    public void recordEventDropped(String reason) {
        Counter.builder("analysiswatch.events.dropped")
                .description("Stream events discarded without touching the registry")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a snapshot load.
     *
     * @param outcome "loaded", "unauthorized" or "failed"
     */
    public void recordSnapshotLoad(String outcome) {
        Counter.builder("analysiswatch.snapshot.loads")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a snapshot result discarded because its activation was superseded or torn down.
     */
    public void recordSnapshotDiscarded() {
        Counter.builder("analysiswatch.snapshot.discarded")
                .register(registry)
                .increment();
    }

    public void recordNotificationFired(String kind) {
        Counter.builder("analysiswatch.notifications.fired")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordTrackedJobs(int count) {
        trackedJobs.set(count);
    }
}
