package com.analysiswatch.core.engine;

import com.analysiswatch.backend.BackendApiClient;
import com.analysiswatch.core.config.AnalysisWatchProperties;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.analysiswatch.core.notification.NotificationPolicy;
import com.analysiswatch.core.session.SessionGate;
import com.analysiswatch.core.snapshot.SnapshotLoader;
import com.analysiswatch.stream.WebSocketEventStream;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Single thread: every registry mutation and lifecycle change runs here, in order. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("engineExecutor")
    public ExecutorService engineExecutor() {
        return Executors.newSingleThreadExecutor(daemon("analysis-engine"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("ioExecutor")
    public ExecutorService ioExecutor() {
        return Executors.newFixedThreadPool(2, daemon("analysis-io"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService analysisScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemon("analysis-timer"));
    }

    @Bean
    public BackendApiClient backendApiClient(AnalysisWatchProperties properties, ObjectMapper objectMapper) {
        return new BackendApiClient(properties, objectMapper);
    }

    @Bean
    public SessionGate sessionGate(BackendApiClient client, AnalysisWatchProperties properties) {
        return new SessionGate(client, properties.getApi().getIdentityPath());
    }

    @Bean
    public SnapshotLoader snapshotLoader(BackendApiClient client, AnalysisWatchProperties properties,
                                         Clock clock, AnalysisWatchMetrics metrics) {
        return new SnapshotLoader(client, properties.getApi().getStatusPath(), clock, metrics);
    }

    @Bean(destroyMethod = "disconnect")
    public WebSocketEventStream webSocketEventStream(AnalysisWatchProperties properties, ObjectMapper objectMapper,
                                                     Clock clock, ScheduledExecutorService analysisScheduler,
                                                     AnalysisWatchMetrics metrics) {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getApi().getConnectTimeoutSeconds()))
                .build();
        return new WebSocketEventStream(properties, httpClient, objectMapper, clock, analysisScheduler, metrics);
    }

    @Bean
    public NotificationPolicy notificationPolicy(AnalysisWatchProperties properties, Clock clock,
                                                 ScheduledExecutorService analysisScheduler,
                                                 AnalysisWatchMetrics metrics) {
        return new NotificationPolicy(analysisScheduler, clock,
                properties.getSuccessDuration(), properties.getInfoDuration(),
                properties.getNotifications().isNotifyOnFailure(), metrics);
    }

    @Bean
    public TaskStatusEngine taskStatusEngine(SessionGate sessionGate, SnapshotLoader snapshotLoader,
                                             WebSocketEventStream eventStream, NotificationPolicy notificationPolicy,
                                             AnalysisWatchMetrics metrics, Clock clock,
                                             @Qualifier("engineExecutor") ExecutorService engineExecutor,
                                             @Qualifier("ioExecutor") ExecutorService ioExecutor,
                                             AnalysisWatchProperties properties) {
        return new TaskStatusEngine(sessionGate, snapshotLoader, eventStream, notificationPolicy, metrics, clock,
                engineExecutor, ioExecutor,
                properties.getStream().getTopicPrefix(), properties.getSnapshot().isPruneMissing());
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
