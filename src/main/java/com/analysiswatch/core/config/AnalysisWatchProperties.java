package com.analysiswatch.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "analysiswatch")
public class AnalysisWatchProperties {

    private Api api = new Api();
    private Stream stream = new Stream();
    private Notifications notifications = new Notifications();
    private Snapshot snapshot = new Snapshot();

    // -- Derived accessors --

    public Duration getSuccessDuration() { return Duration.ofMillis(notifications.successDurationMs); }
    public Duration getInfoDuration() { return Duration.ofMillis(notifications.infoDurationMs); }

    public boolean hasAccessToken() {
        return api.accessToken != null && !api.accessToken.isBlank();
    }

    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }
    public Stream getStream() { return stream; }
    public void setStream(Stream stream) { this.stream = stream; }
    public Notifications getNotifications() { return notifications; }
    public void setNotifications(Notifications notifications) { this.notifications = notifications; }
    public Snapshot getSnapshot() { return snapshot; }
    public void setSnapshot(Snapshot snapshot) { this.snapshot = snapshot; }

    public static class Api {
        private String baseUrl = "http://localhost:8000";
        private String statusPath = "/api/v1/ai-analysis/status";
        private String identityPath = "/api/v1/auth/me";
        private String accessToken = "";
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 15;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getStatusPath() { return statusPath; }
        public void setStatusPath(String statusPath) { this.statusPath = statusPath; }
        public String getIdentityPath() { return identityPath; }
        public void setIdentityPath(String identityPath) { this.identityPath = identityPath; }
        public String getAccessToken() { return accessToken; }
        public void setAccessToken(String accessToken) { this.accessToken = accessToken; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Stream {
        private String url = "ws://localhost:8000/api/v1/ws";
        private String topicPrefix = "analysis";
        private int reconnectDelaySeconds = 3;
        private int maxReconnectAttempts = 5;
        private int pingIntervalSeconds = 30;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getTopicPrefix() { return topicPrefix; }
        public void setTopicPrefix(String topicPrefix) { this.topicPrefix = topicPrefix; }
        public int getReconnectDelaySeconds() { return reconnectDelaySeconds; }
        public void setReconnectDelaySeconds(int reconnectDelaySeconds) { this.reconnectDelaySeconds = reconnectDelaySeconds; }
        public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
        public void setMaxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; }
        public int getPingIntervalSeconds() { return pingIntervalSeconds; }
        public void setPingIntervalSeconds(int pingIntervalSeconds) { this.pingIntervalSeconds = pingIntervalSeconds; }
    }

    public static class Notifications {
        private long successDurationMs = 5000;
        private long infoDurationMs = 3000;
        private boolean notifyOnFailure = false;

        public long getSuccessDurationMs() { return successDurationMs; }
        public void setSuccessDurationMs(long successDurationMs) { this.successDurationMs = successDurationMs; }
        public long getInfoDurationMs() { return infoDurationMs; }
        public void setInfoDurationMs(long infoDurationMs) { this.infoDurationMs = infoDurationMs; }
        public boolean isNotifyOnFailure() { return notifyOnFailure; }
        public void setNotifyOnFailure(boolean notifyOnFailure) { this.notifyOnFailure = notifyOnFailure; }
    }

    public static class Snapshot {
        private boolean pruneMissing = true;

        public boolean isPruneMissing() { return pruneMissing; }
        public void setPruneMissing(boolean pruneMissing) { this.pruneMissing = pruneMissing; }
    }
}
