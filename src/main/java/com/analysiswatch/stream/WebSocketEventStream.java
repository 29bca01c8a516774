package com.analysiswatch.stream;

import com.analysiswatch.core.config.AnalysisWatchProperties;
import com.analysiswatch.core.events.AnalysisEvent;
import com.analysiswatch.core.events.EventBus;
import com.analysiswatch.core.events.Subscription;
import com.analysiswatch.core.ingress.EventStream;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link EventStream} over the backend's tenant-scoped WebSocket endpoint.
 * <p>
 * On open the client sends an {@code auth} message carrying the configured token and then a
 * text {@code ping} every {@code stream.ping-interval-seconds}. Incoming envelopes have the
 * shape {@code {type, tenant_id, data, timestamp}}; they are published on an in-process
 * {@link EventBus} keyed by {@code type}, in the order the socket delivers them.
 * {@code connection.established} records the session's tenant and envelopes for any other
 * tenant are dropped.
 * <p>
 * A lost connection is retried every {@code stream.reconnect-delay-seconds} up to
 * {@code stream.max-reconnect-attempts} consecutive failures. {@link #disconnect()} stops
 * retrying.
 */
public class WebSocketEventStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventStream.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final AnalysisWatchProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AnalysisWatchMetrics metrics;
    private final EventBus eventBus = new EventBus();

    private final CopyOnWriteArrayList<Consumer<Boolean>> connectionListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean connecting = new AtomicBoolean();

    private volatile boolean wanted;
    private volatile boolean connected;
    private volatile WebSocket webSocket;
    private volatile String tenantId;
    private volatile int reconnectAttempts;
    private ScheduledFuture<?> pingTask;

    public WebSocketEventStream(AnalysisWatchProperties properties, HttpClient httpClient,
                                ObjectMapper objectMapper, Clock clock,
                                ScheduledExecutorService scheduler, AnalysisWatchMetrics metrics) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    @Override
    public void connect() {
        wanted = true;
        if (connected) {
            log.debug("Already connected, skipping");
            return;
        }
        openSocket();
    }

    @Override
    public void disconnect() {
        wanted = false;
        stopPing();
        WebSocket socket = webSocket;
        webSocket = null;
        if (socket != null) {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "Client disconnect")
                    .exceptionally(ex -> {
                        log.debug("Close handshake failed: {}", ex.getMessage());
                        socket.abort();
                        return null;
                    });
        }
        tenantId = null;
        reconnectAttempts = 0;
        setConnected(false);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    public boolean isReconnecting() {
        return wanted && !connected;
    }

    public int reconnectAttempts() {
        return reconnectAttempts;
    }

    public String tenantId() {
        return tenantId;
    }

    @Override
    public Subscription onConnectionChange(Consumer<Boolean> listener) {
        connectionListeners.add(listener);
        return () -> connectionListeners.remove(listener);
    }

    @Override
    public Subscription subscribe(String topic, Consumer<AnalysisEvent> consumer) {
        return eventBus.subscribe(topic, consumer);
    }

    // -- Connection management -------------------------------------------------

    private void openSocket() {
        if (!connecting.compareAndSet(false, true)) {
            log.debug("Connection already in progress, skipping");
            return;
        }
        var uri = URI.create(properties.getStream().getUrl());
        var builder = httpClient.newWebSocketBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getApi().getConnectTimeoutSeconds()));
        if (properties.hasAccessToken()) {
            builder.header("Authorization", "Bearer " + properties.getApi().getAccessToken());
        }
        log.info("Connecting to event stream at {}", uri);
        builder.buildAsync(uri, new Listener()).whenComplete((socket, ex) -> {
            connecting.set(false);
            if (ex != null) {
                log.warn("Event stream connection failed: {}", ex.getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (!wanted) {
            return;
        }
        int max = properties.getStream().getMaxReconnectAttempts();
        if (reconnectAttempts >= max) {
            log.error("Event stream unreachable after {} reconnect attempts; giving up", max);
            return;
        }
        reconnectAttempts++;
        int delay = properties.getStream().getReconnectDelaySeconds();
        log.info("Reconnecting in {}s (attempt {}/{})", delay, reconnectAttempts, max);
        scheduler.schedule(() -> {
            if (wanted && !connected) {
                openSocket();
            }
        }, delay, TimeUnit.SECONDS);
    }

    private void onOpened(WebSocket socket) {
        webSocket = socket;
        reconnectAttempts = 0;
        try {
            ObjectNode auth = objectMapper.createObjectNode();
            auth.put("type", "auth");
            auth.put("token", properties.getApi().getAccessToken());
            socket.sendText(objectMapper.writeValueAsString(auth), true);
        } catch (IOException e) {
            log.error("Failed to send auth message: {}", e.getMessage(), e);
            socket.abort();
            onClosed(socket, "auth message failed");
            return;
        }
        startPing(socket);
        log.info("Event stream connected");
        setConnected(true);
    }

    private void onClosed(WebSocket socket, String reason) {
        WebSocket active = webSocket;
        if (active != null && active != socket) {
            log.debug("Ignoring close of superseded socket: {}", reason);
            return;
        }
        stopPing();
        webSocket = null;
        tenantId = null;
        if (connected) {
            log.info("Event stream disconnected: {}", reason);
            setConnected(false);
        }
        scheduleReconnect();
    }

    private synchronized void startPing(WebSocket socket) {
        stopPing();
        long interval = properties.getStream().getPingIntervalSeconds();
        pingTask = scheduler.scheduleAtFixedRate(() ->
                socket.sendText("ping", true).exceptionally(ex -> {
                    log.debug("Ping failed: {}", ex.getMessage());
                    return null;
                }), interval, interval, TimeUnit.SECONDS);
    }

    private synchronized void stopPing() {
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
    }

    private void setConnected(boolean value) {
        if (connected == value) {
            return;
        }
        connected = value;
        for (Consumer<Boolean> listener : connectionListeners) {
            try {
                listener.accept(value);
            } catch (Exception e) {
                log.warn("Connection listener threw exception: {}", e.getMessage(), e);
            }
        }
    }

    // -- Message handling ------------------------------------------------------

    /**
     * Parses one complete text frame and publishes it when it is a tenant event.
     */
    void handleMessage(String text) {
        if ("pong".equals(text)) {
            return;
        }

        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (IOException e) {
            log.warn("Dropping unparseable stream message: {}", e.getMessage());
            metrics.recordEventDropped("malformed");
            return;
        }

        String type = text(message, "type");
        if (type == null) {
            log.warn("Dropping stream message without type: {}", text);
            metrics.recordEventDropped("malformed");
            return;
        }

        if ("connection.established".equals(type)) {
            tenantId = text(message, "tenant_id");
            log.info("Connection established for tenant {}", tenantId);
            return;
        }
        if ("error".equals(type)) {
            log.warn("Stream reported error: {}", message.path("message").asText());
            return;
        }

        String eventTenant = text(message, "tenant_id");
        String sessionTenant = tenantId;
        if (eventTenant != null && sessionTenant != null && !eventTenant.equals(sessionTenant)) {
            log.warn("Dropping {} for tenant {} (session tenant {})", type, eventTenant, sessionTenant);
            metrics.recordEventDropped("foreign_tenant");
            return;
        }

        JsonNode data = message.path("data");
        Map<String, Object> payload = data.isObject()
                ? objectMapper.convertValue(data, PAYLOAD_TYPE)
                : Map.of();
        eventBus.publish(new AnalysisEvent(type, eventTenant, payload, clock.instant()));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /** One per socket, so fragments of a superseded socket never mix into the next one. */
    private final class Listener implements WebSocket.Listener {

        private final StringBuilder partialMessage = new StringBuilder();

        @Override
        public void onOpen(WebSocket socket) {
            onOpened(socket);
            socket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket socket, CharSequence data, boolean last) {
            partialMessage.append(data);
            if (last) {
                String text = partialMessage.toString();
                partialMessage.setLength(0);
                try {
                    handleMessage(text);
                } catch (Exception e) {
                    log.warn("Failed to handle stream message: {}", e.getMessage(), e);
                }
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket socket, int statusCode, String reason) {
            onClosed(socket, "closed with status " + statusCode + (reason.isBlank() ? "" : " (" + reason + ")"));
            return null;
        }

        @Override
        public void onError(WebSocket socket, Throwable error) {
            log.warn("Event stream error: {}", error.getMessage());
            onClosed(socket, "error");
        }
    }
}
