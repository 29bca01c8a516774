package com.analysiswatch.stream;

import com.analysiswatch.core.config.AnalysisWatchProperties;
import com.analysiswatch.core.events.AnalysisEvent;
import com.analysiswatch.core.metrics.AnalysisWatchMetrics;
import com.analysiswatch.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WebSocketEventStreamTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private AnalysisWatchProperties properties;
    private HttpClient httpClient;
    private WebSocket.Builder builder;
    private ScheduledExecutorService scheduler;
    private List<Runnable> scheduled;
    private SimpleMeterRegistry meterRegistry;
    private WebSocketEventStream stream;
    private List<Boolean> connectionChanges;

    @BeforeEach
    void setUp() {
        properties = new AnalysisWatchProperties();
        properties.getApi().setAccessToken("secret-token");
        httpClient = mock(HttpClient.class);
        builder = mock(WebSocket.Builder.class);
        when(httpClient.newWebSocketBuilder()).thenReturn(builder);
        when(builder.connectTimeout(any(Duration.class))).thenReturn(builder);
        when(builder.header(anyString(), anyString())).thenReturn(builder);

        scheduler = mock(ScheduledExecutorService.class);
        scheduled = new ArrayList<>();
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(inv -> {
            scheduled.add(inv.getArgument(0));
            return mock(ScheduledFuture.class);
        });
        when(scheduler.scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class)))
                .thenAnswer(inv -> mock(ScheduledFuture.class));

        meterRegistry = new SimpleMeterRegistry();
        stream = new WebSocketEventStream(properties, httpClient, new ObjectMapper(), new MutableClock(T0),
                scheduler, new AnalysisWatchMetrics(meterRegistry));
        connectionChanges = new ArrayList<>();
        stream.onConnectionChange(connectionChanges::add);
    }

    private double dropped(String reason) {
        var counter = meterRegistry.find("analysiswatch.events.dropped").tag("reason", reason).counter();
        return counter == null ? 0 : counter.count();
    }

    private static WebSocket socket() {
        WebSocket socket = mock(WebSocket.class);
        when(socket.sendText(any(CharSequence.class), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(socket));
        when(socket.sendClose(anyInt(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(socket));
        return socket;
    }

    /** Connects and returns the listener the stream registered with the socket builder. */
    private WebSocket.Listener connectAndCaptureListener(WebSocket socket) {
        ArgumentCaptor<WebSocket.Listener> listener = ArgumentCaptor.forClass(WebSocket.Listener.class);
        when(builder.buildAsync(any(URI.class), listener.capture()))
                .thenReturn(CompletableFuture.completedFuture(socket));
        stream.connect();
        return listener.getValue();
    }

    // -- Message handling ------------------------------------------------------

    @Nested
    @DisplayName("handleMessage")
    class HandleMessage {

        private List<AnalysisEvent> started;

        @BeforeEach
        void subscribe() {
            started = new ArrayList<>();
            stream.subscribe("analysis.started", started::add);
        }

        @Test
        @DisplayName("publishes envelopes on their type topic")
        void publishesEnvelope() {
            stream.handleMessage("""
                    {"type":"analysis.started","tenant_id":"t1",
                     "data":{"customer_id":42,"customer_name":"Acme","task_id":"abc"},
                     "timestamp":"2026-03-01T09:59:59Z"}
                    """);

            assertEquals(1, started.size());
            AnalysisEvent event = started.get(0);
            assertEquals("t1", event.tenantId());
            assertEquals("42", event.payloadString("customer_id"));
            assertEquals("Acme", event.payloadString("customer_name"));
            assertEquals(T0, event.timestamp());
        }

        @Test
        @DisplayName("ignores pong replies")
        void ignoresPong() {
            stream.handleMessage("pong");

            assertTrue(started.isEmpty());
            assertEquals(0, dropped("malformed"));
        }

        @Test
        @DisplayName("drops unparseable text and envelopes without type")
        void dropsMalformed() {
            stream.handleMessage("not json");
            stream.handleMessage("{\"data\":{\"customer_id\":1}}");

            assertTrue(started.isEmpty());
            assertEquals(2.0, dropped("malformed"));
        }

        @Test
        @DisplayName("records the tenant from connection.established")
        void recordsTenant() {
            stream.handleMessage("{\"type\":\"connection.established\",\"tenant_id\":\"t1\"}");

            assertEquals("t1", stream.tenantId());
            assertTrue(started.isEmpty());
        }

        @Test
        @DisplayName("drops events addressed to another tenant")
        void dropsForeignTenant() {
            stream.handleMessage("{\"type\":\"connection.established\",\"tenant_id\":\"t1\"}");

            stream.handleMessage("{\"type\":\"analysis.started\",\"tenant_id\":\"t2\",\"data\":{\"customer_id\":1}}");
            stream.handleMessage("{\"type\":\"analysis.started\",\"tenant_id\":\"t1\",\"data\":{\"customer_id\":2}}");

            assertEquals(1, started.size());
            assertEquals("2", started.get(0).payloadString("customer_id"));
            assertEquals(1.0, dropped("foreign_tenant"));
        }

        @Test
        @DisplayName("error envelopes are logged, not published")
        void errorNotPublished() {
            List<AnalysisEvent> errors = new ArrayList<>();
            stream.subscribe("error", errors::add);

            stream.handleMessage("{\"type\":\"error\",\"message\":\"bad token\"}");

            assertTrue(errors.isEmpty());
        }

        @Test
        @DisplayName("a missing data object yields an empty payload")
        void missingData() {
            stream.handleMessage("{\"type\":\"analysis.started\"}");

            assertEquals(1, started.size());
            assertTrue(started.get(0).payload().isEmpty());
        }
    }

    // -- Connection lifecycle --------------------------------------------------

    @Nested
    @DisplayName("connection lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("opening sends the auth message, starts pinging and reports connected")
        void openSendsAuth() {
            WebSocket socket = socket();
            WebSocket.Listener listener = connectAndCaptureListener(socket);

            listener.onOpen(socket);

            verify(builder).header("Authorization", "Bearer secret-token");
            verify(socket).sendText("{\"type\":\"auth\",\"token\":\"secret-token\"}", true);
            verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(30L), eq(30L), eq(TimeUnit.SECONDS));
            assertTrue(stream.isConnected());
            assertEquals(List.of(true), connectionChanges);
        }

        @Test
        @DisplayName("text frames are reassembled before handling")
        void reassemblesFrames() {
            WebSocket socket = socket();
            WebSocket.Listener listener = connectAndCaptureListener(socket);
            listener.onOpen(socket);
            List<AnalysisEvent> started = new ArrayList<>();
            stream.subscribe("analysis.started", started::add);

            listener.onText(socket, "{\"type\":\"analysis.", false);
            listener.onText(socket, "started\",\"data\":{\"customer_id\":7}}", true);

            assertEquals(1, started.size());
            assertEquals("7", started.get(0).payloadString("customer_id"));
        }

        @Test
        @DisplayName("a fragment left by a dropped socket does not corrupt the next socket's frames")
        void fragmentsAreKeptPerSocket() {
            WebSocket first = socket();
            WebSocket second = socket();
            List<WebSocket.Listener> listeners = new ArrayList<>();
            when(builder.buildAsync(any(URI.class), any(WebSocket.Listener.class))).thenAnswer(inv -> {
                listeners.add(inv.getArgument(1));
                return CompletableFuture.completedFuture(listeners.size() == 1 ? first : second);
            });
            List<AnalysisEvent> started = new ArrayList<>();
            stream.subscribe("analysis.started", started::add);

            stream.connect();
            listeners.get(0).onOpen(first);
            listeners.get(0).onText(first, "{\"type\":\"analysis.", false);
            listeners.get(0).onClose(first, 1006, "");
            scheduled.get(0).run();
            listeners.get(1).onOpen(second);
            listeners.get(1).onText(second, "{\"type\":\"analysis.started\",\"data\":{\"customer_id\":7}}", true);

            assertEquals(1, started.size());
            assertEquals("7", started.get(0).payloadString("customer_id"));
            assertEquals(0, dropped("malformed"));
        }

        @Test
        @DisplayName("a server close reports disconnected and schedules a reconnect")
        void closeSchedulesReconnect() {
            WebSocket socket = socket();
            WebSocket.Listener listener = connectAndCaptureListener(socket);
            listener.onOpen(socket);

            listener.onClose(socket, 1006, "");

            assertFalse(stream.isConnected());
            assertTrue(stream.isReconnecting());
            assertEquals(1, stream.reconnectAttempts());
            assertEquals(List.of(true, false), connectionChanges);
            verify(scheduler).schedule(any(Runnable.class), eq(3L), eq(TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("gives up after the configured number of failed attempts")
        void givesUpAfterMaxAttempts() {
            properties.getStream().setMaxReconnectAttempts(2);
            when(builder.buildAsync(any(URI.class), any(WebSocket.Listener.class)))
                    .thenReturn(CompletableFuture.failedFuture(new java.io.IOException("refused")));

            stream.connect();
            scheduled.get(0).run();
            scheduled.get(1).run();

            assertEquals(2, scheduled.size());
            assertEquals(2, stream.reconnectAttempts());
            verify(httpClient, times(3)).newWebSocketBuilder();
        }

        @Test
        @DisplayName("disconnect closes the socket and stops reconnecting")
        void disconnectStopsReconnecting() {
            WebSocket socket = socket();
            WebSocket.Listener listener = connectAndCaptureListener(socket);
            listener.onOpen(socket);

            stream.disconnect();
            listener.onClose(socket, 1000, "Client disconnect");

            verify(socket).sendClose(WebSocket.NORMAL_CLOSURE, "Client disconnect");
            assertFalse(stream.isConnected());
            assertFalse(stream.isReconnecting());
            assertTrue(scheduled.isEmpty());
        }
    }
}
