package com.analysiswatch.core.ingress;

import com.analysiswatch.core.events.AnalysisEvent;
import com.analysiswatch.core.events.Subscription;

import java.util.function.Consumer;

/**
 * A live, at-least-once stream of backend events.
 * <p>
 * Implementations deliver events of one connection in order, may re-deliver or drop events,
 * and own their reconnect policy.
 */
public interface EventStream {

    /**
     * Starts connecting if not already connected or connecting. Returns immediately.
     */
    void connect();

    /**
     * Closes the connection and stops reconnecting.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Subscribe to connection state changes. The listener receives {@code true} when the
     * stream becomes connected and {@code false} when it loses the connection.
     */
    Subscription onConnectionChange(Consumer<Boolean> listener);

    /**
     * Subscribe to events of one topic.
     */
    Subscription subscribe(String topic, Consumer<AnalysisEvent> consumer);
}
