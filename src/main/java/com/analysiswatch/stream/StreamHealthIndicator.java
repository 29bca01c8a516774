package com.analysiswatch.stream;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the backend event stream.
 * <p>
 * Reports UP while connected, DOWN while reconnecting, UNKNOWN when no connection has been
 * requested.
 */
@Component("eventStreamHealthIndicator")
public class StreamHealthIndicator implements HealthIndicator {

    private final WebSocketEventStream eventStream;

    public StreamHealthIndicator(WebSocketEventStream eventStream) {
        this.eventStream = eventStream;
    }

    @Override
    public Health health() {
        if (eventStream.isConnected()) {
            var builder = Health.up();
            if (eventStream.tenantId() != null) {
                builder.withDetail("tenant", eventStream.tenantId());
            }
            return builder.build();
        }
        if (eventStream.isReconnecting()) {
            return Health.down()
                    .withDetail("reconnectAttempts", eventStream.reconnectAttempts())
                    .build();
        }
        return Health.unknown().withDetail("reason", "not connected").build();
    }
}
