package com.analysiswatch.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event received from the backend's live stream.
 *
 * @param eventType topic of the event (e.g. "analysis.started", "analysis.completed")
 * @param tenantId  tenant the event was published for (nullable when the stream does not say)
 * @param payload   the event's {@code data} object
 * @param timestamp when this client received the event
 */
public record AnalysisEvent(
    String eventType,
    String tenantId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    /**
     * Returns a payload value as a string, or {@code null} when absent or JSON null.
     */
    public String payloadString(String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
