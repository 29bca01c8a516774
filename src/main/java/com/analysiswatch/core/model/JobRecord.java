package com.analysiswatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An unfinished analysis job for one entity, as far as this client knows.
 *
 * @param entityId    unique key of the entity (customer) the job belongs to
 * @param entityLabel display name of the entity; not authoritative and may be blank
 * @param taskId      opaque identifier of the underlying job instance (nullable)
 * @param phase       QUEUED or RUNNING
 * @param observedAt  when this state was observed, used to order competing updates
 */
public record JobRecord(
    String entityId,
    String entityLabel,
    String taskId,
    JobPhase phase,
    Instant observedAt
) implements Serializable {

    public JobRecord {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    public JobRecord withLabel(String label) {
        return new JobRecord(entityId, label, taskId, phase, observedAt);
    }

    public JobRecord withObservedAt(Instant instant) {
        return new JobRecord(entityId, entityLabel, taskId, phase, instant);
    }

    /**
     * Label suitable for display, falling back to the entity id when no name is known.
     */
    public String displayLabel() {
        return entityLabel == null || entityLabel.isBlank() ? entityId : entityLabel;
    }
}
