package com.analysiswatch.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A transient notification about a finished analysis. Never persisted.
 *
 * @param entityId    the entity whose analysis finished
 * @param entityLabel display name at the time the notification fired
 * @param kind        SUCCESS for completions, INFO for failure notices
 * @param message     human-readable text
 * @param firedAt     when the notification fired
 * @param expiresAt   when it stops being shown
 */
public record AnalysisNotification(
    String entityId,
    String entityLabel,
    NotificationKind kind,
    String message,
    Instant firedAt,
    Instant expiresAt
) implements Serializable {}
