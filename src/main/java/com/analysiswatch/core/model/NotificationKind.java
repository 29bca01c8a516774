package com.analysiswatch.core.model;

/**
 * Severity of a user-facing notification; each kind has its own display duration.
 */
public enum NotificationKind {
    SUCCESS,
    INFO
}
