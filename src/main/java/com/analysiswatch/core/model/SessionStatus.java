package com.analysiswatch.core.model;

/**
 * Outcome of the identity probe.
 */
public enum SessionStatus {
    /** The probe returned 2xx. */
    AUTHORIZED,
    /** The probe returned 401, 403 or any other non-2xx status. */
    UNAUTHORIZED,
    /** The probe could not be completed (network failure); treated as not authorized. */
    UNKNOWN
}
