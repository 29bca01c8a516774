package com.analysiswatch.core.model;

/**
 * Non-terminal phases of a background analysis job.
 * <p>
 * Terminal outcomes (completed, failed) are never stored; they remove the record instead.
 */
public enum JobPhase {
    QUEUED,
    RUNNING
}
