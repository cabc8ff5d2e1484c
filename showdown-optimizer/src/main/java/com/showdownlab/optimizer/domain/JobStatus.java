package com.showdownlab.optimizer.domain;

/**
 * Lifecycle of a queued analysis job.
 */
public enum JobStatus {
    SUBMITTED,
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
