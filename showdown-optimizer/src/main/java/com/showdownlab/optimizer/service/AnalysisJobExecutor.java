package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.domain.AnalysisJob;

/**
 * Service interface for executing analysis jobs.
 */
public interface AnalysisJobExecutor {

    /**
     * Claim and run a queued job, storing its report and final status.
     *
     * @param job the job popped from the queue
     */
    void executeJob(AnalysisJob job);
}
