package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.controller.dto.BacktestRequest;
import com.showdownlab.optimizer.controller.dto.JobStatusResponse;
import com.showdownlab.optimizer.controller.dto.JobSubmissionResponse;
import com.showdownlab.optimizer.controller.dto.ModelDiscoveryRequest;

/**
 * Service interface for background analysis jobs.
 */
public interface AnalysisJobService {

    /**
     * Submit a backtest job, or return the existing job for an identical request.
     */
    JobSubmissionResponse submitBacktest(BacktestRequest request);

    /**
     * Submit a model discovery job, or return the existing job for an identical request.
     */
    JobSubmissionResponse submitDiscovery(ModelDiscoveryRequest request);

    /**
     * @throws JobNotFoundException if no job has the given id
     */
    JobStatusResponse getJob(Long jobId);

    /**
     * Request cancellation. Jobs already in a terminal state are returned unchanged.
     *
     * @throws JobNotFoundException if no job has the given id
     */
    JobStatusResponse cancel(Long jobId);
}
