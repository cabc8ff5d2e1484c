package com.showdownlab.optimizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.showdownlab.optimizer.controller.dto.BacktestRequest;
import com.showdownlab.optimizer.controller.dto.ModelDiscoveryRequest;
import com.showdownlab.optimizer.domain.AnalysisJob;
import com.showdownlab.optimizer.domain.BacktestReport;
import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.InvalidLineupInputException;
import com.showdownlab.optimizer.domain.JobStatus;
import com.showdownlab.optimizer.domain.PipelineCancelledException;
import com.showdownlab.optimizer.domain.ProgressListener;
import com.showdownlab.optimizer.domain.ValidationReport;
import com.showdownlab.optimizer.infrastructure.QueueService;
import com.showdownlab.optimizer.repository.AnalysisJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Runs claimed jobs through the backtest or discovery pipeline.
 * Unexpected failures are retried through the queue; bad input fails at once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobExecutorImpl implements AnalysisJobExecutor {

    static final int MAX_RETRY_COUNT = 3;
    private static final int MAX_MESSAGE_LENGTH = 1000;
    private static final int MAX_PROGRESS_MESSAGE_LENGTH = 500;

    private final AnalysisJobRepository analysisJobRepository;
    private final QueueService queueService;
    private final BacktestService backtestService;
    private final ModelSimulationService modelSimulationService;
    private final ObjectMapper objectMapper;
    private final OptimizerMetricsService metricsService;

    @Override
    public void executeJob(AnalysisJob job) {
        if (job == null || job.getId() == null) {
            log.error("Invalid job: job or job ID is null");
            return;
        }

        MDC.put("jobId", String.valueOf(job.getId()));
        try {
            executeJobInternal(job);
        } finally {
            MDC.remove("jobId");
        }
    }

    private void executeJobInternal(AnalysisJob job) {
        long startTime = System.currentTimeMillis();
        Long jobId = job.getId();

        // Only one worker can win the QUEUED -> RUNNING transition
        int claimed = analysisJobRepository.transitionStatus(jobId, List.of(JobStatus.QUEUED), JobStatus.RUNNING,
                LocalDateTime.now());
        if (claimed == 0) {
            log.warn("Job is no longer QUEUED. Skipping execution.");
            return;
        }

        if (job.getRetryCount() == null || job.getRetryCount() == 0) {
            log.info("Started {} job", job.getJobType());
        } else {
            log.info("Retry {} of {} job", job.getRetryCount(), job.getJobType());
        }

        ProgressListener listener = event -> analysisJobRepository.updateProgress(jobId, event.getPercent(),
                truncate(event.getMessage(), MAX_PROGRESS_MESSAGE_LENGTH), LocalDateTime.now());
        CancellationToken token = () -> analysisJobRepository.findStatusById(jobId)
                .map(status -> status == JobStatus.CANCELLED)
                .orElse(true);

        try {
            switch (job.getJobType()) {
                case BACKTEST -> runBacktest(job, listener, token, startTime);
                case MODEL_DISCOVERY -> runDiscovery(job, listener, token, startTime);
            }
        } catch (PipelineCancelledException e) {
            log.info("Job stopped after cancellation: {}", e.getMessage());
        } catch (InvalidLineupInputException e) {
            log.warn("Job rejected: {}", e.getMessage());
            markFailed(jobId, e);
        } catch (JsonProcessingException e) {
            log.error("Job payload could not be processed: {}", e.getMessage(), e);
            markFailed(jobId, e);
        } catch (RuntimeException e) {
            log.error("Error during execution: {}", e.getMessage(), e);
            handleFailure(jobId, e);
        }
    }

    private void runBacktest(AnalysisJob job, ProgressListener listener, CancellationToken token, long startTime)
            throws JsonProcessingException {
        BacktestRequest request = objectMapper.readValue(job.getRequestJson(), BacktestRequest.class);
        BacktestReport report = backtestService.runBacktest(request, listener, token);
        String resultJson = objectMapper.writeValueAsString(report);

        if (report.isCancelled()) {
            analysisJobRepository.attachResult(job.getId(), resultJson, LocalDateTime.now());
            log.info("Backtest cancelled after {} games; partial report stored", report.getGamesProcessed());
            return;
        }
        complete(job.getId(), resultJson, startTime);
    }

    private void runDiscovery(AnalysisJob job, ProgressListener listener, CancellationToken token, long startTime)
            throws JsonProcessingException {
        ModelDiscoveryRequest request = objectMapper.readValue(job.getRequestJson(), ModelDiscoveryRequest.class);
        ValidationReport report = modelSimulationService.runDiscoveryCycle(request, listener, token);
        complete(job.getId(), objectMapper.writeValueAsString(report), startTime);
    }

    private void complete(Long jobId, String resultJson, long startTime) {
        int updated = analysisJobRepository.completeJob(jobId, JobStatus.RUNNING, JobStatus.COMPLETED, resultJson,
                LocalDateTime.now());
        if (updated == 0) {
            log.warn("Job left RUNNING during execution; result not recorded as COMPLETED");
            return;
        }

        long executionTimeMs = System.currentTimeMillis() - startTime;
        metricsService.recordJobCompleted(executionTimeMs);
        log.info("Status changed to COMPLETED in {}ms", executionTimeMs);
        log.debug(metricsService.getMetricsSummary());
    }

    /**
     * Mark a job FAILED without retrying.
     */
    private void markFailed(Long jobId, Exception error) {
        try {
            AnalysisJob current = analysisJobRepository.findById(jobId).orElse(null);
            if (current == null || current.getStatus() != JobStatus.RUNNING) {
                return;
            }
            current.setStatus(JobStatus.FAILED);
            current.setFailureReason(describe(error));
            current.setUpdatedAt(LocalDateTime.now());
            analysisJobRepository.save(current);
            metricsService.recordJobFailed();
            log.info("Status changed to FAILED");
        } catch (OptimisticLockingFailureException e) {
            log.warn("Job changed concurrently while marking it FAILED");
        }
    }

    /**
     * Retry through the queue until {@link #MAX_RETRY_COUNT} attempts, then fail.
     */
    private void handleFailure(Long jobId, Exception error) {
        try {
            AnalysisJob current = analysisJobRepository.findById(jobId).orElse(null);
            if (current == null || current.getStatus() != JobStatus.RUNNING) {
                log.warn("Job is no longer RUNNING; failure not recorded");
                return;
            }

            String errorMessage = describe(error);
            current.setRetryCount(current.getRetryCount() + 1);
            current.setFailureReason(errorMessage);
            current.setUpdatedAt(LocalDateTime.now());

            if (current.getRetryCount() < MAX_RETRY_COUNT) {
                log.warn("Failed (attempt {}/{}): {}. Requeuing for retry...",
                        current.getRetryCount(), MAX_RETRY_COUNT, errorMessage);
                current.setStatus(JobStatus.QUEUED);
                analysisJobRepository.save(current);

                try {
                    queueService.push(jobId);
                    metricsService.recordJobRetried();
                    log.info("Requeued for retry attempt {}", current.getRetryCount() + 1);
                } catch (RuntimeException queueEx) {
                    log.error("Failed to requeue job: {}", queueEx.getMessage(), queueEx);
                    markQueuedJobFailed(jobId, "Could not requeue after failure: " + errorMessage);
                }
            } else {
                log.error("Failed permanently after {} attempts: {}", current.getRetryCount(), errorMessage);
                current.setStatus(JobStatus.FAILED);
                analysisJobRepository.save(current);
                metricsService.recordJobFailed();
                log.info("Status changed to FAILED");
            }
        } catch (OptimisticLockingFailureException e) {
            log.warn("Job changed concurrently while recording failure");
        }
    }

    private void markQueuedJobFailed(Long jobId, String reason) {
        analysisJobRepository.findById(jobId).ifPresent(current -> {
            current.setStatus(JobStatus.FAILED);
            current.setFailureReason(truncate(reason, MAX_MESSAGE_LENGTH));
            current.setUpdatedAt(LocalDateTime.now());
            analysisJobRepository.save(current);
            metricsService.recordJobFailed();
        });
    }

    private static String describe(Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return truncate(message, MAX_MESSAGE_LENGTH);
    }

    private static String truncate(String message, int maxLength) {
        if (message == null || message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength - 3) + "...";
    }
}
