package com.showdownlab.optimizer.infrastructure;

import com.showdownlab.optimizer.domain.AnalysisJob;
import com.showdownlab.optimizer.domain.JobStatus;
import com.showdownlab.optimizer.repository.AnalysisJobRepository;
import com.showdownlab.optimizer.service.AnalysisJobExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Optional;

/**
 * Polls the job queue on its own thread and hands queued jobs to the executor.
 * Retried jobs wait out a growing backoff first.
 */
@RequiredArgsConstructor
@Slf4j
public class AnalysisWorker implements Runnable {

    // Delay before retry 1, 2, 3
    static final long[] BACKOFF_DELAYS = { 1000, 3000, 5000 };

    private final QueueService queueService;
    private final AnalysisJobRepository analysisJobRepository;
    private final AnalysisJobExecutor analysisJobExecutor;
    private final String workerName;

    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started and polling queue", workerName);

        while (running) {
            try {
                Long jobId = queueService.pop();
                if (jobId != null) {
                    processJob(jobId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted", workerName);
                break;
            } catch (RuntimeException e) {
                log.error("{} encountered error while polling queue: {}", workerName, e.getMessage(), e);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during error recovery", workerName);
                    break;
                }
            }
        }

        log.info("{} stopped", workerName);
    }

    void processJob(Long jobId) throws InterruptedException {
        MDC.put("jobId", String.valueOf(jobId));
        MDC.put("worker", workerName);

        try {
            Optional<AnalysisJob> jobOptional = analysisJobRepository.findById(jobId);
            if (jobOptional.isEmpty()) {
                log.warn("Job not found in database");
                return;
            }

            AnalysisJob job = jobOptional.get();
            if (job.getStatus() != JobStatus.QUEUED) {
                log.warn("Job is {}. Skipping.", job.getStatus());
                return;
            }

            if (job.getRetryCount() != null && job.getRetryCount() > 0) {
                applyBackoff(job.getRetryCount());
            }

            log.info("Processing {} job, retry count {}", job.getJobType(), job.getRetryCount());
            analysisJobExecutor.executeJob(job);
        } finally {
            MDC.remove("jobId");
            MDC.remove("worker");
        }
    }

    private void applyBackoff(int retryCount) throws InterruptedException {
        int index = Math.min(retryCount, BACKOFF_DELAYS.length) - 1;
        long delayMs = BACKOFF_DELAYS[index];
        log.info("Backing off {}ms before retry {}", delayMs, retryCount);
        Thread.sleep(delayMs);
    }

    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
