package com.showdownlab.optimizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.showdownlab.optimizer.controller.dto.BacktestRequest;
import com.showdownlab.optimizer.controller.dto.JobStatusResponse;
import com.showdownlab.optimizer.controller.dto.JobSubmissionResponse;
import com.showdownlab.optimizer.controller.dto.ModelDiscoveryRequest;
import com.showdownlab.optimizer.domain.AnalysisJob;
import com.showdownlab.optimizer.domain.JobStatus;
import com.showdownlab.optimizer.domain.JobType;
import com.showdownlab.optimizer.infrastructure.QueueService;
import com.showdownlab.optimizer.repository.AnalysisJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Persists analysis jobs and hands them to the worker queue.
 * Identical requests of the same type map to the same job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobServiceImpl implements AnalysisJobService {

    private static final EnumSet<JobStatus> CANCELLABLE =
            EnumSet.of(JobStatus.SUBMITTED, JobStatus.QUEUED, JobStatus.RUNNING);

    private final AnalysisJobRepository analysisJobRepository;
    private final QueueService queueService;
    private final ObjectMapper objectMapper;
    private final OptimizerMetricsService metricsService;

    @Override
    public JobSubmissionResponse submitBacktest(BacktestRequest request) {
        log.info("Received backtest submission - Lineups per game: {}, Preset: {}",
                request.getLineupCount(), request.getPreset());
        return submit(JobType.BACKTEST, request);
    }

    @Override
    public JobSubmissionResponse submitDiscovery(ModelDiscoveryRequest request) {
        log.info("Received model discovery submission - Games: {}, Train split: {}",
                request.getGameCount(), request.getTrainSplitPercent());
        return submit(JobType.MODEL_DISCOVERY, request);
    }

    @Override
    public JobStatusResponse getJob(Long jobId) {
        AnalysisJob job = analysisJobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        return toStatusResponse(job);
    }

    @Override
    public JobStatusResponse cancel(Long jobId) {
        AnalysisJob job = analysisJobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));

        int updated = analysisJobRepository.transitionStatus(jobId, CANCELLABLE, JobStatus.CANCELLED,
                LocalDateTime.now());
        if (updated > 0) {
            log.info("Job {} cancelled (was {})", jobId, job.getStatus());
            metricsService.recordJobCancelled();
        } else {
            log.info("Job {} is {} and cannot be cancelled", jobId, job.getStatus());
        }

        return getJob(jobId);
    }

    private JobSubmissionResponse submit(JobType jobType, Object request) {
        String requestJson = toJson(request);
        String idempotencyKey = generateIdempotencyKey(jobType, requestJson);
        log.debug("Generated idempotency key: {}", idempotencyKey);

        Optional<AnalysisJob> existingJob = analysisJobRepository.findByIdempotencyKey(idempotencyKey);
        if (existingJob.isPresent()) {
            AnalysisJob job = existingJob.get();
            log.info("Idempotent request detected for job ID: {} with status: {}", job.getId(), job.getStatus());
            return handleExistingJob(job);
        }

        AnalysisJob savedJob;
        try {
            savedJob = analysisJobRepository.save(createJob(jobType, requestJson, idempotencyKey));
        } catch (DataIntegrityViolationException e) {
            // Lost a race with an identical submission
            AnalysisJob job = analysisJobRepository.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
            return handleExistingJob(job);
        }
        log.info("Created new {} job with ID: {}", jobType, savedJob.getId());

        // QUEUED must be visible before a worker can pop the id
        savedJob.setStatus(JobStatus.QUEUED);
        savedJob.setUpdatedAt(LocalDateTime.now());
        savedJob = analysisJobRepository.save(savedJob);

        try {
            queueService.push(savedJob.getId());
        } catch (RuntimeException e) {
            log.error("Failed to enqueue job {}: {}", savedJob.getId(), e.getMessage());
            savedJob.setStatus(JobStatus.FAILED);
            savedJob.setFailureReason("Could not enqueue job: " + e.getMessage());
            analysisJobRepository.save(savedJob);
            throw e;
        }

        metricsService.recordJobSubmitted();
        log.info("Job {} pushed to queue with status QUEUED", savedJob.getId());

        return JobSubmissionResponse.builder()
                .jobId(savedJob.getId())
                .jobType(jobType)
                .status(savedJob.getStatus())
                .message("Job queued successfully")
                .isExisting(false)
                .build();
    }

    private JobSubmissionResponse handleExistingJob(AnalysisJob job) {
        String message = switch (job.getStatus()) {
            case COMPLETED -> "Job already completed. Results available at /jobs/" + job.getId();
            case RUNNING -> "Job is currently being processed";
            case QUEUED -> "Job is queued and waiting for processing";
            case FAILED -> "Job previously failed after " + job.getRetryCount() + " attempts";
            case SUBMITTED -> "Job submitted and awaiting queue placement";
            case CANCELLED -> "Job was cancelled. Change the run label to submit it again";
        };

        return JobSubmissionResponse.builder()
                .jobId(job.getId())
                .jobType(job.getJobType())
                .status(job.getStatus())
                .message(message)
                .isExisting(true)
                .build();
    }

    private JobStatusResponse toStatusResponse(AnalysisJob job) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .jobType(job.getJobType())
                .status(job.getStatus())
                .progressPercent(job.getProgressPercent() != null ? job.getProgressPercent() : 0)
                .progressMessage(job.getProgressMessage())
                .retryCount(job.getRetryCount() != null ? job.getRetryCount() : 0)
                .failureReason(job.getFailureReason())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .result(readResult(job))
                .build();
    }

    private JsonNode readResult(AnalysisJob job) {
        if (job.getResultJson() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(job.getResultJson());
        } catch (JsonProcessingException e) {
            log.error("Stored result for job {} is not valid JSON", job.getId(), e);
            throw new IllegalStateException("Corrupt result for job " + job.getId(), e);
        }
    }

    /**
     * SHA-256 over the job type and request JSON.
     */
    private String generateIdempotencyKey(JobType jobType, String requestJson) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((jobType.name() + ":" + requestJson).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new RuntimeException("Failed to generate idempotency key", e);
        }
    }

    private String toJson(Object request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize request to JSON", e);
            throw new RuntimeException("Failed to serialize job request", e);
        }
    }

    private AnalysisJob createJob(JobType jobType, String requestJson, String idempotencyKey) {
        LocalDateTime now = LocalDateTime.now();
        return AnalysisJob.builder()
                .jobType(jobType)
                .requestJson(requestJson)
                .status(JobStatus.SUBMITTED)
                .idempotencyKey(idempotencyKey)
                .retryCount(0)
                .progressPercent(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
