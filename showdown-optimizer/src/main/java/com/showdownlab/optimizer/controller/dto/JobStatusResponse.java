package com.showdownlab.optimizer.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.showdownlab.optimizer.domain.JobStatus;
import com.showdownlab.optimizer.domain.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Current state of an analysis job, with its report once available.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobStatusResponse {
    private Long jobId;
    private JobType jobType;
    private JobStatus status;
    private int progressPercent;
    private String progressMessage;
    private int retryCount;
    private String failureReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // BacktestReport or ValidationReport
    private JsonNode result;
}
