package com.showdownlab.optimizer.controller.dto;

import com.showdownlab.optimizer.domain.JobStatus;
import com.showdownlab.optimizer.domain.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for backtest and discovery submissions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobSubmissionResponse {
    private Long jobId;
    private JobType jobType;
    private JobStatus status;
    private String message;
    private Boolean isExisting;
}
