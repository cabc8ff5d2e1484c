package com.showdownlab.optimizer.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.showdownlab.optimizer.controller.dto.BacktestRequest;
import com.showdownlab.optimizer.controller.dto.JobStatusResponse;
import com.showdownlab.optimizer.controller.dto.JobSubmissionResponse;
import com.showdownlab.optimizer.controller.dto.ModelDiscoveryRequest;
import com.showdownlab.optimizer.domain.JobStatus;
import com.showdownlab.optimizer.domain.JobType;
import com.showdownlab.optimizer.domain.StrategyPreset;
import com.showdownlab.optimizer.service.AnalysisJobService;
import com.showdownlab.optimizer.service.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for job submission, status and cancellation.
 */
@WebMvcTest(AnalysisJobController.class)
class AnalysisJobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnalysisJobService analysisJobService;

    @Test
    void testSubmitBacktest_Success() throws Exception {
        // Arrange
        BacktestRequest request = BacktestRequest.builder()
                .lineupCount(5)
                .preset(StrategyPreset.SHOOTOUT)
                .build();
        JobSubmissionResponse mockResponse = JobSubmissionResponse.builder()
                .jobId(1L)
                .jobType(JobType.BACKTEST)
                .status(JobStatus.QUEUED)
                .message("Job queued successfully")
                .isExisting(false)
                .build();
        when(analysisJobService.submitBacktest(any())).thenReturn(mockResponse);

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value(1))
                .andExpect(jsonPath("$.jobType").value("BACKTEST"))
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.isExisting").value(false));
    }

    @Test
    void testSubmitBacktest_MissingLineupCount() throws Exception {
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"preset\":\"BALANCED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details[0]").value("lineupCount: Lineup count is required"));

        verify(analysisJobService, never()).submitBacktest(any());
    }

    @Test
    void testSubmitBacktest_UnknownPreset() throws Exception {
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lineupCount\":1,\"preset\":\"YOLO\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void testSubmitDiscovery_IdempotentRequest() throws Exception {
        // Arrange
        JobSubmissionResponse mockResponse = JobSubmissionResponse.builder()
                .jobId(9L)
                .jobType(JobType.MODEL_DISCOVERY)
                .status(JobStatus.COMPLETED)
                .message("Job already completed. Returning cached results.")
                .isExisting(true)
                .build();
        when(analysisJobService.submitDiscovery(any())).thenReturn(mockResponse);

        // Act & Assert
        mockMvc.perform(post("/model-discoveries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(ModelDiscoveryRequest.builder().gameCount(20).build())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value(9))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.isExisting").value(true));
    }

    @Test
    void testSubmitDiscovery_SplitOutOfRange() throws Exception {
        mockMvc.perform(post("/model-discoveries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"trainSplitPercent\":99}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("trainSplitPercent: Training split cannot exceed 95 percent"));
    }

    @Test
    void testGetJob_Success() throws Exception {
        // Arrange
        JobStatusResponse response = JobStatusResponse.builder()
                .jobId(3L)
                .jobType(JobType.BACKTEST)
                .status(JobStatus.RUNNING)
                .progressPercent(40)
                .progressMessage("Processed 4 of 10 games")
                .retryCount(0)
                .build();
        when(analysisJobService.getJob(3L)).thenReturn(response);

        // Act & Assert
        mockMvc.perform(get("/jobs/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.progressPercent").value(40))
                .andExpect(jsonPath("$.progressMessage").value("Processed 4 of 10 games"));
    }

    @Test
    void testGetJob_NotFound() throws Exception {
        when(analysisJobService.getJob(42L)).thenThrow(new JobNotFoundException(42L));

        mockMvc.perform(get("/jobs/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Analysis job not found: 42"));
    }

    @Test
    void testCancel_Success() throws Exception {
        // Arrange
        JobStatusResponse response = JobStatusResponse.builder()
                .jobId(3L)
                .jobType(JobType.MODEL_DISCOVERY)
                .status(JobStatus.CANCELLED)
                .build();
        when(analysisJobService.cancel(3L)).thenReturn(response);

        // Act & Assert
        mockMvc.perform(post("/jobs/3/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }
}
