package com.showdownlab.optimizer.controller;

import com.showdownlab.optimizer.controller.dto.BacktestRequest;
import com.showdownlab.optimizer.controller.dto.JobStatusResponse;
import com.showdownlab.optimizer.controller.dto.JobSubmissionResponse;
import com.showdownlab.optimizer.controller.dto.ModelDiscoveryRequest;
import com.showdownlab.optimizer.service.AnalysisJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for background backtest and model discovery jobs.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobController {

    private final AnalysisJobService analysisJobService;

    /**
     * Queue a backtest over all cached historical games.
     */
    @PostMapping("/backtests")
    public ResponseEntity<JobSubmissionResponse> submitBacktest(@Valid @RequestBody BacktestRequest request) {
        log.info("POST /backtests - Lineups per game: {}, Preset: {}", request.getLineupCount(), request.getPreset());
        return ResponseEntity.status(HttpStatus.CREATED).body(analysisJobService.submitBacktest(request));
    }

    /**
     * Queue a model discovery and validation cycle.
     */
    @PostMapping("/model-discoveries")
    public ResponseEntity<JobSubmissionResponse> submitDiscovery(@Valid @RequestBody ModelDiscoveryRequest request) {
        log.info("POST /model-discoveries - Games: {}, Train split: {}",
                request.getGameCount(), request.getTrainSplitPercent());
        return ResponseEntity.status(HttpStatus.CREATED).body(analysisJobService.submitDiscovery(request));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable Long jobId) {
        log.debug("GET /jobs/{}", jobId);
        return ResponseEntity.ok(analysisJobService.getJob(jobId));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<JobStatusResponse> cancel(@PathVariable Long jobId) {
        log.info("POST /jobs/{}/cancel", jobId);
        return ResponseEntity.ok(analysisJobService.cancel(jobId));
    }
}
