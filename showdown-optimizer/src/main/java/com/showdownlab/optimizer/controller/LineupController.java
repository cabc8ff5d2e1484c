package com.showdownlab.optimizer.controller;

import com.showdownlab.optimizer.controller.dto.LineupRequest;
import com.showdownlab.optimizer.controller.dto.LineupResponse;
import com.showdownlab.optimizer.service.LineupOptimizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for synchronous lineup optimization.
 */
@RestController
@RequestMapping("/lineups")
@RequiredArgsConstructor
@Slf4j
public class LineupController {

    private final LineupOptimizationService lineupOptimizationService;

    /**
     * Generate up to {@code lineupCount} unique lineups for the given pool.
     *
     * @param request players, constraints and generation options
     * @return evaluated lineups with a run manifest
     */
    @PostMapping
    public ResponseEntity<LineupResponse> optimize(@Valid @RequestBody LineupRequest request) {
        log.info("POST /lineups - Players: {}, Lineups: {}, Mode: {}",
                request.getPlayers().size(), request.getLineupCount(), request.getScoringMode());

        return ResponseEntity.ok(lineupOptimizationService.optimize(request));
    }
}
