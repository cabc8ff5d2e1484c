package com.showdownlab.optimizer.controller.dto;

import com.showdownlab.optimizer.domain.RunManifest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for lineup optimization.
 * {@code exhausted} is set when fewer unique feasible lineups existed than were requested.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineupResponse {
    private int requestedCount;
    private int generatedCount;
    private boolean exhausted;

    @Builder.Default
    private List<EvaluatedLineup> lineups = new ArrayList<>();

    private RunManifest manifest;
}
