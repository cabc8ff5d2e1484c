package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Lineups generated for one historical game and how they actually scored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameBacktestResult {
    private String gameId;
    private String description;
    private int poolSize;

    @Builder.Default
    private List<ScoredLineup> lineups = new ArrayList<>();

    private double topScore;
}
