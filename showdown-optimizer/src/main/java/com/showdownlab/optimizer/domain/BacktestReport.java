package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit of a backtest across all cached games.
 * The average covers exactly the games in {@code gameResults}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestReport {
    private int gamesProcessed;
    private int gamesSkipped;
    private int totalLineups;
    private double averageTopScore;

    @Builder.Default
    private List<GameBacktestResult> gameResults = new ArrayList<>();

    @Builder.Default
    private List<PlayerExposure> exposures = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private boolean cancelled;
}
