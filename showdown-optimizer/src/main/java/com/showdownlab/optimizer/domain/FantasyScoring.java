package com.showdownlab.optimizer.domain;

import java.util.Map;

/**
 * Actual fantasy points from a final box score.
 */
public final class FantasyScoring {

    private static final StatWeights SCORING = StatWeights.fantasyDefaults();

    private FantasyScoring() {
    }

    public static double actualPoints(Map<StatFeature, Double> stats) {
        return Math.round(SCORING.dot(stats) * 100.0) / 100.0;
    }
}
