package com.showdownlab.optimizer.domain;

/**
 * Projection scenario used as the solver objective.
 */
public enum ScoringMode {
    MEAN,
    CEILING;

    public double scoreOf(Player player) {
        return this == CEILING ? player.getCeilingScore() : player.getMeanScore();
    }
}
