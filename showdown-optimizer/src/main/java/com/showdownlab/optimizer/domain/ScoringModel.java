package com.showdownlab.optimizer.domain;

import java.util.Map;

/**
 * Applies a weight vector to historical player lines or live stat projections.
 */
public class ScoringModel {

    private final StatWeights weights;

    public ScoringModel(StatWeights weights) {
        this.weights = weights;
    }

    /**
     * Predicted fantasy points for a historical player, including team,
     * game and teammate context, scaled by the matchup multiplier when present.
     */
    public double predict(HistoricalPlayerRecord player, HistoricalGame game) {
        double total = 0.0;
        for (Map.Entry<StatFeature, Double> weight : weights.asMap().entrySet()) {
            total += weight.getValue() * FeatureExtractor.value(weight.getKey(), player, game);
        }

        return total * matchupMultiplier(player);
    }

    public static double matchupMultiplier(HistoricalPlayerRecord player) {
        Double matchup = player.getMatchupAdvantageScore();
        return matchup != null ? matchup : 1.0;
    }

    /**
     * Fantasy points implied by a projected stat line.
     */
    public double project(Map<StatFeature, Double> statProjection) {
        return weights.dot(statProjection);
    }

    public StatWeights getWeights() {
        return weights;
    }
}
