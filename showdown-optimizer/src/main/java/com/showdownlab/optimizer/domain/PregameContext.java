package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Information known before kickoff.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PregameContext {

    @Builder.Default
    private List<String> injuries = new ArrayList<>();

    private String vegasLine;

    // Team abbreviation -> TEAM-group metrics
    @Builder.Default
    private Map<String, Map<StatFeature, Double>> teamMetrics = new HashMap<>();

    // GAME_CONTEXT-group factors
    @Builder.Default
    private Map<StatFeature, Double> gameFactors = new HashMap<>();

    public double teamMetric(String team, StatFeature feature) {
        if (team == null || teamMetrics == null) {
            return 0.0;
        }
        Map<StatFeature, Double> metrics = teamMetrics.get(team);
        if (metrics == null) {
            return 0.0;
        }
        return metrics.getOrDefault(feature, 0.0);
    }

    public double gameFactor(StatFeature feature) {
        return gameFactors != null ? gameFactors.getOrDefault(feature, 0.0) : 0.0;
    }
}
