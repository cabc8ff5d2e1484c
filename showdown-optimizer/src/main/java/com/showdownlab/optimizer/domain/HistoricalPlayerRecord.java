package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * One player's final line in a past game.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalPlayerRecord {

    private String name;
    private String team;
    private Position position;

    @Builder.Default
    private Map<StatFeature, Double> stats = new HashMap<>();

    @Builder.Default
    private Map<StatFeature, Double> advancedStats = new HashMap<>();

    private double actualFantasyPoints;

    // Null when the slate's salary is unknown
    private Integer salary;

    // Multiplier applied to model predictions; null means neutral
    private Double matchupAdvantageScore;

    public double statValue(StatFeature feature) {
        Double value = stats != null ? stats.get(feature) : null;
        if (value == null && advancedStats != null) {
            value = advancedStats.get(feature);
        }
        return value != null ? value : 0.0;
    }

    public int salaryOrZero() {
        return salary != null ? salary : 0;
    }
}
