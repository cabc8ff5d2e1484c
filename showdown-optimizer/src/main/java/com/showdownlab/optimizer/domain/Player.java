package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A player available on a Showdown slate, already enriched with salary,
 * projections, ownership and pairwise correlations.
 * Treated as read-only once a solve starts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Player {

    private String id;
    private String name;
    private String team;
    private String opponent;
    private Position position;
    private int salary;
    private double meanScore;
    private double ceilingScore;

    // Projected field ownership in percent (0-100)
    private double ownershipFlex;
    private double ownershipCaptain;

    @Builder.Default
    private Map<String, Double> correlations = new HashMap<>();

    // Optional stat lines a tuned model can re-project
    private Map<StatFeature, Double> meanStatProjection;
    private Map<StatFeature, Double> ceilingStatProjection;

    /**
     * Correlation coefficient with another player, checking both directions.
     */
    public double correlationWith(Player other) {
        if (correlations != null) {
            Double value = correlations.get(other.getId());
            if (value != null) {
                return value;
            }
        }
        if (other.getCorrelations() != null) {
            Double value = other.getCorrelations().get(id);
            if (value != null) {
                return value;
            }
        }
        return 0.0;
    }
}
