package com.showdownlab.optimizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable feature-to-coefficient mapping. Features without an entry
 * contribute zero.
 */
@EqualsAndHashCode
@ToString
public final class StatWeights {

    private final Map<StatFeature, Double> coefficients;

    private StatWeights(Map<StatFeature, Double> coefficients) {
        this.coefficients = coefficients;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StatWeights of(Map<StatFeature, Double> coefficients) {
        EnumMap<StatFeature, Double> copy = new EnumMap<>(StatFeature.class);
        if (coefficients != null) {
            coefficients.forEach((feature, value) -> {
                if (feature != null && value != null && value != 0.0) {
                    copy.put(feature, value);
                }
            });
        }
        return new StatWeights(copy);
    }

    public static StatWeights zero() {
        return of(Collections.emptyMap());
    }

    /**
     * FanDuel box-score scoring: the starting point every fitted model is merged over.
     */
    public static StatWeights fantasyDefaults() {
        Map<StatFeature, Double> weights = new EnumMap<>(StatFeature.class);
        weights.put(StatFeature.PASS_YDS, 0.04);
        weights.put(StatFeature.PASS_TDS, 4.0);
        weights.put(StatFeature.INTERCEPTIONS, -1.0);
        weights.put(StatFeature.RUSH_YDS, 0.1);
        weights.put(StatFeature.RUSH_TDS, 6.0);
        weights.put(StatFeature.RECEPTIONS, 0.5);
        weights.put(StatFeature.REC_YDS, 0.1);
        weights.put(StatFeature.REC_TDS, 6.0);
        weights.put(StatFeature.FUMBLES_LOST, -2.0);
        return of(weights);
    }

    /**
     * Element-wise mean of several weight vectors.
     */
    public static StatWeights average(List<StatWeights> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty list of weights");
        }

        Map<StatFeature, Double> sums = new EnumMap<>(StatFeature.class);
        for (StatWeights w : weights) {
            w.coefficients.forEach((feature, value) -> sums.merge(feature, value, Double::sum));
        }
        sums.replaceAll((feature, sum) -> sum / weights.size());
        return of(sums);
    }

    public double get(StatFeature feature) {
        return coefficients.getOrDefault(feature, 0.0);
    }

    public StatWeights with(StatFeature feature, double value) {
        Map<StatFeature, Double> copy = new EnumMap<>(StatFeature.class);
        copy.putAll(coefficients);
        copy.put(feature, value);
        return of(copy);
    }

    /**
     * Overlay the given coefficients on this vector.
     */
    public StatWeights mergedWith(Map<StatFeature, Double> overrides) {
        Map<StatFeature, Double> copy = new EnumMap<>(StatFeature.class);
        copy.putAll(coefficients);
        copy.putAll(overrides);
        return of(copy);
    }

    /**
     * Weighted sum over a sparse stat line.
     */
    public double dot(Map<StatFeature, Double> stats) {
        if (stats == null) {
            return 0.0;
        }
        double total = 0.0;
        for (Map.Entry<StatFeature, Double> entry : coefficients.entrySet()) {
            Double value = stats.get(entry.getKey());
            if (value != null) {
                total += value * entry.getValue();
            }
        }
        return total;
    }

    @JsonValue
    public Map<StatFeature, Double> asMap() {
        return Collections.unmodifiableMap(coefficients);
    }
}
