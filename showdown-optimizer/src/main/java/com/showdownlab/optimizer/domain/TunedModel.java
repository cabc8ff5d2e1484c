package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * A named weight vector with its provenance and measured performance.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TunedModel {

    /**
     * Lowest validation MAE first, unvalidated models last, newest first on ties.
     */
    public static final Comparator<TunedModel> RANKING = Comparator
            .comparing(TunedModel::validationMaeOrNull, Comparator.nullsLast(Comparator.<Double>naturalOrder()))
            .thenComparing(TunedModel::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private String id;
    private String name;
    private StatWeights weights;
    private String sourceDescription;
    private LocalDateTime createdAt;
    private ModelPerformance performance;

    public ScoringModel scoringModel() {
        return new ScoringModel(weights);
    }

    private Double validationMaeOrNull() {
        return performance != null ? performance.getValidationMae() : null;
    }
}
