package com.showdownlab.optimizer.domain;

/**
 * Computes lineup metrics, including a simplified contest expected value
 * that rewards ceiling and discounts rosters the field is likely to duplicate.
 * Pure: the same lineup always yields the same metrics.
 */
public class LineupEvaluator {

    public static final int DEFAULT_FIELD_SIZE = 100_000;
    public static final double MIN_OWNERSHIP_FRACTION = 0.0001;

    private final int fieldSize;

    public LineupEvaluator() {
        this(DEFAULT_FIELD_SIZE);
    }

    public LineupEvaluator(int fieldSize) {
        if (fieldSize <= 0) {
            throw new IllegalArgumentException("Field size must be positive");
        }
        this.fieldSize = fieldSize;
    }

    public LineupMetrics evaluate(Lineup lineup) {
        double ownershipProduct = lineup.getOwnershipProduct();
        double totalCeiling = lineup.getTotalCeilingScore();

        // Expected number of other entrants holding the same roster
        double duplicationRisk = Math.max(0.0, ownershipProduct * fieldSize - 1.0);
        double uniquenessFactor = 1.0 / (1.0 + Math.sqrt(duplicationRisk));

        return LineupMetrics.builder()
                .totalMeanScore(lineup.getTotalMeanScore())
                .totalCeilingScore(totalCeiling)
                .totalSalary(lineup.getTotalSalary())
                .averageOwnership(lineup.getAverageOwnership())
                .ownershipProduct(ownershipProduct)
                .correlationScore(lineup.getCorrelationSum())
                .duplicationRisk(duplicationRisk)
                .expectedValue(totalCeiling * uniquenessFactor)
                .stackType(lineup.getStackSignature())
                .build();
    }

    public int getFieldSize() {
        return fieldSize;
    }
}
