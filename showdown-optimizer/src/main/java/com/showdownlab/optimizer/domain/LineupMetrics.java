package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived figures for a completed lineup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineupMetrics {
    private double totalMeanScore;
    private double totalCeilingScore;
    private int totalSalary;
    private double averageOwnership;
    private double ownershipProduct;
    private double correlationScore;
    private double duplicationRisk;
    private double expectedValue;
    private String stackType;
}
