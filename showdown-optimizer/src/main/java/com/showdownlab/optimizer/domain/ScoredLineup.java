package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A backtest lineup with its projected and realised score.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScoredLineup {
    private String captainName;
    private List<String> otherNames;
    private int totalSalary;
    private double projectedScore;
    private double actualScore;
}
