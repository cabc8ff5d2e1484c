package com.showdownlab.optimizer.controller.dto;

import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluatedLineup {
    private int rank;
    private String signature;
    private Lineup lineup;
    private LineupMetrics metrics;
}
