package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fit quality of a tuned model on training data, plus validation results once scored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ModelPerformance {
    private double trainingMae;
    private double trainingResidualStdDev;
    private int trainingSampleSize;
    private Double validationMae;
    private CalibrationReport calibration;
}
