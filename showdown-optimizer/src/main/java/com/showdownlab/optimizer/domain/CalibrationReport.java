package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Accuracy and calibration of a model on held-out games, computed under a
 * Gaussian predictive distribution centred on each point prediction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalibrationReport {
    private int sampleSize;
    private double mae;
    private double crps;

    // Kolmogorov-Smirnov p-value of PIT values against Uniform(0,1); null below two samples
    private Double pitKsPValue;

    // Percent of actuals inside the central 50% predictive interval
    private double p50Coverage;

    private double predictiveSigma;
    private SigmaSource sigmaSource;

    /**
     * Where the predictive standard deviation came from.
     */
    public enum SigmaSource {
        TRAINING_RESIDUALS,
        VALIDATION_RESIDUALS
    }
}
