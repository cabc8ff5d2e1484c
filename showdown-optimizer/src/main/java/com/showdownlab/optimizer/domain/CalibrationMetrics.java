package com.showdownlab.optimizer.domain;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

/**
 * Calculator for prediction accuracy and Gaussian calibration metrics.
 */
public final class CalibrationMetrics {

    static final double MIN_SIGMA = 1e-6;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);
    private static final double INV_SQRT_PI = 1.0 / Math.sqrt(Math.PI);

    private CalibrationMetrics() {
    }

    /**
     * Mean absolute error between predictions and actuals.
     */
    public static double meanAbsoluteError(double[] predicted, double[] actual) {
        checkLengths(predicted, actual);
        if (predicted.length == 0) {
            return 0.0;
        }

        double sum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / predicted.length;
    }

    /**
     * Root mean square of the residuals (population form, residual mean not removed).
     */
    public static double residualStandardDeviation(double[] predicted, double[] actual) {
        checkLengths(predicted, actual);
        if (predicted.length == 0) {
            return 0.0;
        }

        double sumSquares = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            double residual = actual[i] - predicted[i];
            sumSquares += residual * residual;
        }
        return Math.sqrt(sumSquares / predicted.length);
    }

    /**
     * Mean continuous ranked probability score of N(prediction, sigma^2) forecasts.
     */
    public static double gaussianCrps(double[] predicted, double[] actual, double sigma) {
        checkLengths(predicted, actual);
        if (predicted.length == 0) {
            return 0.0;
        }

        double s = Math.max(sigma, MIN_SIGMA);
        double sum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            double z = (actual[i] - predicted[i]) / s;
            double cdf = STANDARD_NORMAL.cumulativeProbability(z);
            double pdf = STANDARD_NORMAL.density(z);
            sum += s * (z * (2.0 * cdf - 1.0) + 2.0 * pdf - INV_SQRT_PI);
        }
        return sum / predicted.length;
    }

    /**
     * Probability integral transform of each actual under its predictive distribution.
     */
    public static double[] pitValues(double[] predicted, double[] actual, double sigma) {
        checkLengths(predicted, actual);
        double s = Math.max(sigma, MIN_SIGMA);
        double[] pit = new double[predicted.length];
        for (int i = 0; i < predicted.length; i++) {
            pit[i] = STANDARD_NORMAL.cumulativeProbability((actual[i] - predicted[i]) / s);
        }
        return pit;
    }

    /**
     * KS test p-value of the PIT values against Uniform(0,1); null with fewer than two samples.
     */
    public static Double pitKolmogorovSmirnovPValue(double[] predicted, double[] actual, double sigma) {
        if (predicted.length < 2) {
            return null;
        }
        double[] pit = pitValues(predicted, actual, sigma);
        return new KolmogorovSmirnovTest().kolmogorovSmirnovTest(new UniformRealDistribution(0.0, 1.0), pit);
    }

    /**
     * Percent of actuals falling inside the central interval holding the given probability mass.
     */
    public static double centralIntervalCoverage(double[] predicted, double[] actual, double sigma, double mass) {
        checkLengths(predicted, actual);
        if (predicted.length == 0) {
            return 0.0;
        }

        double halfWidth = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + mass / 2.0)
                * Math.max(sigma, MIN_SIGMA);
        int covered = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (Math.abs(actual[i] - predicted[i]) <= halfWidth) {
                covered++;
            }
        }
        return 100.0 * covered / predicted.length;
    }

    public static CalibrationReport report(double[] predicted, double[] actual, double sigma,
            CalibrationReport.SigmaSource sigmaSource) {
        return CalibrationReport.builder()
                .sampleSize(predicted.length)
                .mae(meanAbsoluteError(predicted, actual))
                .crps(gaussianCrps(predicted, actual, sigma))
                .pitKsPValue(pitKolmogorovSmirnovPValue(predicted, actual, sigma))
                .p50Coverage(centralIntervalCoverage(predicted, actual, sigma, 0.5))
                .predictiveSigma(sigma)
                .sigmaSource(sigmaSource)
                .build();
    }

    private static void checkLengths(double[] predicted, double[] actual) {
        if (predicted.length != actual.length) {
            throw new IllegalArgumentException("Predicted and actual arrays differ in length: "
                    + predicted.length + " vs " + actual.length);
        }
    }
}
