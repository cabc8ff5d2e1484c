package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.domain.StatFeature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the no-intercept least-squares fitter.
 */
class RegressionFitterTest {

    private static final List<StatFeature> FEATURES =
            List.of(StatFeature.PASS_YDS, StatFeature.RUSH_YDS, StatFeature.REC_YDS);

    private final RegressionFitter fitter = new RegressionFitter();

    @Test
    void testFit_RecoversExactCoefficients() {
        // Arrange
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        double[][] data = { { 250, 10, 0 }, { 310, 25, 0 }, { 0, 80, 0 }, { 0, 45, 0 }, { 180, 0, 0 }, { 275, 5, 0 } };
        for (double[] row : data) {
            rows.add(row);
            targets.add(0.04 * row[0] + 0.1 * row[1]);
        }

        // Act
        RegressionFit fit = fitter.fit(FEATURES, rows, targets);

        // Assert
        assertTrue(fit.isSuccessful());
        assertFalse(fit.isRankDeficient());
        assertEquals(6, fit.getRowCount());
        assertEquals(0.04, fit.getCoefficients().get(StatFeature.PASS_YDS), 1e-9);
        assertEquals(0.1, fit.getCoefficients().get(StatFeature.RUSH_YDS), 1e-9);
    }

    @Test
    void testFit_AllZeroColumnDropped() {
        List<double[]> rows = List.of(new double[] { 1, 2, 0 }, new double[] { 2, 1, 0 }, new double[] { 3, 3, 0 });
        List<Double> targets = List.of(5.0, 4.0, 9.0);

        RegressionFit fit = fitter.fit(FEATURES, rows, targets);

        assertTrue(fit.isSuccessful());
        assertFalse(fit.getCoefficients().containsKey(StatFeature.REC_YDS));
        assertEquals(2, fit.getCoefficients().size());
    }

    @Test
    void testFit_NoNonZeroFeature_Skipped() {
        List<double[]> rows = List.of(new double[] { 0, 0, 0 }, new double[] { 0, 0, 0 });

        RegressionFit fit = fitter.fit(FEATURES, rows, List.of(1.0, 2.0));

        assertFalse(fit.isSuccessful());
        assertTrue(fit.getCoefficients().isEmpty());
        assertTrue(fit.getFailureReason().contains("no feature"));
    }

    @Test
    void testFit_TooFewRows_Skipped() {
        List<double[]> rows = List.of(new double[] { 1, 2, 0 }, new double[] { 2, 5, 0 });

        RegressionFit fit = fitter.fit(FEATURES, rows, List.of(1.0, 2.0));

        assertFalse(fit.isSuccessful());
        assertTrue(fit.getFailureReason().startsWith("insufficient training data"));
    }

    @Test
    void testFit_CollinearColumns_MinimumNormSolution() {
        // Arrange
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            rows.add(new double[] { i, 2.0 * i, 0 });
            targets.add(3.0 * i);
        }

        // Act
        RegressionFit fit = fitter.fit(FEATURES, rows, targets);

        // Assert: any b1 + 2 * b2 = 3 fits exactly, the shortest is (0.6, 1.2)
        assertTrue(fit.isSuccessful());
        assertTrue(fit.isRankDeficient());
        assertEquals(0.6, fit.getCoefficients().get(StatFeature.PASS_YDS), 1e-9);
        assertEquals(1.2, fit.getCoefficients().get(StatFeature.RUSH_YDS), 1e-9);
    }

    @Test
    void testFit_DuplicatedRowsWithZeroResidual_ZeroCoefficients() {
        // Arrange: two distinct rows repeated, three active columns
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(new double[] { 250, 2, 1 });
            rows.add(new double[] { 310, 3, 0 });
            targets.add(0.0);
            targets.add(0.0);
        }

        // Act
        RegressionFit fit = fitter.fit(FEATURES, rows, targets);

        // Assert
        assertTrue(fit.isSuccessful());
        assertTrue(fit.isRankDeficient());
        assertEquals(3, fit.getCoefficients().size());
        fit.getCoefficients().values().forEach(value -> assertEquals(0.0, value, 1e-12));
    }

    @Test
    void testFit_MismatchedTargets_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> fitter.fit(FEATURES, List.of(new double[] { 1, 0, 0 }), List.of()));
    }
}
