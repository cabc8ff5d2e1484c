package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.domain.StatFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordinary least squares without intercept over a named feature matrix.
 * Columns that are zero in every row are dropped before fitting and keep a
 * zero coefficient. A rank-deficient matrix is solved through the SVD
 * pseudo-inverse, which gives the minimum-norm least-squares solution: any
 * direction the data cannot identify gets a zero coefficient.
 */
@Slf4j
public class RegressionFitter {

    private static final double SINGULARITY_THRESHOLD = 1e-10;
    private static final double RELATIVE_RANK_TOLERANCE = 1e-10;

    public RegressionFit fit(List<StatFeature> features, List<double[]> rows, List<Double> targets) {
        if (rows.size() != targets.size()) {
            throw new IllegalArgumentException("Row and target counts differ: " + rows.size() + " vs " + targets.size());
        }

        List<Integer> activeColumns = new ArrayList<>();
        for (int col = 0; col < features.size(); col++) {
            for (double[] row : rows) {
                if (row[col] != 0.0) {
                    activeColumns.add(col);
                    break;
                }
            }
        }

        if (activeColumns.isEmpty()) {
            return RegressionFit.skipped("no feature has a nonzero value", rows.size());
        }
        if (rows.size() <= activeColumns.size()) {
            return RegressionFit.skipped("insufficient training data: " + rows.size()
                    + " rows for " + activeColumns.size() + " features", rows.size());
        }

        double[][] x = new double[rows.size()][activeColumns.size()];
        double[] y = new double[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            for (int c = 0; c < activeColumns.size(); c++) {
                x[r][c] = rows.get(r)[activeColumns.get(c)];
            }
            y[r] = targets.get(r);
        }

        double[] parameters;
        boolean rankDeficient = false;
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            regression.setNoIntercept(true);
            regression.newSampleData(y, x);
            parameters = regression.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            log.debug("Feature matrix is singular, solving with the pseudo-inverse: {}", e.getMessage());
            parameters = minimumNormSolution(x, y);
            rankDeficient = true;
        } catch (MathIllegalArgumentException e) {
            log.debug("Regression failed: {}", e.getMessage());
            return RegressionFit.skipped("degenerate feature matrix: " + e.getMessage(), rows.size());
        }

        Map<StatFeature, Double> coefficients = new EnumMap<>(StatFeature.class);
        for (int c = 0; c < activeColumns.size(); c++) {
            double value = parameters[c];
            coefficients.put(features.get(activeColumns.get(c)), Double.isFinite(value) ? value : 0.0);
        }
        return RegressionFit.success(coefficients, rows.size(), rankDeficient);
    }

    /**
     * Truncated pseudo-inverse solve. Singular values below a fixed fraction of
     * the largest are treated as zero.
     */
    private static double[] minimumNormSolution(double[][] x, double[] y) {
        SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(x, false));
        double[] singularValues = svd.getSingularValues();
        double cutoff = singularValues[0] * RELATIVE_RANK_TOLERANCE;

        RealVector projected = svd.getU().preMultiply(new ArrayRealVector(y, false));
        double[] scaled = new double[singularValues.length];
        for (int i = 0; i < singularValues.length; i++) {
            scaled[i] = singularValues[i] > cutoff ? projected.getEntry(i) / singularValues[i] : 0.0;
        }
        return svd.getV().operate(new ArrayRealVector(scaled, false)).toArray();
    }
}
