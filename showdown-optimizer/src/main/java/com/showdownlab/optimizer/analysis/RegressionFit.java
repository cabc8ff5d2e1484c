package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.domain.StatFeature;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Coefficients of a successful least-squares fit, or the reason it was skipped.
 */
@Getter
public final class RegressionFit {

    private final Map<StatFeature, Double> coefficients;
    private final int rowCount;
    private final String failureReason;

    // Solved through the pseudo-inverse because the feature matrix was singular
    private final boolean rankDeficient;

    private RegressionFit(Map<StatFeature, Double> coefficients, int rowCount, String failureReason,
            boolean rankDeficient) {
        this.coefficients = coefficients;
        this.rowCount = rowCount;
        this.failureReason = failureReason;
        this.rankDeficient = rankDeficient;
    }

    static RegressionFit success(Map<StatFeature, Double> coefficients, int rowCount, boolean rankDeficient) {
        return new RegressionFit(Collections.unmodifiableMap(coefficients), rowCount, null, rankDeficient);
    }

    static RegressionFit skipped(String reason, int rowCount) {
        return new RegressionFit(Collections.emptyMap(), rowCount, reason, false);
    }

    public boolean isSuccessful() {
        return failureReason == null;
    }
}
