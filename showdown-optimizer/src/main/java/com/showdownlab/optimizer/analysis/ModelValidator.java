package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.domain.CalibrationMetrics;
import com.showdownlab.optimizer.domain.CalibrationReport;
import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.ModelPerformance;
import com.showdownlab.optimizer.domain.TunedModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores candidate models against held-out games and ranks them.
 */
@Slf4j
public class ModelValidator {

    /**
     * Annotate every model with validation MAE and a calibration report.
     *
     * @return the models ranked by {@link TunedModel#RANKING}
     */
    public List<TunedModel> validate(List<TunedModel> models, List<HistoricalGame> validationGames,
            List<String> warnings, CancellationToken token) {
        List<TunedModel> validated = new ArrayList<>();

        for (TunedModel model : models) {
            token.throwIfCancelled("validating " + model.getName());

            double[][] pairs = ModelDiscovery.predictionPairs(model.scoringModel(), validationGames);
            double[] predicted = pairs[0];
            double[] actual = pairs[1];

            ModelPerformance performance = model.getPerformance() != null
                    ? model.getPerformance().toBuilder().build()
                    : new ModelPerformance();

            if (predicted.length == 0) {
                warnings.add("No validation samples with positive actual points for " + model.getName());
                validated.add(model.toBuilder().performance(performance).build());
                continue;
            }

            double sigma = performance.getTrainingResidualStdDev();
            CalibrationReport.SigmaSource source = CalibrationReport.SigmaSource.TRAINING_RESIDUALS;
            if (sigma <= 0.0) {
                sigma = CalibrationMetrics.residualStandardDeviation(predicted, actual);
                source = CalibrationReport.SigmaSource.VALIDATION_RESIDUALS;
                warnings.add(model.getName() + " has no training residual spread; calibration uses validation residuals");
            }

            CalibrationReport report = CalibrationMetrics.report(predicted, actual, sigma, source);
            performance.setValidationMae(report.getMae());
            performance.setCalibration(report);

            log.info("Validated {} - MAE: {}, CRPS: {}, P50 coverage: {}%",
                    model.getName(), String.format("%.3f", report.getMae()),
                    String.format("%.3f", report.getCrps()), String.format("%.1f", report.getP50Coverage()));

            validated.add(model.toBuilder().performance(performance).build());
        }

        validated.sort(TunedModel.RANKING);
        return validated;
    }
}
