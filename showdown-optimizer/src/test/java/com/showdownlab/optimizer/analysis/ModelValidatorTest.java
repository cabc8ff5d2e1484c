package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.TestFixtures;
import com.showdownlab.optimizer.domain.CalibrationReport;
import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalPlayerRecord;
import com.showdownlab.optimizer.domain.ModelPerformance;
import com.showdownlab.optimizer.domain.PipelineCancelledException;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.StatFeature;
import com.showdownlab.optimizer.domain.StatWeights;
import com.showdownlab.optimizer.domain.TunedModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelValidatorTest {

    private final ModelValidator validator = new ModelValidator();
    private final List<HistoricalGame> validationGames = List.of(
            TestFixtures.historicalGame("v1", 1), TestFixtures.historicalGame("v2", 2));

    @Test
    void testValidate_RanksByValidationMae() {
        // Arrange
        TunedModel weak = model("weak", StatWeights.of(Map.of(StatFeature.REC_YDS, 0.05)), 4.0);
        TunedModel strong = model("strong", StatWeights.fantasyDefaults(), 2.0);
        List<String> warnings = new ArrayList<>();

        // Act
        List<TunedModel> ranked = validator.validate(List.of(weak, strong), validationGames, warnings,
                CancellationToken.NONE);

        // Assert
        assertEquals("strong", ranked.get(0).getName());
        assertEquals("weak", ranked.get(1).getName());
        assertTrue(ranked.get(0).getPerformance().getValidationMae()
                < ranked.get(1).getPerformance().getValidationMae());
        assertTrue(warnings.isEmpty());

        CalibrationReport calibration = ranked.get(0).getPerformance().getCalibration();
        assertEquals(CalibrationReport.SigmaSource.TRAINING_RESIDUALS, calibration.getSigmaSource());
        assertEquals(2.0, calibration.getPredictiveSigma());
        assertNotNull(calibration.getPitKsPValue());
    }

    @Test
    void testValidate_ZeroTrainingSpread_FallsBackToValidationResiduals() {
        TunedModel model = model("flat", StatWeights.fantasyDefaults(), 0.0);
        List<String> warnings = new ArrayList<>();

        List<TunedModel> ranked = validator.validate(List.of(model), validationGames, warnings, CancellationToken.NONE);

        CalibrationReport calibration = ranked.get(0).getPerformance().getCalibration();
        assertEquals(CalibrationReport.SigmaSource.VALIDATION_RESIDUALS, calibration.getSigmaSource());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).startsWith("flat"));
    }

    @Test
    void testValidate_NoPositiveActuals_LeftUnvalidated() {
        HistoricalGame empty = HistoricalGame.builder()
                .gameId("empty")
                .players(List.of(HistoricalPlayerRecord.builder()
                        .name("Bench").team("AAA").position(Position.WR).actualFantasyPoints(0.0).build()))
                .build();
        List<String> warnings = new ArrayList<>();

        List<TunedModel> ranked = validator.validate(
                List.of(model("m", StatWeights.fantasyDefaults(), 1.0)), List.of(empty), warnings,
                CancellationToken.NONE);

        assertNull(ranked.get(0).getPerformance().getValidationMae());
        assertEquals(1, warnings.size());
    }

    @Test
    void testValidate_DoesNotMutateInputModels() {
        TunedModel model = model("m", StatWeights.fantasyDefaults(), 1.0);

        validator.validate(List.of(model), validationGames, new ArrayList<>(), CancellationToken.NONE);

        assertNull(model.getPerformance().getValidationMae());
    }

    @Test
    void testValidate_Cancelled_Throws() {
        TunedModel model = model("m", StatWeights.fantasyDefaults(), 1.0);

        assertThrows(PipelineCancelledException.class,
                () -> validator.validate(List.of(model), validationGames, new ArrayList<>(), () -> true));
    }

    private static TunedModel model(String name, StatWeights weights, double trainingSpread) {
        return TunedModel.builder()
                .id(name)
                .name(name)
                .weights(weights)
                .performance(ModelPerformance.builder()
                        .trainingMae(1.0)
                        .trainingResidualStdDev(trainingSpread)
                        .trainingSampleSize(10)
                        .build())
                .build();
    }
}
