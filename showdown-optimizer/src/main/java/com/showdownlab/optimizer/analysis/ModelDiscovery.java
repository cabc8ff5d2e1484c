package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.CalibrationMetrics;
import com.showdownlab.optimizer.domain.FeatureExtractor;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalPlayerRecord;
import com.showdownlab.optimizer.domain.ModelPerformance;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.ProgressListener;
import com.showdownlab.optimizer.domain.ScoringModel;
import com.showdownlab.optimizer.domain.StatFeature;
import com.showdownlab.optimizer.domain.StatWeights;
import com.showdownlab.optimizer.domain.TunedModel;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Fits candidate scoring models from training games.
 * <p>
 * Each regression candidate fits corrections to the FanDuel default weights
 * over its own feature set: the target is what the defaults fail to explain
 * and the fitted coefficients are added to the defaults. Features outside the
 * set keep their default weight. Rows are scaled by the player's matchup
 * multiplier so they share the scale of the prediction. When the data cannot
 * separate two features the minimum-norm solve leaves that direction at the
 * defaults.
 */
@Slf4j
public class ModelDiscovery {

    public static final String RAW_MODEL = "Master Quant Model (Regression-Based)";
    public static final String SABERMETRIC_MODEL = "Sabermetric Synthesis Model";
    public static final String CORRELATION_MODEL = "Correlation-Infused Quant Model";
    public static final String HINDSIGHT_MODEL = "Averaged Hindsight Model (AI-Based)";
    public static final String ENSEMBLE_MODEL_FORMAT = "Ensemble Super Model (Top %d)";

    // Kickers and defenses score outside the box-score stats
    private static final Set<Position> SKILL_POSITIONS = EnumSet.of(Position.RB, Position.WR, Position.TE);

    private static final List<RegressionCandidate> REGRESSION_CANDIDATES = List.of(
            new RegressionCandidate(RAW_MODEL,
                    "Linear regression of actual points on raw box-score stats",
                    StatFeature.inGroups(StatFeature.Group.RAW),
                    player -> true),
            new RegressionCandidate(SABERMETRIC_MODEL,
                    "Linear regression on advanced player, team and game-context metrics",
                    StatFeature.inGroups(StatFeature.Group.PLAYER_ADVANCED, StatFeature.Group.TEAM,
                            StatFeature.Group.GAME_CONTEXT),
                    player -> true),
            new RegressionCandidate(CORRELATION_MODEL,
                    "Linear regression of skill players on own stats plus quarterback and top-teammate stats",
                    StatFeature.inGroups(StatFeature.Group.RAW, StatFeature.Group.TEAMMATE),
                    player -> SKILL_POSITIONS.contains(player.getPosition())));

    private final RegressionFitter fitter;
    private final Clock clock;

    public ModelDiscovery(RegressionFitter fitter, Clock clock) {
        this.fitter = fitter;
        this.clock = clock;
    }

    public DiscoveryResult discover(DiscoveryConfig config) {
        List<HistoricalGame> training = config.getTrainingGames();
        ProgressListener listener = config.getListener() != null ? config.getListener() : ProgressListener.NONE;
        CancellationToken token = config.getToken() != null ? config.getToken() : CancellationToken.NONE;

        log.info("Starting model discovery - Training games: {}, Top K: {}", training.size(), config.getTopK());

        List<TunedModel> candidates = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        StatWeights base = StatWeights.fantasyDefaults();

        for (int i = 0; i < REGRESSION_CANDIDATES.size(); i++) {
            RegressionCandidate candidate = REGRESSION_CANDIDATES.get(i);
            token.throwIfCancelled("fitting " + candidate.name);
            listener.report("Fitting " + candidate.name, 40 + i * 10);

            RegressionFit fit = fitCandidate(candidate, training, base);
            if (!fit.isSuccessful()) {
                String warning = candidate.name + " skipped: " + fit.getFailureReason();
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            if (fit.isRankDeficient()) {
                String warning = candidate.name + " fitted on collinear data; unidentified weights kept at defaults";
                log.warn(warning);
                warnings.add(warning);
            }

            log.info("Fitted {} on {} rows", candidate.name, fit.getRowCount());
            candidates.add(newModel(candidate.name, candidate.description,
                    adjustedWeights(base, fit.getCoefficients()), training));
        }

        List<StatWeights> hindsight = config.getHindsightWeights();
        if (hindsight != null && !hindsight.isEmpty()) {
            candidates.add(newModel(HINDSIGHT_MODEL,
                    "Average of " + hindsight.size() + " externally sourced hindsight weight vectors",
                    StatWeights.average(hindsight), training));
        }

        if (candidates.size() > 1) {
            token.throwIfCancelled("building ensemble");
            listener.report("Blending top models into an ensemble", 70);
            candidates.add(buildEnsemble(candidates, Math.max(1, config.getTopK()), training));
        }

        log.info("Model discovery produced {} candidates with {} warnings", candidates.size(), warnings.size());
        return DiscoveryResult.builder()
                .candidates(candidates)
                .warnings(warnings)
                .build();
    }

    /**
     * Predicted and actual points for every player with a positive actual score.
     */
    public static double[][] predictionPairs(ScoringModel model, List<HistoricalGame> games) {
        List<double[]> pairs = new ArrayList<>();
        for (HistoricalGame game : games) {
            for (HistoricalPlayerRecord player : game.getPlayers()) {
                if (player.getActualFantasyPoints() > 0) {
                    pairs.add(new double[] { model.predict(player, game), player.getActualFantasyPoints() });
                }
            }
        }

        double[][] result = new double[2][pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            result[0][i] = pairs.get(i)[0];
            result[1][i] = pairs.get(i)[1];
        }
        return result;
    }

    private RegressionFit fitCandidate(RegressionCandidate candidate, List<HistoricalGame> training, StatWeights base) {
        ScoringModel baseModel = new ScoringModel(base);

        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (HistoricalGame game : training) {
            for (HistoricalPlayerRecord player : game.getPlayers()) {
                if (player.getActualFantasyPoints() <= 0 || !candidate.rowFilter.test(player)) {
                    continue;
                }
                double[] row = FeatureExtractor.vector(candidate.features, player, game);
                double multiplier = ScoringModel.matchupMultiplier(player);
                for (int i = 0; i < row.length; i++) {
                    row[i] *= multiplier;
                }
                if (!hasNonZero(row)) {
                    continue;
                }
                rows.add(row);
                targets.add(player.getActualFantasyPoints() - baseModel.predict(player, game));
            }
        }

        return fitter.fit(candidate.features, rows, targets);
    }

    private static StatWeights adjustedWeights(StatWeights base, Map<StatFeature, Double> corrections) {
        Map<StatFeature, Double> adjusted = new EnumMap<>(StatFeature.class);
        corrections.forEach((feature, delta) -> adjusted.put(feature, base.get(feature) + delta));
        return base.mergedWith(adjusted);
    }

    private TunedModel buildEnsemble(List<TunedModel> candidates, int topK, List<HistoricalGame> training) {
        List<TunedModel> best = candidates.stream()
                .sorted(Comparator.comparingDouble(m -> m.getPerformance().getTrainingMae()))
                .limit(topK)
                .collect(Collectors.toList());

        String members = best.stream().map(TunedModel::getName).collect(Collectors.joining(", "));
        StatWeights averaged = StatWeights.average(best.stream()
                .map(TunedModel::getWeights)
                .collect(Collectors.toList()));

        return newModel(String.format(Locale.ROOT, ENSEMBLE_MODEL_FORMAT, best.size()),
                "Average of the top " + best.size() + " models by training MAE: " + members,
                averaged, training);
    }

    private TunedModel newModel(String name, String description, StatWeights weights, List<HistoricalGame> training) {
        double[][] pairs = predictionPairs(new ScoringModel(weights), training);

        ModelPerformance performance = ModelPerformance.builder()
                .trainingMae(CalibrationMetrics.meanAbsoluteError(pairs[0], pairs[1]))
                .trainingResidualStdDev(CalibrationMetrics.residualStandardDeviation(pairs[0], pairs[1]))
                .trainingSampleSize(pairs[0].length)
                .build();

        return TunedModel.builder()
                .id(slug(name) + "-" + UUID.randomUUID().toString().substring(0, 8))
                .name(name)
                .weights(weights)
                .sourceDescription(description)
                .createdAt(LocalDateTime.now(clock))
                .performance(performance)
                .build();
    }

    private static boolean hasNonZero(double[] row) {
        for (double value : row) {
            if (value != 0.0) {
                return true;
            }
        }
        return false;
    }

    static String slug(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
    }

    private static final class RegressionCandidate {
        private final String name;
        private final String description;
        private final List<StatFeature> features;
        private final Predicate<HistoricalPlayerRecord> rowFilter;

        private RegressionCandidate(String name, String description, List<StatFeature> features,
                Predicate<HistoricalPlayerRecord> rowFilter) {
            this.name = name;
            this.description = description;
            this.features = features;
            this.rowFilter = rowFilter;
        }
    }

    /**
     * Inputs for one discovery run.
     */
    @Data
    @Builder
    public static class DiscoveryConfig {
        private List<HistoricalGame> trainingGames;
        private List<StatWeights> hindsightWeights;
        private int topK;
        private ProgressListener listener;
        private CancellationToken token;
    }

    /**
     * Candidates produced by one discovery run.
     */
    @Data
    @Builder
    public static class DiscoveryResult {
        private List<TunedModel> candidates;
        private List<String> warnings;
    }
}
