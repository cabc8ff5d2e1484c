package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.analysis.ModelDiscovery;
import com.showdownlab.optimizer.analysis.ModelValidator;
import com.showdownlab.optimizer.controller.dto.ModelDiscoveryRequest;
import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.InvalidLineupInputException;
import com.showdownlab.optimizer.domain.ProgressListener;
import com.showdownlab.optimizer.domain.StatWeights;
import com.showdownlab.optimizer.domain.TunedModel;
import com.showdownlab.optimizer.domain.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * One discovery cycle: load games, split them, fit candidates on the
 * training part, score them on the held-out part and save the results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelSimulationService {

    static final int MIN_GAMES = 4;
    static final int MIN_VALIDATION_GAMES = 2;

    private final HistoricalGameSource historicalGameSource;
    private final HistoricalGameVault historicalGameVault;
    private final Optional<HindsightWeightSource> hindsightWeightSource;
    private final ModelDiscovery modelDiscovery;
    private final ModelValidator modelValidator;
    private final ModelStore modelStore;
    private final OptimizerMetricsService metricsService;

    @Value("${showdown.discovery.top-k-ensemble:3}")
    private int defaultTopK;

    @Value("${showdown.discovery.train-split-percent:75}")
    private int defaultTrainSplitPercent;

    @Value("${showdown.discovery.shuffle-seed:1337}")
    private long shuffleSeed;

    @Value("${showdown.discovery.max-games:40}")
    private int defaultMaxGames;

    public ValidationReport runDiscoveryCycle(ModelDiscoveryRequest request, ProgressListener listener,
            CancellationToken token) {
        int gameCount = request.getGameCount() != null ? request.getGameCount() : defaultMaxGames;
        int splitPercent = request.getTrainSplitPercent() != null ? request.getTrainSplitPercent() : defaultTrainSplitPercent;
        int topK = request.getTopKEnsemble() != null ? request.getTopKEnsemble() : defaultTopK;

        List<String> warnings = new ArrayList<>();
        List<HistoricalGame> games = loadGames(gameCount, warnings, listener, token);

        if (games.size() < MIN_GAMES) {
            throw new InvalidLineupInputException("At least " + MIN_GAMES
                    + " historical games are required for discovery, found " + games.size());
        }

        List<HistoricalGame> shuffled = new ArrayList<>(games);
        Collections.shuffle(shuffled, new Random(shuffleSeed));
        int trainingSize = Math.max(1, (int) Math.round(shuffled.size() * splitPercent / 100.0));
        List<HistoricalGame> training = new ArrayList<>(shuffled.subList(0, Math.min(trainingSize, shuffled.size())));
        List<HistoricalGame> validation = new ArrayList<>(shuffled.subList(training.size(), shuffled.size()));

        if (validation.size() < MIN_VALIDATION_GAMES) {
            throw new InvalidLineupInputException("Validation set needs at least " + MIN_VALIDATION_GAMES
                    + " games, got " + validation.size() + " from a " + splitPercent + "% training split of "
                    + shuffled.size() + " games");
        }
        log.info("Split {} games into {} training and {} validation", shuffled.size(), training.size(),
                validation.size());

        token.throwIfCancelled("collecting hindsight weights");
        listener.report("Collecting hindsight weights", 35);
        List<StatWeights> hindsight = collectHindsightWeights(training, warnings);

        ModelDiscovery.DiscoveryResult discovered = modelDiscovery.discover(ModelDiscovery.DiscoveryConfig.builder()
                .trainingGames(training)
                .hindsightWeights(hindsight)
                .topK(topK)
                .listener(listener)
                .token(token)
                .build());
        warnings.addAll(discovered.getWarnings());
        metricsService.recordModelsDiscovered(discovered.getCandidates().size());

        listener.report("Validating " + discovered.getCandidates().size() + " candidate models", 80);
        List<TunedModel> ranked = modelValidator.validate(discovered.getCandidates(), validation, warnings, token);

        if (!Boolean.FALSE.equals(request.getSaveModels())) {
            token.throwIfCancelled("saving models");
            listener.report("Saving models", 95);
            ranked.forEach(modelStore::put);
        }

        listener.report("Discovery complete", 100);
        log.info("Discovery cycle finished with {} ranked models and {} warnings", ranked.size(), warnings.size());

        return ValidationReport.builder()
                .trainingSetSize(training.size())
                .validationSetSize(validation.size())
                .models(ranked)
                .warnings(warnings)
                .build();
    }

    /**
     * Read games through the vault, fetching and storing any it does not hold yet.
     */
    private List<HistoricalGame> loadGames(int limit, List<String> warnings, ProgressListener listener,
            CancellationToken token) {
        List<String> ids = historicalGameSource.catalog(limit);
        List<HistoricalGame> games = new ArrayList<>();

        for (int i = 0; i < ids.size(); i++) {
            String gameId = ids.get(i);
            token.throwIfCancelled("loading game " + gameId);

            HistoricalGame game = historicalGameVault.get(gameId);
            if (game == null) {
                try {
                    game = historicalGameVault.put(historicalGameSource.fetch(gameId));
                } catch (RuntimeException e) {
                    String warning = "Game " + gameId + " could not be loaded: " + e.getMessage();
                    log.warn(warning);
                    warnings.add(warning);
                    continue;
                }
            }
            games.add(game);
            listener.report("Loaded " + (i + 1) + " of " + ids.size() + " games", (i + 1) * 30 / ids.size());
        }
        return games;
    }

    private List<StatWeights> collectHindsightWeights(List<HistoricalGame> training, List<String> warnings) {
        List<StatWeights> weights = new ArrayList<>();
        if (hindsightWeightSource.isEmpty()) {
            return weights;
        }

        for (HistoricalGame game : training) {
            try {
                hindsightWeightSource.get().hindsightWeights(game).ifPresent(weights::add);
            } catch (RuntimeException e) {
                String warning = "Hindsight weights unavailable for game " + game.getGameId() + ": " + e.getMessage();
                log.warn(warning);
                warnings.add(warning);
            }
        }
        log.info("Collected hindsight weights for {} of {} training games", weights.size(), training.size());
        return weights;
    }
}
