package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.controller.dto.EvaluatedLineup;
import com.showdownlab.optimizer.controller.dto.LineupRequest;
import com.showdownlab.optimizer.controller.dto.LineupResponse;
import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupEvaluator;
import com.showdownlab.optimizer.domain.LineupInputValidator;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.RunManifest;
import com.showdownlab.optimizer.domain.ScoringMode;
import com.showdownlab.optimizer.domain.ScoringModel;
import com.showdownlab.optimizer.domain.TunedModel;
import com.showdownlab.optimizer.solver.LineupGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synchronous lineup optimization: resolves constraints, optionally
 * re-projects players with a saved model, generates unique lineups and
 * scores them with the evaluator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LineupOptimizationService {

    private final LineupGenerator lineupGenerator;
    private final LineupEvaluator lineupEvaluator;
    private final ModelStore modelStore;
    private final OptimizerMetricsService metricsService;
    private final Clock clock;

    @Value("${showdown.scoring.salary-cap:60000}")
    private int defaultSalaryCap;

    @Value("${showdown.scoring.roster-size:5}")
    private int defaultRosterSize;

    @Value("${showdown.scoring.captain-multiplier:1.5}")
    private double defaultCaptainMultiplier;

    public LineupResponse optimize(LineupRequest request) {
        ScoringMode mode = request.getScoringMode() != null ? request.getScoringMode() : ScoringMode.MEAN;
        int count = request.getLineupCount();
        log.info("Optimizing {} lineups in {} mode over {} players", count, mode,
                request.getPlayers() != null ? request.getPlayers().size() : 0);

        List<Player> pool = request.getPlayers();
        RosterConstraintSet constraints = buildConstraints(request);
        LineupInputValidator.validate(pool, constraints);

        if (request.getModelId() != null) {
            TunedModel model = modelStore.get(request.getModelId())
                    .orElseThrow(() -> new ModelNotFoundException(request.getModelId()));
            pool = applyModel(pool, model);
        }

        long startTime = System.currentTimeMillis();
        List<Lineup> lineups = lineupGenerator.generate(pool, constraints, count, mode);
        long durationMs = System.currentTimeMillis() - startTime;
        metricsService.recordGeneration(count, lineups.size(), durationMs);

        List<EvaluatedLineup> evaluated = new ArrayList<>();
        for (int i = 0; i < lineups.size(); i++) {
            Lineup lineup = lineups.get(i);
            evaluated.add(EvaluatedLineup.builder()
                    .rank(i + 1)
                    .signature(lineup.getSignature().toString())
                    .lineup(lineup)
                    .metrics(lineupEvaluator.evaluate(lineup))
                    .build());
        }

        if (lineups.size() < count) {
            log.warn("Only {} of {} requested lineups were feasible", lineups.size(), count);
        }
        log.info("Generated {} lineups in {}ms", lineups.size(), durationMs);

        return LineupResponse.builder()
                .requestedCount(count)
                .generatedCount(lineups.size())
                .exhausted(lineups.size() < count)
                .lineups(evaluated)
                .manifest(RunManifest.describe(pool, constraints, mode, count, request.getModelId(),
                        LocalDateTime.now(clock)))
                .build();
    }

    /**
     * Resolve the request into a constraint set. Explicit request fields win,
     * then the preset, then configured defaults.
     */
    RosterConstraintSet buildConstraints(LineupRequest request) {
        Map<Position, Integer> caps = new EnumMap<>(Position.class);
        if (request.getMaxPerPosition() != null) {
            caps.putAll(request.getMaxPerPosition());
        }

        RosterConstraintSet constraints = RosterConstraintSet.builder()
                .salaryCap(request.getSalaryCap() != null ? request.getSalaryCap() : defaultSalaryCap)
                .rosterSize(request.getRosterSize() != null ? request.getRosterSize() : defaultRosterSize)
                .captainMultiplier(request.getCaptainMultiplier() != null
                        ? request.getCaptainMultiplier() : defaultCaptainMultiplier)
                .maxPerPosition(caps)
                .lockedPlayerIds(copyOf(request.getLockedPlayerIds()))
                .excludedPlayerIds(copyOf(request.getExcludedPlayerIds()))
                .requireCaptainStack(Boolean.TRUE.equals(request.getRequireCaptainStack()))
                .requireOpponentBringBack(Boolean.TRUE.equals(request.getRequireOpponentBringBack()))
                .maxExposure(request.getMaxExposure())
                .build();

        if (request.getPreset() == null) {
            return constraints;
        }

        RosterConstraintSet withPreset = request.getPreset().applyTo(constraints);
        return withPreset.toBuilder()
                .requireCaptainStack(request.getRequireCaptainStack() != null
                        ? request.getRequireCaptainStack() : withPreset.isRequireCaptainStack())
                .requireOpponentBringBack(request.getRequireOpponentBringBack() != null
                        ? request.getRequireOpponentBringBack() : withPreset.isRequireOpponentBringBack())
                .build();
    }

    /**
     * Recompute projections from stat lines for players that carry them.
     */
    static List<Player> applyModel(List<Player> pool, TunedModel model) {
        ScoringModel scoring = model.scoringModel();
        List<Player> projected = new ArrayList<>();
        int updated = 0;

        for (Player player : pool) {
            if (player.getMeanStatProjection() == null && player.getCeilingStatProjection() == null) {
                projected.add(player);
                continue;
            }

            Player.PlayerBuilder builder = player.toBuilder();
            if (player.getMeanStatProjection() != null) {
                builder.meanScore(scoring.project(player.getMeanStatProjection()));
            }
            if (player.getCeilingStatProjection() != null) {
                builder.ceilingScore(scoring.project(player.getCeilingStatProjection()));
            }
            projected.add(builder.build());
            updated++;
        }

        log.info("Re-projected {} of {} players with model {}", updated, pool.size(), model.getId());
        return projected;
    }

    private static LinkedHashSet<String> copyOf(Set<String> ids) {
        return ids != null ? new LinkedHashSet<>(ids) : new LinkedHashSet<>();
    }
}
