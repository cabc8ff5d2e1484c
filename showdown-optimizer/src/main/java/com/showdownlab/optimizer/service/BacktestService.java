package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.analysis.BacktestRunner;
import com.showdownlab.optimizer.controller.dto.BacktestRequest;
import com.showdownlab.optimizer.domain.BacktestReport;
import com.showdownlab.optimizer.domain.BacktestSettings;
import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.ProgressListener;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Runs a backtest over every game in the vault.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestService {

    private final BacktestRunner backtestRunner;
    private final HistoricalGameVault historicalGameVault;
    private final OptimizerMetricsService metricsService;

    @Value("${showdown.scoring.salary-cap:60000}")
    private int defaultSalaryCap;

    @Value("${showdown.scoring.roster-size:5}")
    private int defaultRosterSize;

    @Value("${showdown.scoring.captain-multiplier:1.5}")
    private double defaultCaptainMultiplier;

    public BacktestReport runBacktest(BacktestRequest request, ProgressListener listener, CancellationToken token) {
        BacktestSettings settings = toSettings(request);
        List<HistoricalGame> games = historicalGameVault.findAll();
        log.info("Backtesting {} cached games with {} lineups each", games.size(), settings.getLineupCount());

        if (games.isEmpty()) {
            log.warn("No historical games in the vault; run a model discovery first to populate it");
        }

        BacktestReport report = backtestRunner.run(games, settings, listener, token);
        metricsService.recordGamesSkipped(report.getGamesSkipped());
        return report;
    }

    BacktestSettings toSettings(BacktestRequest request) {
        Map<Position, Integer> caps = new EnumMap<>(Position.class);
        if (request.getMaxPerPosition() != null) {
            caps.putAll(request.getMaxPerPosition());
        }

        boolean stack = Boolean.TRUE.equals(request.getRequireCaptainStack());
        boolean bringBack = Boolean.TRUE.equals(request.getRequireOpponentBringBack());

        // Reuse the preset rules defined on constraint sets
        if (request.getPreset() != null) {
            RosterConstraintSet resolved = request.getPreset().applyTo(RosterConstraintSet.builder()
                    .maxPerPosition(caps)
                    .requireCaptainStack(stack)
                    .requireOpponentBringBack(bringBack)
                    .build());
            caps = resolved.getMaxPerPosition();
            stack = request.getRequireCaptainStack() != null ? stack : resolved.isRequireCaptainStack();
            bringBack = request.getRequireOpponentBringBack() != null ? bringBack : resolved.isRequireOpponentBringBack();
        }

        return BacktestSettings.builder()
                .salaryCap(request.getSalaryCap() != null ? request.getSalaryCap() : defaultSalaryCap)
                .rosterSize(request.getRosterSize() != null ? request.getRosterSize() : defaultRosterSize)
                .captainMultiplier(defaultCaptainMultiplier)
                .maxPerPosition(caps)
                .lockedPlayerNames(request.getLockedPlayerNames() != null
                        ? new LinkedHashSet<>(request.getLockedPlayerNames()) : new LinkedHashSet<>())
                .excludedPlayerNames(request.getExcludedPlayerNames() != null
                        ? new LinkedHashSet<>(request.getExcludedPlayerNames()) : new LinkedHashSet<>())
                .requireCaptainStack(stack)
                .requireOpponentBringBack(bringBack)
                .maxExposure(request.getMaxExposure())
                .lineupCount(request.getLineupCount() != null ? request.getLineupCount() : 1)
                .build();
    }
}
