package com.showdownlab.optimizer.analysis;

import com.showdownlab.optimizer.domain.BacktestReport;
import com.showdownlab.optimizer.domain.BacktestSettings;
import com.showdownlab.optimizer.domain.CancellationToken;
import com.showdownlab.optimizer.domain.GameBacktestResult;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalPlayerRecord;
import com.showdownlab.optimizer.domain.InvalidLineupInputException;
import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupInputValidator;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.PlayerExposure;
import com.showdownlab.optimizer.domain.ProgressListener;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.ScoredLineup;
import com.showdownlab.optimizer.domain.ScoringMode;
import com.showdownlab.optimizer.solver.LineupGenerator;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Replays lineup generation against finished games, using actual points as
 * perfect-hindsight projections, and scores the lineups with the real outcome.
 * Games run in parallel, one task per game with its own pool.
 */
@Slf4j
public class BacktestRunner {

    private static final double CEILING_FACTOR = 1.5;

    private final LineupGenerator generator;
    private final ExecutorService executor;
    private final int minPoolSize;

    public BacktestRunner(LineupGenerator generator, ExecutorService executor, int minPoolSize) {
        this.generator = generator;
        this.executor = executor;
        this.minPoolSize = minPoolSize;
    }

    public BacktestReport run(List<HistoricalGame> games, BacktestSettings settings,
            ProgressListener listener, CancellationToken token) {
        validateSettings(settings);
        log.info("Starting backtest - Games: {}, Lineups per game: {}", games.size(), settings.getLineupCount());

        AtomicInteger finished = new AtomicInteger();
        List<Future<GameOutcome>> futures = new ArrayList<>();
        for (HistoricalGame game : games) {
            futures.add(executor.submit(() -> {
                GameOutcome outcome = runGame(game, settings, token);
                reportProgress(listener, finished.incrementAndGet(), games.size());
                return outcome;
            }));
        }

        List<GameBacktestResult> results = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int skipped = 0;
        boolean cancelled = false;

        for (int i = 0; i < futures.size(); i++) {
            GameOutcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                warnings.add("Backtest interrupted after " + results.size() + " games");
                cancelled = true;
                break;
            } catch (ExecutionException e) {
                String gameId = games.get(i).getGameId();
                log.warn("Game {} failed: {}", gameId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                warnings.add("Game " + gameId + " failed: " + e.getCause());
                skipped++;
                continue;
            }

            if (outcome.isCancelled()) {
                cancelled = true;
            } else if (outcome.getSkipReason() != null) {
                warnings.add(outcome.getSkipReason());
                skipped++;
            } else {
                results.add(outcome.getResult());
            }
        }

        BacktestReport report = aggregate(results, warnings, skipped, cancelled);
        log.info("Backtest finished - Processed: {}, Skipped: {}, Average top score: {}",
                report.getGamesProcessed(), report.getGamesSkipped(),
                String.format("%.2f", report.getAverageTopScore()));
        return report;
    }

    /**
     * A failing listener must not turn a scored game into a skipped one.
     */
    private static void reportProgress(ProgressListener listener, int done, int total) {
        try {
            listener.report("Backtested " + done + " of " + total + " games", done * 100 / total);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed after {} of {} games: {}", done, total, e.getMessage());
        }
    }

    /**
     * Synthetic pool for a game: players with a salary, actual points as the
     * mean projection and 1.5x actual as the ceiling.
     */
    public static List<Player> reconstructPool(HistoricalGame game) {
        List<Player> pool = new ArrayList<>();
        for (HistoricalPlayerRecord record : game.getPlayers()) {
            if (record.getSalary() == null || record.getSalary() <= 0 || record.getPosition() == null
                    || record.getName() == null || record.getTeam() == null) {
                continue;
            }

            pool.add(Player.builder()
                    .id(playerId(game.getGameId(), record.getName()))
                    .name(record.getName())
                    .team(record.getTeam())
                    .opponent(game.opponentOf(record.getTeam()))
                    .position(record.getPosition())
                    .salary(record.getSalary())
                    .meanScore(record.getActualFantasyPoints())
                    .ceilingScore(record.getActualFantasyPoints() * CEILING_FACTOR)
                    .ownershipFlex(0.0)
                    .ownershipCaptain(0.0)
                    .build());
        }
        return pool;
    }

    static String playerId(String gameId, String name) {
        return gameId + "_" + name.replaceAll("\\s+", "");
    }

    private GameOutcome runGame(HistoricalGame game, BacktestSettings settings, CancellationToken token) {
        if (token.isCancellationRequested()) {
            return GameOutcome.builder().cancelled(true).build();
        }

        try {
            List<Player> pool = reconstructPool(game);
            if (pool.size() < Math.max(minPoolSize, settings.getRosterSize())) {
                return skip("Game " + game.getGameId() + " skipped: only " + pool.size()
                        + " players with salary data");
            }

            RosterConstraintSet constraints = constraintsFor(pool, settings);
            LineupInputValidator.validate(pool, constraints);

            List<Lineup> lineups = generator.generate(pool, constraints, settings.getLineupCount(), ScoringMode.MEAN);

            Map<String, Double> actualById = pool.stream()
                    .collect(Collectors.toMap(Player::getId, Player::getMeanScore));
            List<ScoredLineup> scored = lineups.stream()
                    .map(lineup -> score(lineup, actualById))
                    .collect(Collectors.toList());
            double topScore = scored.stream().mapToDouble(ScoredLineup::getActualScore).max().orElse(0.0);

            return GameOutcome.builder()
                    .result(GameBacktestResult.builder()
                            .gameId(game.getGameId())
                            .description(game.getDescription())
                            .poolSize(pool.size())
                            .lineups(scored)
                            .topScore(topScore)
                            .build())
                    .build();
        } catch (RuntimeException e) {
            log.warn("Game {} failed during backtest: {}", game.getGameId(), e.getMessage());
            return skip("Game " + game.getGameId() + " failed: " + e.getMessage());
        }
    }

    private RosterConstraintSet constraintsFor(List<Player> pool, BacktestSettings settings) {
        Set<String> locked = idsForNames(pool, settings.getLockedPlayerNames());
        Set<String> excluded = idsForNames(pool, settings.getExcludedPlayerNames());

        return RosterConstraintSet.builder()
                .salaryCap(settings.getSalaryCap())
                .rosterSize(settings.getRosterSize())
                .captainMultiplier(settings.getCaptainMultiplier())
                .maxPerPosition(settings.getMaxPerPosition())
                .lockedPlayerIds(locked)
                .excludedPlayerIds(excluded)
                .requireCaptainStack(settings.isRequireCaptainStack())
                .requireOpponentBringBack(settings.isRequireOpponentBringBack())
                .maxExposure(settings.getMaxExposure())
                .build();
    }

    private static Set<String> idsForNames(List<Player> pool, Set<String> names) {
        Set<String> ids = new LinkedHashSet<>();
        if (names == null || names.isEmpty()) {
            return ids;
        }
        for (Player player : pool) {
            if (names.contains(player.getName())) {
                ids.add(player.getId());
            }
        }
        return ids;
    }

    private static ScoredLineup score(Lineup lineup, Map<String, Double> actualById) {
        double actual = actualById.get(lineup.getCaptain().getId()) * lineup.getCaptainMultiplier();
        for (Player player : lineup.getOthers()) {
            actual += actualById.get(player.getId());
        }

        return ScoredLineup.builder()
                .captainName(lineup.getCaptain().getName())
                .otherNames(lineup.getOthers().stream().map(Player::getName).collect(Collectors.toList()))
                .totalSalary(lineup.getTotalSalary())
                .projectedScore(lineup.getTotalMeanScore())
                .actualScore(actual)
                .build();
    }

    private static BacktestReport aggregate(List<GameBacktestResult> results, List<String> warnings,
            int skipped, boolean cancelled) {
        Map<String, Integer> counts = new HashMap<>();
        int totalLineups = 0;
        for (GameBacktestResult result : results) {
            for (ScoredLineup lineup : result.getLineups()) {
                totalLineups++;
                counts.merge(lineup.getCaptainName(), 1, Integer::sum);
                for (String name : lineup.getOtherNames()) {
                    counts.merge(name, 1, Integer::sum);
                }
            }
        }

        final int lineupTotal = totalLineups;
        List<PlayerExposure> exposures = counts.entrySet().stream()
                .map(e -> PlayerExposure.builder()
                        .playerName(e.getKey())
                        .count(e.getValue())
                        .percentage(lineupTotal == 0 ? 0.0 : 100.0 * e.getValue() / lineupTotal)
                        .build())
                .sorted(Comparator.comparingInt(PlayerExposure::getCount).reversed()
                        .thenComparing(PlayerExposure::getPlayerName))
                .collect(Collectors.toList());

        double average = results.stream().mapToDouble(GameBacktestResult::getTopScore).average().orElse(0.0);

        return BacktestReport.builder()
                .gamesProcessed(results.size())
                .gamesSkipped(skipped)
                .totalLineups(totalLineups)
                .averageTopScore(average)
                .gameResults(results)
                .exposures(exposures)
                .warnings(warnings)
                .cancelled(cancelled)
                .build();
    }

    private static void validateSettings(BacktestSettings settings) {
        if (settings == null) {
            throw new InvalidLineupInputException("Backtest settings are required");
        }
        if (settings.getLineupCount() <= 0) {
            throw new InvalidLineupInputException("Lineup count must be positive");
        }
        if (settings.getLockedPlayerNames() == null || settings.getExcludedPlayerNames() == null) {
            throw new InvalidLineupInputException("Lock and exclusion name sets must not be null");
        }

        // Name-level checks here; id-level rules run per game
        LineupInputValidator.validateConstraints(RosterConstraintSet.builder()
                .salaryCap(settings.getSalaryCap())
                .rosterSize(settings.getRosterSize())
                .captainMultiplier(settings.getCaptainMultiplier())
                .maxPerPosition(settings.getMaxPerPosition())
                .lockedPlayerIds(settings.getLockedPlayerNames())
                .excludedPlayerIds(settings.getExcludedPlayerNames())
                .maxExposure(settings.getMaxExposure())
                .build());
    }

    @Data
    @Builder
    private static class GameOutcome {
        private GameBacktestResult result;
        private String skipReason;
        private boolean cancelled;
    }

    private static GameOutcome skip(String reason) {
        log.warn(reason);
        return GameOutcome.builder().skipReason(reason).build();
    }
}
