package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.domain.FantasyScoring;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalPlayerRecord;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.PregameContext;
import com.showdownlab.optimizer.domain.StatFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Default game source for demonstration and testing.
 * Generates deterministic box scores per game id: receivers feed off their
 * quarterback's passing, so the teammate features carry real signal.
 */
@Component
@Slf4j
public class SyntheticHistoricalGameSource implements HistoricalGameSource {

    static final String ID_PREFIX = "synthetic-";

    private static final String[] TEAMS = {
            "KC", "BUF", "PHI", "SF", "DAL", "MIA", "CIN", "BAL", "DET", "GB", "LAR", "SEA", "NYJ", "MIN", "JAX", "LAC"
    };

    private final long seed;

    public SyntheticHistoricalGameSource(@Value("${showdown.discovery.shuffle-seed:1337}") long seed) {
        this.seed = seed;
    }

    @Override
    public List<String> catalog(int limit) {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= limit; i++) {
            ids.add(String.format(Locale.ROOT, "%s%03d", ID_PREFIX, i));
        }
        return ids;
    }

    @Override
    public HistoricalGame fetch(String gameId) {
        if (gameId == null || !gameId.startsWith(ID_PREFIX)) {
            throw new IllegalArgumentException("Unknown synthetic game id: " + gameId);
        }

        Random random = new Random(seed * 31 + gameId.hashCode());
        int home = random.nextInt(TEAMS.length);
        int away = (home + 1 + random.nextInt(TEAMS.length - 1)) % TEAMS.length;
        String homeTeam = TEAMS[home];
        String awayTeam = TEAMS[away];

        List<HistoricalPlayerRecord> players = new ArrayList<>();
        players.addAll(generateTeam(homeTeam, random));
        players.addAll(generateTeam(awayTeam, random));

        Map<String, Map<StatFeature, Double>> teamMetrics = new HashMap<>();
        teamMetrics.put(homeTeam, generateTeamMetrics(random));
        teamMetrics.put(awayTeam, generateTeamMetrics(random));

        Map<StatFeature, Double> gameFactors = new HashMap<>();
        gameFactors.put(StatFeature.STRENGTH_OF_SCHEDULE, round(0.4 + random.nextDouble() * 0.2));
        gameFactors.put(StatFeature.WEATHER_FACTOR, round(0.8 + random.nextDouble() * 0.2));
        gameFactors.put(StatFeature.HOME_FIELD_ADVANTAGE, 1.0);

        double spread = Math.round(random.nextGaussian() * 6.0 * 2) / 2.0;
        PregameContext context = PregameContext.builder()
                .vegasLine(String.format(Locale.ROOT, "%s %+.1f", homeTeam, spread))
                .teamMetrics(teamMetrics)
                .gameFactors(gameFactors)
                .build();

        log.debug("Generated synthetic game {}: {} vs {}", gameId, awayTeam, homeTeam);
        return HistoricalGame.builder()
                .gameId(gameId)
                .description(awayTeam + " @ " + homeTeam)
                .pregameContext(context)
                .players(players)
                .build();
    }

    private List<HistoricalPlayerRecord> generateTeam(String team, Random random) {
        List<HistoricalPlayerRecord> players = new ArrayList<>();

        double passYds = Math.max(90.0, 245.0 + random.nextGaussian() * 60.0);
        double passTds = Math.max(0, Math.round(passYds / 120.0 + random.nextGaussian() * 0.8));
        Map<StatFeature, Double> qb = new HashMap<>();
        qb.put(StatFeature.PASS_YDS, Math.rint(passYds));
        qb.put(StatFeature.PASS_TDS, passTds);
        qb.put(StatFeature.INTERCEPTIONS, (double) (random.nextDouble() < 0.4 ? 1 : 0));
        qb.put(StatFeature.RUSH_YDS, Math.rint(Math.max(0.0, 15.0 + random.nextGaussian() * 12.0)));
        players.add(record(team + " QB", team, Position.QB, qb, random));

        // Receiving share of the passing yards, WR1 first
        double[] shares = { 0.32, 0.22, 0.14, 0.17, 0.08, 0.07 };
        Position[] receivers = { Position.WR, Position.WR, Position.WR, Position.TE, Position.RB, Position.RB };
        String[] labels = { "WR1", "WR2", "WR3", "TE", "RB1", "RB2" };
        double tdsLeft = passTds;

        for (int i = 0; i < receivers.length; i++) {
            Map<StatFeature, Double> stats = new HashMap<>();
            double recYds = Math.max(0.0, passYds * shares[i] * (0.7 + random.nextDouble() * 0.6));
            stats.put(StatFeature.REC_YDS, Math.rint(recYds));
            stats.put(StatFeature.RECEPTIONS, (double) Math.round(recYds / 11.0));
            double recTds = tdsLeft > 0 && random.nextDouble() < shares[i] * 2.5 ? 1.0 : 0.0;
            tdsLeft -= recTds;
            stats.put(StatFeature.REC_TDS, recTds);

            if (receivers[i] == Position.RB) {
                double rushYds = Math.max(0.0, (i == 4 ? 70.0 : 30.0) + random.nextGaussian() * 25.0);
                stats.put(StatFeature.RUSH_YDS, Math.rint(rushYds));
                stats.put(StatFeature.RUSH_TDS, random.nextDouble() < rushYds / 150.0 ? 1.0 : 0.0);
                stats.put(StatFeature.FUMBLES_LOST, random.nextDouble() < 0.05 ? 1.0 : 0.0);
            }
            players.add(record(team + " " + labels[i], team, receivers[i], stats, random));
        }

        players.add(record(team + " K", team, Position.K, new HashMap<>(), random));
        players.add(record(team + " DST", team, Position.DST, new HashMap<>(), random));
        return players;
    }

    private HistoricalPlayerRecord record(String name, String team, Position position,
            Map<StatFeature, Double> stats, Random random) {
        double points = FantasyScoring.actualPoints(stats);

        // Kickers and defenses score outside the box-score features
        if (position == Position.K) {
            points = 3.0 + random.nextInt(12);
        } else if (position == Position.DST) {
            points = Math.max(0, 2.0 + random.nextInt(12) - 3);
        } else {
            points = Math.max(0.0, points + random.nextGaussian() * 0.5);
        }

        int salary = (int) Math.round((4000 + points * 450 + random.nextGaussian() * 800) / 100.0) * 100;
        salary = Math.max(1000, Math.min(15000, salary));

        return HistoricalPlayerRecord.builder()
                .name(name)
                .team(team)
                .position(position)
                .stats(stats)
                .advancedStats(generateAdvancedStats(position, stats, random))
                .actualFantasyPoints(Math.round(points * 100.0) / 100.0)
                .salary(salary)
                .build();
    }

    private Map<StatFeature, Double> generateAdvancedStats(Position position, Map<StatFeature, Double> stats,
            Random random) {
        Map<StatFeature, Double> advanced = new HashMap<>();
        double recYds = stats.getOrDefault(StatFeature.REC_YDS, 0.0);
        double rushYds = stats.getOrDefault(StatFeature.RUSH_YDS, 0.0);

        switch (position) {
            case QB -> {
                advanced.put(StatFeature.TIME_TO_THROW, round(2.4 + random.nextDouble() * 0.6));
                advanced.put(StatFeature.CLEAN_POCKET_COMPLETION_RATE, round(0.65 + random.nextDouble() * 0.15));
                advanced.put(StatFeature.UNDER_PRESSURE_COMPLETION_RATE, round(0.40 + random.nextDouble() * 0.15));
                advanced.put(StatFeature.DEEP_BALL_COMPLETION_RATE, round(0.30 + random.nextDouble() * 0.15));
                advanced.put(StatFeature.PLAY_ACTION_PASS_RATE, round(0.15 + random.nextDouble() * 0.15));
                advanced.put(StatFeature.AIR_YARDS, Math.rint(stats.getOrDefault(StatFeature.PASS_YDS, 0.0) * 0.55));
            }
            case WR, TE, RB -> {
                advanced.put(StatFeature.TARGET_SHARE, round(Math.min(0.4, recYds / 400.0 + random.nextDouble() * 0.03)));
                advanced.put(StatFeature.AIR_YARDS, Math.rint(recYds * (0.6 + random.nextDouble() * 0.6)));
                advanced.put(StatFeature.YARDS_AFTER_CATCH, Math.rint(recYds * (0.3 + random.nextDouble() * 0.2)));
                advanced.put(StatFeature.ROUTES_RUN, Math.rint(15 + random.nextDouble() * 25));
                advanced.put(StatFeature.YARDS_PER_ROUTE_RUN, round(recYds / 30.0));
                advanced.put(StatFeature.AVERAGE_DEPTH_OF_TARGET, round(4.0 + random.nextDouble() * 10.0));
                advanced.put(StatFeature.RED_ZONE_TOUCHES, (double) random.nextInt(4));
                if (position == Position.RB) {
                    advanced.put(StatFeature.RUSH_ATTEMPT_SHARE, round(Math.min(0.8, rushYds / 120.0)));
                    advanced.put(StatFeature.AVOIDED_TACKLES, (double) random.nextInt(6));
                    advanced.put(StatFeature.YARDS_CREATED_PER_TOUCH, round(1.5 + random.nextDouble() * 2.0));
                }
            }
            default -> {
                // K and DST carry no advanced metrics
            }
        }
        return advanced;
    }

    private Map<StatFeature, Double> generateTeamMetrics(Random random) {
        Map<StatFeature, Double> metrics = new HashMap<>();
        metrics.put(StatFeature.OFFENSIVE_LINE_RANK, (double) (1 + random.nextInt(32)));
        metrics.put(StatFeature.DEFENSIVE_LINE_RANK, (double) (1 + random.nextInt(32)));
        metrics.put(StatFeature.SECONDARY_COVERAGE_RANK, (double) (1 + random.nextInt(32)));
        metrics.put(StatFeature.PASS_RUSH_WIN_RATE, round(0.35 + random.nextDouble() * 0.2));
        metrics.put(StatFeature.RUN_STOP_WIN_RATE, round(0.25 + random.nextDouble() * 0.15));
        metrics.put(StatFeature.PLAYS_PER_GAME, Math.rint(58 + random.nextDouble() * 12));
        metrics.put(StatFeature.NEUTRAL_SITUATION_PACE, round(27 + random.nextDouble() * 5));
        metrics.put(StatFeature.NEUTRAL_SITUATION_PASS_RATE, round(0.5 + random.nextDouble() * 0.15));
        metrics.put(StatFeature.COACHING_AGGRESSIVENESS, round(random.nextDouble()));
        metrics.put(StatFeature.TURNOVER_DIFFERENTIAL, (double) (random.nextInt(21) - 10));
        return metrics;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
