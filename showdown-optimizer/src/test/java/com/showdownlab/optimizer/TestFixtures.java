package com.showdownlab.optimizer;

import com.showdownlab.optimizer.domain.FantasyScoring;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalPlayerRecord;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.StatFeature;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Shared slates and historical games for tests.
 */
public final class TestFixtures {

    public static final int SALARY_CAP = 60000;

    private TestFixtures() {
    }

    /**
     * Ten-player KC vs BUF slate. The five most expensive players cost 69,000,
     * so the cap binds.
     */
    public static List<Player> showdownPool() {
        List<Player> pool = new ArrayList<>();
        pool.add(player("kc_qb", "KC", "BUF", Position.QB, 15000, 20.0, 34.0, 30.0, 18.0));
        pool.add(player("kc_wr1", "KC", "BUF", Position.WR, 13500, 16.0, 30.0, 35.0, 12.0));
        pool.add(player("kc_te", "KC", "BUF", Position.TE, 12000, 12.0, 22.0, 25.0, 8.0));
        pool.add(player("kc_rb", "KC", "BUF", Position.RB, 11000, 11.0, 19.0, 20.0, 6.0));
        pool.add(player("kc_k", "KC", "BUF", Position.K, 8500, 7.0, 11.0, 40.0, 2.0));
        pool.add(player("buf_qb", "BUF", "KC", Position.QB, 15500, 21.0, 36.0, 32.0, 20.0));
        pool.add(player("buf_wr1", "BUF", "KC", Position.WR, 13000, 15.0, 28.0, 30.0, 10.0));
        pool.add(player("buf_rb", "BUF", "KC", Position.RB, 11500, 12.0, 21.0, 22.0, 7.0));
        pool.add(player("buf_wr2", "BUF", "KC", Position.WR, 9000, 9.0, 18.0, 15.0, 4.0));
        pool.add(player("buf_dst", "BUF", "KC", Position.DST, 8000, 6.0, 14.0, 18.0, 3.0));
        return pool;
    }

    public static Player player(String id, String team, String opponent, Position position, int salary,
            double mean, double ceiling, double ownershipFlex, double ownershipCaptain) {
        return Player.builder()
                .id(id)
                .name(id)
                .team(team)
                .opponent(opponent)
                .position(position)
                .salary(salary)
                .meanScore(mean)
                .ceilingScore(ceiling)
                .ownershipFlex(ownershipFlex)
                .ownershipCaptain(ownershipCaptain)
                .build();
    }

    public static RosterConstraintSet defaultConstraints() {
        return RosterConstraintSet.builder()
                .salaryCap(SALARY_CAP)
                .build();
    }

    public static Player byId(List<Player> pool, String id) {
        return pool.stream().filter(p -> p.getId().equals(id)).findFirst().orElseThrow();
    }

    /**
     * Historical game with two teams of QB, WR, WR, TE, RB, K and DST whose
     * actual points equal fantasy scoring of their box score. Salaries follow points.
     */
    public static HistoricalGame historicalGame(String gameId, long seed) {
        Random random = new Random(seed);
        List<HistoricalPlayerRecord> players = new ArrayList<>();
        for (String team : List.of("AAA", "BBB")) {
            double passYds = 180 + random.nextInt(160);
            players.add(record(team + " QB", team, Position.QB, Map.of(
                    StatFeature.PASS_YDS, passYds,
                    StatFeature.PASS_TDS, (double) random.nextInt(4),
                    StatFeature.INTERCEPTIONS, (double) random.nextInt(2),
                    StatFeature.RUSH_YDS, (double) random.nextInt(40))));
            players.add(record(team + " WR1", team, Position.WR, receiver(passYds * 0.35, random)));
            players.add(record(team + " WR2", team, Position.WR, receiver(passYds * 0.25, random)));
            players.add(record(team + " TE", team, Position.TE, receiver(passYds * 0.15, random)));
            Map<StatFeature, Double> rb = receiver(passYds * 0.1, random);
            rb.put(StatFeature.RUSH_YDS, 40.0 + random.nextInt(80));
            rb.put(StatFeature.RUSH_TDS, (double) random.nextInt(2));
            players.add(record(team + " RB", team, Position.RB, rb));
            players.add(fixedRecord(team + " K", team, Position.K, 4.0 + random.nextInt(10)));
            players.add(fixedRecord(team + " DST", team, Position.DST, 1.0 + random.nextInt(10)));
        }
        return HistoricalGame.builder()
                .gameId(gameId)
                .description("AAA @ BBB")
                .players(players)
                .build();
    }

    private static Map<StatFeature, Double> receiver(double recYds, Random random) {
        Map<StatFeature, Double> stats = new HashMap<>();
        double yards = Math.rint(recYds * (0.6 + random.nextDouble() * 0.8));
        stats.put(StatFeature.REC_YDS, yards);
        stats.put(StatFeature.RECEPTIONS, (double) Math.max(1, Math.round(yards / 12.0)));
        stats.put(StatFeature.REC_TDS, (double) random.nextInt(2));
        return stats;
    }

    private static HistoricalPlayerRecord record(String name, String team, Position position,
            Map<StatFeature, Double> stats) {
        double points = FantasyScoring.actualPoints(stats);
        return HistoricalPlayerRecord.builder()
                .name(name)
                .team(team)
                .position(position)
                .stats(new HashMap<>(stats))
                .actualFantasyPoints(points)
                .salary(4000 + (int) Math.round(points) * 300)
                .build();
    }

    private static HistoricalPlayerRecord fixedRecord(String name, String team, Position position, double points) {
        return HistoricalPlayerRecord.builder()
                .name(name)
                .team(team)
                .position(position)
                .actualFantasyPoints(points)
                .salary(4000 + (int) Math.round(points) * 300)
                .build();
    }
}
