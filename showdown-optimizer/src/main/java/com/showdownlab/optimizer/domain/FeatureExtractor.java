package com.showdownlab.optimizer.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the value of any {@link StatFeature} for a player within a game,
 * pulling team, game and teammate context as needed.
 */
public final class FeatureExtractor {

    private FeatureExtractor() {
    }

    public static double value(StatFeature feature, HistoricalPlayerRecord player, HistoricalGame game) {
        PregameContext context = game.getPregameContext() != null
                ? game.getPregameContext()
                : new PregameContext();

        return switch (feature.getGroup()) {
            case RAW, PLAYER_ADVANCED -> player.statValue(feature);
            case TEAM -> {
                String team = feature.isOpponentMetric() ? game.opponentOf(player.getTeam()) : player.getTeam();
                yield context.teamMetric(team, feature);
            }
            case GAME_CONTEXT -> context.gameFactor(feature);
            case TEAMMATE -> teammateValue(feature, player, game);
        };
    }

    public static double[] vector(List<StatFeature> features, HistoricalPlayerRecord player, HistoricalGame game) {
        double[] row = new double[features.size()];
        for (int i = 0; i < features.size(); i++) {
            row[i] = value(features.get(i), player, game);
        }
        return row;
    }

    /**
     * The passer on the player's team with the most passing yards.
     */
    static Optional<HistoricalPlayerRecord> quarterbackOf(HistoricalPlayerRecord player, HistoricalGame game) {
        return game.getPlayers().stream()
                .filter(p -> p.getPosition() == Position.QB)
                .filter(p -> p.getTeam() != null && p.getTeam().equals(player.getTeam()))
                .max(Comparator.comparingDouble(p -> p.statValue(StatFeature.PASS_YDS)));
    }

    /**
     * Highest-salaried non-QB teammate other than the player.
     */
    static Optional<HistoricalPlayerRecord> topTeammateOf(HistoricalPlayerRecord player, HistoricalGame game) {
        return game.getPlayers().stream()
                .filter(p -> p != player)
                .filter(p -> p.getPosition() != Position.QB)
                .filter(p -> p.getTeam() != null && p.getTeam().equals(player.getTeam()))
                .filter(p -> p.getName() == null || !p.getName().equals(player.getName()))
                .max(Comparator.comparingInt(HistoricalPlayerRecord::salaryOrZero)
                        .thenComparingDouble(HistoricalPlayerRecord::getActualFantasyPoints));
    }

    private static double teammateValue(StatFeature feature, HistoricalPlayerRecord player, HistoricalGame game) {
        return switch (feature) {
            case QB_PASS_YDS -> quarterbackValue(player, game, StatFeature.PASS_YDS);
            case QB_RUSH_YDS -> quarterbackValue(player, game, StatFeature.RUSH_YDS);
            case TOP_TEAMMATE_REC_YDS -> topTeammateValue(player, game, StatFeature.REC_YDS);
            case TOP_TEAMMATE_RUSH_YDS -> topTeammateValue(player, game, StatFeature.RUSH_YDS);
            case TOP_TEAMMATE_RECEPTIONS -> topTeammateValue(player, game, StatFeature.RECEPTIONS);
            default -> throw new IllegalArgumentException("Not a teammate feature: " + feature);
        };
    }

    private static double quarterbackValue(HistoricalPlayerRecord player, HistoricalGame game, StatFeature stat) {
        if (player.getPosition() == Position.QB) {
            return 0.0;
        }
        return quarterbackOf(player, game).map(qb -> qb.statValue(stat)).orElse(0.0);
    }

    private static double topTeammateValue(HistoricalPlayerRecord player, HistoricalGame game, StatFeature stat) {
        return topTeammateOf(player, game).map(mate -> mate.statValue(stat)).orElse(0.0);
    }
}
