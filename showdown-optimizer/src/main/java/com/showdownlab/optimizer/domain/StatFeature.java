package com.showdownlab.optimizer.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Every statistical feature a scoring model can weight.
 */
public enum StatFeature {

    // Box score
    PASS_YDS(Group.RAW),
    PASS_TDS(Group.RAW),
    INTERCEPTIONS(Group.RAW),
    RUSH_YDS(Group.RAW),
    RUSH_TDS(Group.RAW),
    RECEPTIONS(Group.RAW),
    REC_YDS(Group.RAW),
    REC_TDS(Group.RAW),
    FUMBLES_LOST(Group.RAW),

    // Per-player advanced
    AIR_YARDS(Group.PLAYER_ADVANCED),
    RED_ZONE_TOUCHES(Group.PLAYER_ADVANCED),
    TARGET_SHARE(Group.PLAYER_ADVANCED),
    RUSH_ATTEMPT_SHARE(Group.PLAYER_ADVANCED),
    YARDS_PER_ROUTE_RUN(Group.PLAYER_ADVANCED),
    AVERAGE_DEPTH_OF_TARGET(Group.PLAYER_ADVANCED),
    YARDS_AFTER_CATCH(Group.PLAYER_ADVANCED),
    ROUTES_RUN(Group.PLAYER_ADVANCED),
    AVOIDED_TACKLES(Group.PLAYER_ADVANCED),
    YARDS_CREATED_PER_TOUCH(Group.PLAYER_ADVANCED),
    PLAY_ACTION_PASS_RATE(Group.PLAYER_ADVANCED),
    TIME_TO_THROW(Group.PLAYER_ADVANCED),
    CLEAN_POCKET_COMPLETION_RATE(Group.PLAYER_ADVANCED),
    UNDER_PRESSURE_COMPLETION_RATE(Group.PLAYER_ADVANCED),
    DEEP_BALL_COMPLETION_RATE(Group.PLAYER_ADVANCED),
    RED_ZONE_CONVERSION_RATE(Group.PLAYER_ADVANCED),

    // Team level; the two opponent-facing metrics are read from the opposing team
    OFFENSIVE_LINE_RANK(Group.TEAM),
    DEFENSIVE_LINE_RANK(Group.TEAM, true),
    PASS_RUSH_WIN_RATE(Group.TEAM),
    RUN_STOP_WIN_RATE(Group.TEAM),
    SECONDARY_COVERAGE_RANK(Group.TEAM, true),
    PLAYS_PER_GAME(Group.TEAM),
    NEUTRAL_SITUATION_PACE(Group.TEAM),
    NEUTRAL_SITUATION_PASS_RATE(Group.TEAM),
    COACHING_AGGRESSIVENESS(Group.TEAM),
    TURNOVER_DIFFERENTIAL(Group.TEAM),

    // Game level
    STRENGTH_OF_SCHEDULE(Group.GAME_CONTEXT),
    WEATHER_FACTOR(Group.GAME_CONTEXT),
    HOME_FIELD_ADVANTAGE(Group.GAME_CONTEXT),

    // Teammate correlation
    QB_PASS_YDS(Group.TEAMMATE),
    QB_RUSH_YDS(Group.TEAMMATE),
    TOP_TEAMMATE_REC_YDS(Group.TEAMMATE),
    TOP_TEAMMATE_RUSH_YDS(Group.TEAMMATE),
    TOP_TEAMMATE_RECEPTIONS(Group.TEAMMATE);

    /**
     * Where a feature's value comes from.
     */
    public enum Group {
        RAW,
        PLAYER_ADVANCED,
        TEAM,
        GAME_CONTEXT,
        TEAMMATE
    }

    private final Group group;
    private final boolean opponentMetric;

    StatFeature(Group group) {
        this(group, false);
    }

    StatFeature(Group group, boolean opponentMetric) {
        this.group = group;
        this.opponentMetric = opponentMetric;
    }

    public Group getGroup() {
        return group;
    }

    public boolean isOpponentMetric() {
        return opponentMetric;
    }

    /**
     * Features in the given groups, in declaration order.
     */
    public static List<StatFeature> inGroups(Group... groups) {
        Set<Group> wanted = EnumSet.noneOf(Group.class);
        wanted.addAll(Arrays.asList(groups));

        List<StatFeature> features = new ArrayList<>();
        for (StatFeature feature : values()) {
            if (wanted.contains(feature.group)) {
                features.add(feature);
            }
        }
        return features;
    }
}
