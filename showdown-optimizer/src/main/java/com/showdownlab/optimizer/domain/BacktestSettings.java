package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Constraint choices for a backtest. Locks and exclusions are player names
 * because ids are rebuilt for every historical game.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestSettings {

    private int salaryCap;

    @Builder.Default
    private int rosterSize = RosterConstraintSet.DEFAULT_ROSTER_SIZE;

    @Builder.Default
    private double captainMultiplier = RosterConstraintSet.DEFAULT_CAPTAIN_MULTIPLIER;

    @Builder.Default
    private Map<Position, Integer> maxPerPosition = new EnumMap<>(Position.class);

    @Builder.Default
    private Set<String> lockedPlayerNames = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> excludedPlayerNames = new LinkedHashSet<>();

    private boolean requireCaptainStack;
    private boolean requireOpponentBringBack;
    private Double maxExposure;

    @Builder.Default
    private int lineupCount = 1;
}
