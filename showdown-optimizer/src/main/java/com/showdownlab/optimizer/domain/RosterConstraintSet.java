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
 * Declarative bundle of roster rules applied to one optimization run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RosterConstraintSet {

    public static final int DEFAULT_ROSTER_SIZE = 5;
    public static final double DEFAULT_CAPTAIN_MULTIPLIER = 1.5;

    private int salaryCap;

    @Builder.Default
    private int rosterSize = DEFAULT_ROSTER_SIZE;

    @Builder.Default
    private double captainMultiplier = DEFAULT_CAPTAIN_MULTIPLIER;

    @Builder.Default
    private Map<Position, Integer> maxPerPosition = new EnumMap<>(Position.class);

    @Builder.Default
    private Set<String> lockedPlayerIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> excludedPlayerIds = new LinkedHashSet<>();

    private boolean requireCaptainStack;

    // Only applied together with requireCaptainStack
    private boolean requireOpponentBringBack;

    // Fraction of generated lineups a non-locked player may appear in; null means unlimited
    private Double maxExposure;

    public boolean isLocked(String playerId) {
        return lockedPlayerIds != null && lockedPlayerIds.contains(playerId);
    }

    public boolean isExcluded(String playerId) {
        return excludedPlayerIds != null && excludedPlayerIds.contains(playerId);
    }
}
