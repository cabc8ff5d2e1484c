package com.showdownlab.optimizer.domain;

import java.util.EnumMap;
import java.util.Map;

/**
 * Named bundles of stacking and position rules for common game scripts.
 */
public enum StrategyPreset {
    BALANCED(Map.of(Position.K, 1, Position.DST, 1), false, false),
    SHOOTOUT(Map.of(Position.K, 1, Position.DST, 1), true, true),
    TEAM_STACK(Map.of(Position.K, 1, Position.DST, 1), true, false),
    GRIND_IT_OUT(Map.of(Position.K, 2, Position.DST, 2), false, false);

    private final Map<Position, Integer> positionCaps;
    private final boolean captainStack;
    private final boolean opponentBringBack;

    StrategyPreset(Map<Position, Integer> positionCaps, boolean captainStack, boolean opponentBringBack) {
        this.positionCaps = positionCaps;
        this.captainStack = captainStack;
        this.opponentBringBack = opponentBringBack;
    }

    /**
     * Fill in the preset's rules. Position caps already present on the
     * constraint set win over the preset's caps.
     */
    public RosterConstraintSet applyTo(RosterConstraintSet constraints) {
        Map<Position, Integer> caps = new EnumMap<>(Position.class);
        caps.putAll(positionCaps);
        if (constraints.getMaxPerPosition() != null) {
            caps.putAll(constraints.getMaxPerPosition());
        }

        return constraints.toBuilder()
                .maxPerPosition(caps)
                .requireCaptainStack(constraints.isRequireCaptainStack() || captainStack)
                .requireOpponentBringBack(constraints.isRequireOpponentBringBack() || opponentBringBack)
                .build();
    }
}
