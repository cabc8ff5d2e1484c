package com.showdownlab.optimizer.domain;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fail-fast checks on a player pool and its constraint set.
 */
public final class LineupInputValidator {

    private LineupInputValidator() {
    }

    public static void validate(List<Player> pool, RosterConstraintSet constraints) {
        if (constraints == null) {
            throw new InvalidLineupInputException("Roster constraints are required");
        }
        validateConstraints(constraints);

        if (pool == null || pool.isEmpty()) {
            throw new InvalidLineupInputException("Player pool is empty");
        }

        Set<String> ids = new HashSet<>();
        for (Player player : pool) {
            if (player == null) {
                throw new InvalidLineupInputException("Player pool contains a null entry");
            }
            if (player.getId() == null || player.getId().isBlank()) {
                throw new InvalidLineupInputException("Player id is required (name: " + player.getName() + ")");
            }
            if (!ids.add(player.getId())) {
                throw new InvalidLineupInputException("Duplicate player id: " + player.getId());
            }
            if (player.getPosition() == null) {
                throw new InvalidLineupInputException("Player " + player.getId() + " has no position");
            }
            if (player.getTeam() == null || player.getTeam().isBlank()) {
                throw new InvalidLineupInputException("Player " + player.getId() + " has no team");
            }
            if (player.getSalary() < 0) {
                throw new InvalidLineupInputException(
                        "Player " + player.getId() + " has negative salary: " + player.getSalary());
            }
            if (!Double.isFinite(player.getMeanScore()) || !Double.isFinite(player.getCeilingScore())) {
                throw new InvalidLineupInputException("Player " + player.getId() + " has a non-finite projection");
            }
        }

        for (String lockedId : constraints.getLockedPlayerIds()) {
            if (!ids.contains(lockedId)) {
                throw new InvalidLineupInputException("Locked player is not in the pool: " + lockedId);
            }
        }
    }

    public static void validateConstraints(RosterConstraintSet constraints) {
        if (constraints.getSalaryCap() <= 0) {
            throw new InvalidLineupInputException("Salary cap must be positive");
        }
        if (constraints.getRosterSize() < 2) {
            throw new InvalidLineupInputException(
                    "Roster size must be at least 2 (captain plus one), got " + constraints.getRosterSize());
        }
        if (constraints.getCaptainMultiplier() < 1.0) {
            throw new InvalidLineupInputException("Captain multiplier must be at least 1.0");
        }
        if (constraints.getMaxPerPosition() != null) {
            for (Map.Entry<Position, Integer> cap : constraints.getMaxPerPosition().entrySet()) {
                if (cap.getValue() == null || cap.getValue() < 0) {
                    throw new InvalidLineupInputException("Position cap for " + cap.getKey() + " must be non-negative");
                }
            }
        }

        Set<String> locked = constraints.getLockedPlayerIds();
        Set<String> excluded = constraints.getExcludedPlayerIds();
        if (locked == null || excluded == null) {
            throw new InvalidLineupInputException("Lock and exclusion sets must not be null");
        }
        for (String id : locked) {
            if (excluded.contains(id)) {
                throw new InvalidLineupInputException("Player is both locked and excluded: " + id);
            }
        }
        if (locked.size() > constraints.getRosterSize()) {
            throw new InvalidLineupInputException("Cannot lock " + locked.size()
                    + " players into a roster of " + constraints.getRosterSize());
        }

        Double maxExposure = constraints.getMaxExposure();
        if (maxExposure != null && (maxExposure <= 0.0 || maxExposure > 1.0)) {
            throw new InvalidLineupInputException("Max exposure must be in (0, 1], got " + maxExposure);
        }
    }
}
