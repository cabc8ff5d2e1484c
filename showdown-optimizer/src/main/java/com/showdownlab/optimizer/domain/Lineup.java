package com.showdownlab.optimizer.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * One captain plus the remaining distinct roster players.
 * All score and ownership figures are derived from the players.
 */
@Getter
@EqualsAndHashCode(of = "signature")
public class Lineup {

    private final Player captain;
    private final List<Player> others;
    private final double captainMultiplier;
    private final LineupSignature signature;

    public Lineup(Player captain, List<Player> others, double captainMultiplier) {
        Objects.requireNonNull(captain, "Captain is required");
        Objects.requireNonNull(others, "Roster players are required");

        Set<String> seen = new HashSet<>();
        seen.add(captain.getId());
        for (Player player : others) {
            if (!seen.add(player.getId())) {
                throw new IllegalArgumentException("Player " + player.getId() + " appears twice in lineup");
            }
        }

        this.captain = captain;
        this.others = List.copyOf(others);
        this.captainMultiplier = captainMultiplier;
        this.signature = new LineupSignature(captain.getId(),
                others.stream().map(Player::getId).collect(Collectors.toList()));
    }

    /**
     * Captain first, then the other players in selection order.
     */
    @JsonIgnore
    public List<Player> getPlayers() {
        List<Player> players = new ArrayList<>(others.size() + 1);
        players.add(captain);
        players.addAll(others);
        return players;
    }

    public int getRosterSize() {
        return others.size() + 1;
    }

    public boolean contains(String playerId) {
        return signature.getCaptainId().equals(playerId) || signature.getOtherIds().contains(playerId);
    }

    public int getTotalSalary() {
        return getPlayers().stream().mapToInt(Player::getSalary).sum();
    }

    public double totalScore(ScoringMode mode) {
        double total = mode.scoreOf(captain) * captainMultiplier;
        for (Player player : others) {
            total += mode.scoreOf(player);
        }
        return total;
    }

    public double getTotalMeanScore() {
        return totalScore(ScoringMode.MEAN);
    }

    public double getTotalCeilingScore() {
        return totalScore(ScoringMode.CEILING);
    }

    /**
     * Product of ownership fractions, captain slot using captain ownership.
     * Zero ownership is floored so the product never collapses to zero.
     */
    public double getOwnershipProduct() {
        double product = ownershipFraction(captain.getOwnershipCaptain());
        for (Player player : others) {
            product *= ownershipFraction(player.getOwnershipFlex());
        }
        return product;
    }

    public double getAverageOwnership() {
        double total = captain.getOwnershipCaptain();
        for (Player player : others) {
            total += player.getOwnershipFlex();
        }
        return total / getRosterSize();
    }

    public double getCorrelationSum() {
        List<Player> players = getPlayers();
        double sum = 0.0;
        for (int i = 0; i < players.size(); i++) {
            for (int j = i + 1; j < players.size(); j++) {
                sum += players.get(i).correlationWith(players.get(j));
            }
        }
        return sum;
    }

    public double getAverageCorrelation() {
        int size = getRosterSize();
        int pairs = size * (size - 1) / 2;
        return pairs == 0 ? 0.0 : getCorrelationSum() / pairs;
    }

    /**
     * Per-team player counts sorted descending, e.g. "3-2" or "4-1".
     */
    public String getStackSignature() {
        Map<String, Integer> counts = new TreeMap<>();
        for (Player player : getPlayers()) {
            counts.merge(player.getTeam(), 1, Integer::sum);
        }
        return counts.values().stream()
                .sorted((a, b) -> Integer.compare(b, a))
                .map(String::valueOf)
                .collect(Collectors.joining("-"));
    }

    private static double ownershipFraction(double ownershipPercent) {
        return ownershipPercent > 0 ? ownershipPercent / 100.0 : LineupEvaluator.MIN_OWNERSHIP_FRACTION;
    }
}
