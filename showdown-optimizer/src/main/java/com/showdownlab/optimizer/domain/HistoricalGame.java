package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A finished game used as ground truth. Never modified after it is cached.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalGame {

    private String gameId;
    private String description;

    @Builder.Default
    private PregameContext pregameContext = new PregameContext();

    @Builder.Default
    private List<HistoricalPlayerRecord> players = new ArrayList<>();

    public Set<String> teams() {
        Set<String> teams = new LinkedHashSet<>();
        for (HistoricalPlayerRecord player : players) {
            if (player.getTeam() != null) {
                teams.add(player.getTeam());
            }
        }
        return teams;
    }

    /**
     * The other team in this game, or null when it cannot be determined.
     */
    public String opponentOf(String team) {
        for (String candidate : teams()) {
            if (!candidate.equals(team)) {
                return candidate;
            }
        }
        return null;
    }
}
