package com.showdownlab.optimizer.solver;

import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupSignature;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.ScoringMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Produces up to N distinct lineups by re-solving with every accepted
 * signature forbidden. Solves run sequentially since each depends on the
 * cuts accumulated so far.
 */
@Slf4j
@RequiredArgsConstructor
public class LineupGenerator {

    private final LineupSolver solver;

    /**
     * Generate lineups until {@code count} are produced or no further unique
     * feasible lineup exists. Exhaustion is not an error: the shorter list is returned.
     */
    public List<Lineup> generate(List<Player> pool, RosterConstraintSet constraints, int count, ScoringMode mode) {
        List<Lineup> lineups = new ArrayList<>();
        if (count <= 0) {
            return lineups;
        }

        Set<LineupSignature> forbidden = new LinkedHashSet<>();
        Set<String> exposureExcluded = new LinkedHashSet<>();
        Map<String, Integer> appearances = new HashMap<>();
        int exposureLimit = exposureLimit(constraints.getMaxExposure(), count);

        while (lineups.size() < count) {
            RosterConstraintSet effective = constraints;
            if (!exposureExcluded.isEmpty()) {
                Set<String> excluded = new LinkedHashSet<>(constraints.getExcludedPlayerIds());
                excluded.addAll(exposureExcluded);
                effective = constraints.toBuilder().excludedPlayerIds(excluded).build();
            }

            Optional<Lineup> next = solver.solve(pool, effective, mode, forbidden);
            if (next.isEmpty()) {
                log.info("Lineup generation exhausted after {} of {} lineups", lineups.size(), count);
                break;
            }

            Lineup lineup = next.get();
            if (!forbidden.add(lineup.getSignature())) {
                log.warn("Solver repeated signature {}; stopping generation", lineup.getSignature());
                break;
            }
            lineups.add(lineup);

            for (Player player : lineup.getPlayers()) {
                int seen = appearances.merge(player.getId(), 1, Integer::sum);
                if (seen >= exposureLimit && !constraints.isLocked(player.getId())) {
                    exposureExcluded.add(player.getId());
                }
            }
        }

        log.debug("Generated {} lineups for pool of {} players", lineups.size(), pool.size());
        return lineups;
    }

    static int exposureLimit(Double maxExposure, int count) {
        if (maxExposure == null) {
            return Integer.MAX_VALUE;
        }
        return Math.max(1, (int) Math.ceil(maxExposure * count));
    }
}
