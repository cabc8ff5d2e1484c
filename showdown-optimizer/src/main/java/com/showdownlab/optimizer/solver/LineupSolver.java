package com.showdownlab.optimizer.solver;

import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupSignature;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.ScoringMode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the single best lineup for a pool under a constraint set.
 */
public interface LineupSolver {

    /**
     * Solve for the highest-scoring feasible lineup.
     *
     * @param pool        candidate players; excluded ids are ignored
     * @param constraints roster rules
     * @param mode        which projection to maximise
     * @param forbidden   signatures that must not be produced again
     * @return the optimal lineup, or empty when no feasible lineup remains
     */
    Optional<Lineup> solve(List<Player> pool, RosterConstraintSet constraints, ScoringMode mode,
            Set<LineupSignature> forbidden);
}
