package com.showdownlab.optimizer.solver;

import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupSignature;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.ScoringMode;
import lombok.extern.slf4j.Slf4j;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binary integer program over two variables per player: in roster and is captain.
 * Builds a fresh ojAlgo model for every call and keeps no state between calls,
 * so one instance can serve concurrent solves.
 */
@Slf4j
public class MilpLineupSolver implements LineupSolver {

    private static final double SELECTED = 0.5;

    @Override
    public Optional<Lineup> solve(List<Player> pool, RosterConstraintSet constraints, ScoringMode mode,
            Set<LineupSignature> forbidden) {
        List<Player> eligible = pool.stream()
                .filter(p -> !constraints.isExcluded(p.getId()))
                .collect(Collectors.toList());

        int rosterSize = constraints.getRosterSize();
        if (eligible.size() < rosterSize) {
            log.debug("Only {} eligible players for a roster of {}", eligible.size(), rosterSize);
            return Optional.empty();
        }

        int n = eligible.size();
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexById.put(eligible.get(i).getId(), i);
        }

        for (String lockedId : constraints.getLockedPlayerIds()) {
            if (!indexById.containsKey(lockedId)) {
                log.debug("Locked player {} is not eligible", lockedId);
                return Optional.empty();
            }
        }

        ExpressionsBasedModel model = new ExpressionsBasedModel();
        double captainBonus = constraints.getCaptainMultiplier() - 1.0;

        // Variable order matters: roster flags occupy [0, n), captain flags [n, 2n)
        Variable[] inRoster = new Variable[n];
        for (int i = 0; i < n; i++) {
            inRoster[i] = model.addVariable("roster_" + i).binary().weight(mode.scoreOf(eligible.get(i)));
        }
        Variable[] isCaptain = new Variable[n];
        for (int i = 0; i < n; i++) {
            isCaptain[i] = model.addVariable("captain_" + i).binary()
                    .weight(mode.scoreOf(eligible.get(i)) * captainBonus);
        }

        Expression rosterCount = model.addExpression("roster_size").level(rosterSize);
        Expression captainCount = model.addExpression("one_captain").level(1);
        Expression salary = model.addExpression("salary_cap").upper(constraints.getSalaryCap());
        for (int i = 0; i < n; i++) {
            rosterCount.set(inRoster[i], 1);
            captainCount.set(isCaptain[i], 1);
            salary.set(inRoster[i], eligible.get(i).getSalary());

            Expression captainInRoster = model.addExpression("captain_in_roster_" + i).upper(0);
            captainInRoster.set(isCaptain[i], 1);
            captainInRoster.set(inRoster[i], -1);
        }

        for (String lockedId : constraints.getLockedPlayerIds()) {
            inRoster[indexById.get(lockedId)].lower(1);
        }

        addPositionCaps(model, eligible, inRoster, constraints);

        if (constraints.isRequireCaptainStack()) {
            addStackConstraints(model, eligible, inRoster, isCaptain, constraints.isRequireOpponentBringBack());
        }

        int cuts = addSignatureCuts(model, forbidden, indexById, inRoster, isCaptain, rosterSize);

        log.debug("Solving lineup model - Players: {}, Cuts: {}, Mode: {}", n, cuts, mode);
        Optimisation.Result result = model.maximise();

        if (!result.getState().isFeasible()) {
            log.debug("No feasible lineup - Solver state: {}", result.getState());
            return Optional.empty();
        }

        return extractLineup(result, eligible, constraints);
    }

    private void addPositionCaps(ExpressionsBasedModel model, List<Player> eligible, Variable[] inRoster,
            RosterConstraintSet constraints) {
        if (constraints.getMaxPerPosition() == null) {
            return;
        }

        for (Map.Entry<Position, Integer> cap : constraints.getMaxPerPosition().entrySet()) {
            Expression positionCount = model.addExpression("position_cap_" + cap.getKey()).upper(cap.getValue());
            for (int i = 0; i < eligible.size(); i++) {
                if (eligible.get(i).getPosition() == cap.getKey()) {
                    positionCount.set(inRoster[i], 1);
                }
            }
        }
    }

    /**
     * For every candidate captain i: sum of eligible partners selected - isCaptain_i >= 0.
     * A quarterback captain needs a same-team WR or TE; anyone else needs any teammate.
     * With bring-back, the captain also needs at least one player from the opposing team.
     */
    private void addStackConstraints(ExpressionsBasedModel model, List<Player> eligible, Variable[] inRoster,
            Variable[] isCaptain, boolean bringBack) {
        for (int i = 0; i < eligible.size(); i++) {
            Player captain = eligible.get(i);

            Expression stack = model.addExpression("stack_" + i).lower(0);
            stack.set(isCaptain[i], -1);
            for (int j = 0; j < eligible.size(); j++) {
                if (j != i && isStackPartner(captain, eligible.get(j))) {
                    stack.set(inRoster[j], 1);
                }
            }

            if (bringBack) {
                Expression opposing = model.addExpression("bring_back_" + i).lower(0);
                opposing.set(isCaptain[i], -1);
                for (int j = 0; j < eligible.size(); j++) {
                    if (isOpponent(captain, eligible.get(j))) {
                        opposing.set(inRoster[j], 1);
                    }
                }
            }
        }
    }

    static boolean isStackPartner(Player captain, Player partner) {
        if (!captain.getTeam().equals(partner.getTeam())) {
            return false;
        }
        if (captain.getPosition() == Position.QB) {
            return partner.getPosition() != null && partner.getPosition().isPassCatcher();
        }
        return true;
    }

    static boolean isOpponent(Player captain, Player other) {
        if (captain.getOpponent() != null && !captain.getOpponent().isBlank()) {
            return captain.getOpponent().equals(other.getTeam());
        }
        return !captain.getTeam().equals(other.getTeam());
    }

    private int addSignatureCuts(ExpressionsBasedModel model, Set<LineupSignature> forbidden,
            Map<String, Integer> indexById, Variable[] inRoster, Variable[] isCaptain, int rosterSize) {
        if (forbidden == null) {
            return 0;
        }

        int added = 0;
        for (LineupSignature signature : forbidden) {
            Integer captainIndex = indexById.get(signature.getCaptainId());
            List<Integer> otherIndexes = new ArrayList<>();
            for (String otherId : signature.getOtherIds()) {
                Integer index = indexById.get(otherId);
                if (index != null) {
                    otherIndexes.add(index);
                }
            }

            // A signature touching an ineligible player can never be reproduced
            if (captainIndex == null || otherIndexes.size() != signature.getOtherIds().size()
                    || otherIndexes.size() != rosterSize - 1) {
                continue;
            }

            Expression cut = model.addExpression("cut_" + added).upper(rosterSize - 1);
            cut.set(isCaptain[captainIndex], 1);
            for (Integer index : otherIndexes) {
                cut.set(inRoster[index], 1);
            }
            added++;
        }
        return added;
    }

    private Optional<Lineup> extractLineup(Optimisation.Result result, List<Player> eligible,
            RosterConstraintSet constraints) {
        int n = eligible.size();
        Player captain = null;
        List<Player> others = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            boolean selected = result.doubleValue(i) > SELECTED;
            boolean captainSlot = result.doubleValue(n + i) > SELECTED;
            if (captainSlot) {
                captain = eligible.get(i);
            } else if (selected) {
                others.add(eligible.get(i));
            }
        }

        if (captain == null || others.size() != constraints.getRosterSize() - 1) {
            log.warn("Solver returned an inconsistent assignment - Captain: {}, Others: {}",
                    captain != null ? captain.getId() : null, others.size());
            return Optional.empty();
        }

        return Optional.of(new Lineup(captain, others, constraints.getCaptainMultiplier()));
    }
}
