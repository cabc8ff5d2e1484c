package com.showdownlab.optimizer.solver;

import com.showdownlab.optimizer.TestFixtures;
import com.showdownlab.optimizer.domain.Lineup;
import com.showdownlab.optimizer.domain.LineupSignature;
import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.RosterConstraintSet;
import com.showdownlab.optimizer.domain.ScoringMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LineupGenerator uniqueness, exhaustion and exposure handling.
 */
class LineupGeneratorTest {

    private LineupGenerator generator;
    private List<Player> pool;

    @BeforeEach
    void setUp() {
        generator = new LineupGenerator(new MilpLineupSolver());
        pool = TestFixtures.showdownPool();
    }

    @Test
    void testGenerate_FiveUniqueLineups() {
        // Act
        List<Lineup> lineups = generator.generate(pool, TestFixtures.defaultConstraints(), 5, ScoringMode.MEAN);

        // Assert
        assertEquals(5, lineups.size());
        Set<LineupSignature> signatures = lineups.stream().map(Lineup::getSignature).collect(Collectors.toSet());
        assertEquals(5, signatures.size());
        lineups.forEach(l -> assertTrue(l.getTotalSalary() <= TestFixtures.SALARY_CAP));
    }

    @Test
    void testGenerate_ScoresNeverIncrease() {
        List<Lineup> lineups = generator.generate(pool, TestFixtures.defaultConstraints(), 8, ScoringMode.CEILING);

        for (int i = 1; i < lineups.size(); i++) {
            assertTrue(lineups.get(i).getTotalCeilingScore() <= lineups.get(i - 1).getTotalCeilingScore() + 1e-6,
                    "Lineup " + i + " scores higher than its predecessor");
        }
    }

    @Test
    void testGenerate_LockedAndExcludedHonouredInEveryLineup() {
        // Arrange
        RosterConstraintSet constraints = TestFixtures.defaultConstraints().toBuilder()
                .lockedPlayerIds(Set.of("buf_wr2"))
                .excludedPlayerIds(Set.of("kc_qb"))
                .build();

        // Act
        List<Lineup> lineups = generator.generate(pool, constraints, 6, ScoringMode.MEAN);

        // Assert
        assertEquals(6, lineups.size());
        for (Lineup lineup : lineups) {
            assertTrue(lineup.contains("buf_wr2"));
            assertFalse(lineup.contains("kc_qb"));
        }
    }

    @Test
    void testGenerate_ExhaustsWhenFewerUniqueLineupsExist() {
        // Arrange: five players can only form five lineups, one per captain
        List<Player> fivePlayers = pool.subList(5, 10);
        RosterConstraintSet constraints = TestFixtures.defaultConstraints().toBuilder()
                .salaryCap(100000)
                .build();

        // Act
        List<Lineup> lineups = generator.generate(fivePlayers, constraints, 10, ScoringMode.MEAN);

        // Assert
        assertEquals(5, lineups.size());
        Set<String> captains = lineups.stream().map(l -> l.getCaptain().getId()).collect(Collectors.toSet());
        assertEquals(5, captains.size());
    }

    @Test
    void testGenerate_InfeasibleConstraints_ReturnsEmptyList() {
        RosterConstraintSet constraints = TestFixtures.defaultConstraints().toBuilder()
                .lockedPlayerIds(Set.of("buf_qb", "kc_qb", "kc_wr1", "buf_wr1", "kc_te"))
                .build();

        List<Lineup> lineups = generator.generate(pool, constraints, 3, ScoringMode.MEAN);

        assertTrue(lineups.isEmpty());
    }

    @Test
    void testGenerate_ZeroCount_ReturnsEmptyWithoutSolving() {
        LineupSolver solver = mock(LineupSolver.class);

        List<Lineup> lineups = new LineupGenerator(solver).generate(pool, TestFixtures.defaultConstraints(), 0,
                ScoringMode.MEAN);

        assertTrue(lineups.isEmpty());
        verifyNoInteractions(solver);
    }

    @Test
    void testGenerate_ExposureCapLimitsAppearances() {
        // Arrange: at most ceil(0.4 * 5) = 2 appearances per unlocked player
        RosterConstraintSet constraints = TestFixtures.defaultConstraints().toBuilder()
                .maxExposure(0.4)
                .build();

        // Act
        List<Lineup> lineups = generator.generate(pool, constraints, 5, ScoringMode.MEAN);

        // Assert
        assertFalse(lineups.isEmpty());
        Map<String, Integer> appearances = new HashMap<>();
        lineups.forEach(l -> l.getPlayers().forEach(p -> appearances.merge(p.getId(), 1, Integer::sum)));
        appearances.values().forEach(count -> assertTrue(count <= 2));
    }

    @Test
    void testGenerate_LockedPlayerExemptFromExposureCap() {
        RosterConstraintSet constraints = TestFixtures.defaultConstraints().toBuilder()
                .lockedPlayerIds(Set.of("buf_dst"))
                .maxExposure(0.5)
                .build();

        List<Lineup> lineups = generator.generate(pool, constraints, 2, ScoringMode.MEAN);

        assertEquals(2, lineups.size());
        lineups.forEach(l -> assertTrue(l.contains("buf_dst")));
    }

    @Test
    void testGenerate_StopsWhenSolverRepeatsSignature() {
        // Arrange
        LineupSolver solver = mock(LineupSolver.class);
        Lineup lineup = new Lineup(pool.get(0), pool.subList(1, 5), 1.5);
        when(solver.solve(any(), any(), any(), any())).thenReturn(Optional.of(lineup));

        // Act
        List<Lineup> lineups = new LineupGenerator(solver).generate(pool, TestFixtures.defaultConstraints(), 3,
                ScoringMode.MEAN);

        // Assert
        assertEquals(1, lineups.size());
        verify(solver, times(2)).solve(any(), any(), any(), any());
    }

    @Test
    void testGenerate_PassesAccumulatedSignaturesToSolver() {
        // Arrange: the same set instance is passed on every call, so copy it per call
        MilpLineupSolver solver = spy(new MilpLineupSolver());
        List<Set<LineupSignature>> forbiddenPerCall = new ArrayList<>();
        doAnswer(invocation -> {
            Set<LineupSignature> forbidden = invocation.getArgument(3);
            forbiddenPerCall.add(new HashSet<>(forbidden));
            return invocation.callRealMethod();
        }).when(solver).solve(any(), any(), any(), any());
        LineupGenerator spiedGenerator = new LineupGenerator(solver);

        // Act
        List<Lineup> lineups = spiedGenerator.generate(pool, TestFixtures.defaultConstraints(), 4, ScoringMode.MEAN);

        // Assert
        assertEquals(4, lineups.size());
        assertEquals(4, forbiddenPerCall.size());
        Set<LineupSignature> expected = new HashSet<>();
        for (int i = 0; i < lineups.size(); i++) {
            assertEquals(expected, forbiddenPerCall.get(i), "Forbidden set before lineup " + i);
            expected.add(lineups.get(i).getSignature());
        }
    }

    @Test
    void testExposureLimit() {
        assertEquals(Integer.MAX_VALUE, LineupGenerator.exposureLimit(null, 10));
        assertEquals(4, LineupGenerator.exposureLimit(0.35, 10));
        assertEquals(1, LineupGenerator.exposureLimit(0.01, 10));
        assertEquals(10, LineupGenerator.exposureLimit(1.0, 10));
    }
}
