package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalPlayerRecord;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.StatFeature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticHistoricalGameSourceTest {

    private final SyntheticHistoricalGameSource source = new SyntheticHistoricalGameSource(1337L);

    @Test
    void testCatalog_SequentialIds() {
        assertEquals(List.of("synthetic-001", "synthetic-002", "synthetic-003"), source.catalog(3));
        assertTrue(source.catalog(0).isEmpty());
    }

    @Test
    void testFetch_DeterministicPerId() {
        assertEquals(source.fetch("synthetic-004"), source.fetch("synthetic-004"));
        assertNotEquals(source.fetch("synthetic-004"), source.fetch("synthetic-005"));
    }

    @Test
    void testFetch_TwoFullTeams() {
        HistoricalGame game = source.fetch("synthetic-001");

        assertEquals(18, game.getPlayers().size());
        assertEquals(2, game.teams().size());
        for (String team : game.teams()) {
            long quarterbacks = game.getPlayers().stream()
                    .filter(p -> team.equals(p.getTeam()) && p.getPosition() == Position.QB)
                    .count();
            assertEquals(1, quarterbacks);
            assertNotNull(game.getPregameContext().getTeamMetrics().get(team));
        }
        assertTrue(game.getDescription().contains(" @ "));
    }

    @Test
    void testFetch_PlayersHavePlausibleSalaries() {
        HistoricalGame game = source.fetch("synthetic-010");

        for (HistoricalPlayerRecord player : game.getPlayers()) {
            assertTrue(player.getSalary() >= 1000 && player.getSalary() <= 15000, player.getName());
            assertEquals(0, player.getSalary() % 100);
            assertTrue(player.getActualFantasyPoints() >= 0.0);
        }
    }

    @Test
    void testFetch_ReceiversFollowQuarterback() {
        HistoricalGame game = source.fetch("synthetic-002");
        HistoricalPlayerRecord qb = game.getPlayers().stream()
                .filter(p -> p.getPosition() == Position.QB)
                .findFirst()
                .orElseThrow();

        double receiving = game.getPlayers().stream()
                .filter(p -> qb.getTeam().equals(p.getTeam()))
                .mapToDouble(p -> p.statValue(StatFeature.REC_YDS))
                .sum();

        // Shares sum to 1.0 with +/-30% noise each
        assertTrue(receiving > qb.statValue(StatFeature.PASS_YDS) * 0.6);
        assertTrue(receiving < qb.statValue(StatFeature.PASS_YDS) * 1.4);
    }

    @Test
    void testFetch_UnknownId_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> source.fetch("2024-wk1"));
        assertThrows(IllegalArgumentException.class, () -> source.fetch(null));
    }
}
