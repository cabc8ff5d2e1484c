package com.showdownlab.optimizer.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.showdownlab.optimizer.TestFixtures.player;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LineupEvaluator metrics and the duplication model.
 */
class LineupEvaluatorTest {

    private Lineup lineupWithOwnership() {
        Player captain = player("c", "KC", "BUF", Position.QB, 15000, 20, 30, 40, 10);
        Player a = player("a", "KC", "BUF", Position.WR, 12000, 14, 25, 20, 5);
        Player b = player("b", "KC", "BUF", Position.TE, 9000, 10, 18, 20, 5);
        Player c = player("d", "BUF", "KC", Position.RB, 10000, 11, 20, 50, 5);
        Player d = player("e", "BUF", "KC", Position.DST, 8000, 7, 14, 50, 5);
        return new Lineup(captain, List.of(a, b, c, d), 1.5);
    }

    @Test
    void testEvaluate_DuplicationRiskAndExpectedValue() {
        // Arrange: ownership product 0.1 * 0.2 * 0.2 * 0.5 * 0.5 = 0.001
        LineupEvaluator evaluator = new LineupEvaluator(100_000);
        Lineup lineup = lineupWithOwnership();

        // Act
        LineupMetrics metrics = evaluator.evaluate(lineup);

        // Assert
        assertEquals(0.001, metrics.getOwnershipProduct(), 1e-12);
        assertEquals(99.0, metrics.getDuplicationRisk(), 1e-6);
        double ceiling = 30 * 1.5 + 25 + 18 + 20 + 14;
        assertEquals(ceiling, metrics.getTotalCeilingScore(), 1e-9);
        assertEquals(ceiling / (1.0 + Math.sqrt(99.0)), metrics.getExpectedValue(), 1e-9);
        assertEquals("3-2", metrics.getStackType());
        assertEquals(54000, metrics.getTotalSalary());
    }

    @Test
    void testEvaluate_RareLineupKeepsFullCeiling() {
        // Arrange: product * field below one means no expected duplicates
        LineupEvaluator evaluator = new LineupEvaluator(500);
        Lineup lineup = lineupWithOwnership();

        // Act
        LineupMetrics metrics = evaluator.evaluate(lineup);

        // Assert
        assertEquals(0.0, metrics.getDuplicationRisk());
        assertEquals(metrics.getTotalCeilingScore(), metrics.getExpectedValue(), 1e-9);
    }

    @Test
    void testEvaluate_IsIdempotent() {
        LineupEvaluator evaluator = new LineupEvaluator();
        Lineup lineup = lineupWithOwnership();

        assertEquals(evaluator.evaluate(lineup), evaluator.evaluate(lineup));
    }

    @Test
    void testConstructor_RejectsNonPositiveFieldSize() {
        assertThrows(IllegalArgumentException.class, () -> new LineupEvaluator(0));
    }
}
