package com.showdownlab.optimizer.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatWeights arithmetic and JSON form.
 */
class StatWeightsTest {

    @Test
    void testFantasyDefaults_ScoreBoxScore() {
        Map<StatFeature, Double> stats = new EnumMap<>(StatFeature.class);
        stats.put(StatFeature.PASS_YDS, 300.0);
        stats.put(StatFeature.PASS_TDS, 2.0);
        stats.put(StatFeature.INTERCEPTIONS, 1.0);
        stats.put(StatFeature.RUSH_YDS, 20.0);

        // 12 + 8 - 1 + 2
        assertEquals(21.0, StatWeights.fantasyDefaults().dot(stats), 1e-9);
        assertEquals(21.0, FantasyScoring.actualPoints(stats), 1e-9);
    }

    @Test
    void testUnlistedFeatureWeighsZero() {
        StatWeights weights = StatWeights.fantasyDefaults();

        assertEquals(0.0, weights.get(StatFeature.TARGET_SHARE));
        assertFalse(weights.asMap().containsKey(StatFeature.TARGET_SHARE));
    }

    @Test
    void testMergedWith_OverridesOnlyGivenFeatures() {
        StatWeights merged = StatWeights.fantasyDefaults().mergedWith(Map.of(
                StatFeature.PASS_YDS, 0.05,
                StatFeature.AIR_YARDS, 0.01));

        assertEquals(0.05, merged.get(StatFeature.PASS_YDS));
        assertEquals(0.01, merged.get(StatFeature.AIR_YARDS));
        assertEquals(6.0, merged.get(StatFeature.RUSH_TDS));
    }

    @Test
    void testAverage_ElementWise() {
        StatWeights a = StatWeights.of(Map.of(StatFeature.PASS_YDS, 0.04, StatFeature.REC_YDS, 0.2));
        StatWeights b = StatWeights.of(Map.of(StatFeature.PASS_YDS, 0.06));

        StatWeights average = StatWeights.average(List.of(a, b));

        assertEquals(0.05, average.get(StatFeature.PASS_YDS), 1e-12);
        assertEquals(0.1, average.get(StatFeature.REC_YDS), 1e-12);
    }

    @Test
    void testAverage_EmptyListRejected() {
        assertThrows(IllegalArgumentException.class, () -> StatWeights.average(List.of()));
    }

    @Test
    void testWith_ReturnsNewInstance() {
        StatWeights original = StatWeights.zero();
        StatWeights changed = original.with(StatFeature.RECEPTIONS, 1.0);

        assertEquals(0.0, original.get(StatFeature.RECEPTIONS));
        assertEquals(1.0, changed.get(StatFeature.RECEPTIONS));
        assertNotEquals(original, changed);
    }

    @Test
    void testJson_SerializesAsPlainMap() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        StatWeights weights = StatWeights.of(Map.of(StatFeature.REC_TDS, 6.0));

        String json = mapper.writeValueAsString(weights);

        assertEquals("{\"REC_TDS\":6.0}", json);
        assertEquals(weights, mapper.readValue(json, StatWeights.class));
    }
}
