package com.showdownlab.optimizer.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private OptimizerMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new OptimizerMetricsService(registry);
    }

    @Test
    void testRecordGeneration_CountsLineupsAndShortfalls() {
        metricsService.recordGeneration(5, 5, 12);
        metricsService.recordGeneration(10, 3, 40);

        assertEquals(8.0, registry.get("showdown.lineups.generated").counter().count());
        assertEquals(1.0, registry.get("showdown.solver.infeasible").counter().count());
        assertEquals(2L, registry.get("showdown.solver.solve.time").timer().count());
    }

    @Test
    void testRecordGamesSkipped_IgnoresZero() {
        metricsService.recordGamesSkipped(0);
        metricsService.recordGamesSkipped(3);

        assertEquals(3.0, registry.get("showdown.backtest.games.skipped").counter().count());
    }

    @Test
    void testJobLifecycleCounters() {
        metricsService.recordJobSubmitted();
        metricsService.recordJobSubmitted();
        metricsService.recordJobCompleted(250);
        metricsService.recordJobRetried();
        metricsService.recordJobFailed();
        metricsService.recordJobCancelled();
        metricsService.recordModelsDiscovered(5);

        assertEquals(2.0, registry.get("showdown.jobs.submitted").counter().count());
        assertEquals(1.0, registry.get("showdown.jobs.completed").counter().count());
        assertEquals(1L, registry.get("showdown.job.execution.time").timer().count());
        assertEquals(5.0, registry.get("showdown.models.discovered").counter().count());
        assertEquals("Metrics: Lineups=0, Submitted=2, Completed=1, Failed=1, Retried=1, Cancelled=1",
                metricsService.getMetricsSummary());
    }
}
