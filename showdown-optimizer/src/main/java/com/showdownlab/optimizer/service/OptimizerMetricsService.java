package com.showdownlab.optimizer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer counters and timers for optimization runs and background jobs.
 * Exposed via Spring Boot Actuator.
 */
@Service
@Slf4j
public class OptimizerMetricsService {

    private final Counter lineupsGeneratedCounter;
    private final Counter generationExhaustedCounter;
    private final Counter gamesSkippedCounter;
    private final Counter modelsDiscoveredCounter;
    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter jobsRetriedCounter;
    private final Counter jobsCancelledCounter;
    private final Timer generationTimer;
    private final Timer jobExecutionTimer;

    public OptimizerMetricsService(MeterRegistry meterRegistry) {
        this.lineupsGeneratedCounter = Counter.builder("showdown.lineups.generated")
                .description("Total number of lineups produced by the optimizer")
                .register(meterRegistry);

        this.generationExhaustedCounter = Counter.builder("showdown.solver.infeasible")
                .description("Generation runs that stopped early because no further feasible unique lineup existed")
                .register(meterRegistry);

        this.gamesSkippedCounter = Counter.builder("showdown.backtest.games.skipped")
                .description("Historical games skipped during backtests")
                .register(meterRegistry);

        this.modelsDiscoveredCounter = Counter.builder("showdown.models.discovered")
                .description("Candidate models produced by discovery cycles")
                .register(meterRegistry);

        this.jobsSubmittedCounter = Counter.builder("showdown.jobs.submitted")
                .description("Analysis jobs submitted")
                .register(meterRegistry);

        this.jobsCompletedCounter = Counter.builder("showdown.jobs.completed")
                .description("Analysis jobs completed successfully")
                .register(meterRegistry);

        this.jobsFailedCounter = Counter.builder("showdown.jobs.failed")
                .description("Analysis jobs failed permanently")
                .register(meterRegistry);

        this.jobsRetriedCounter = Counter.builder("showdown.jobs.retried")
                .description("Analysis job retry attempts")
                .register(meterRegistry);

        this.jobsCancelledCounter = Counter.builder("showdown.jobs.cancelled")
                .description("Analysis jobs stopped by a cancellation request")
                .register(meterRegistry);

        this.generationTimer = Timer.builder("showdown.solver.solve.time")
                .description("Wall time of one multi-lineup generation run")
                .register(meterRegistry);

        this.jobExecutionTimer = Timer.builder("showdown.job.execution.time")
                .description("Analysis job execution time")
                .register(meterRegistry);

        log.info("OptimizerMetricsService initialized with Micrometer metrics");
    }

    public void recordGeneration(int requested, int generated, long durationMs) {
        lineupsGeneratedCounter.increment(generated);
        if (generated < requested) {
            generationExhaustedCounter.increment();
        }
        generationTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordGamesSkipped(int count) {
        if (count > 0) {
            gamesSkippedCounter.increment(count);
        }
    }

    public void recordModelsDiscovered(int count) {
        modelsDiscoveredCounter.increment(count);
    }

    public void recordJobSubmitted() {
        jobsSubmittedCounter.increment();
    }

    public void recordJobCompleted(long executionTimeMs) {
        jobsCompletedCounter.increment();
        jobExecutionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordJobFailed() {
        jobsFailedCounter.increment();
    }

    public void recordJobRetried() {
        jobsRetriedCounter.increment();
    }

    public void recordJobCancelled() {
        jobsCancelledCounter.increment();
    }

    /**
     * Current job metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Lineups=%d, Submitted=%d, Completed=%d, Failed=%d, Retried=%d, Cancelled=%d",
                (long) lineupsGeneratedCounter.count(),
                (long) jobsSubmittedCounter.count(),
                (long) jobsCompletedCounter.count(),
                (long) jobsFailedCounter.count(),
                (long) jobsRetriedCounter.count(),
                (long) jobsCancelledCounter.count());
    }
}
