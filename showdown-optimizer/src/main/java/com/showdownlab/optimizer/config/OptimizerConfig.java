package com.showdownlab.optimizer.config;

import com.showdownlab.optimizer.analysis.BacktestRunner;
import com.showdownlab.optimizer.analysis.ModelDiscovery;
import com.showdownlab.optimizer.analysis.ModelValidator;
import com.showdownlab.optimizer.analysis.RegressionFitter;
import com.showdownlab.optimizer.domain.LineupEvaluator;
import com.showdownlab.optimizer.solver.LineupGenerator;
import com.showdownlab.optimizer.solver.LineupSolver;
import com.showdownlab.optimizer.solver.MilpLineupSolver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Wires the framework-free solver and analysis classes into the context.
 */
@Configuration
public class OptimizerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LineupSolver lineupSolver() {
        return new MilpLineupSolver();
    }

    @Bean
    public LineupGenerator lineupGenerator(LineupSolver lineupSolver) {
        return new LineupGenerator(lineupSolver);
    }

    @Bean
    public LineupEvaluator lineupEvaluator(@Value("${showdown.evaluation.field-size:100000}") int fieldSize) {
        return new LineupEvaluator(fieldSize);
    }

    @Bean
    public RegressionFitter regressionFitter() {
        return new RegressionFitter();
    }

    @Bean
    public ModelDiscovery modelDiscovery(RegressionFitter regressionFitter, Clock clock) {
        return new ModelDiscovery(regressionFitter, clock);
    }

    @Bean
    public ModelValidator modelValidator() {
        return new ModelValidator();
    }

    @Bean
    public BacktestRunner backtestRunner(LineupGenerator lineupGenerator,
            @Qualifier("backtestExecutorService") ExecutorService backtestExecutorService,
            @Value("${showdown.backtest.min-pool-size:10}") int minPoolSize) {
        return new BacktestRunner(lineupGenerator, backtestExecutorService, minPoolSize);
    }
}
