package com.showdownlab.optimizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the queue workers and for per-game backtest runs.
 */
@Configuration
public class AsyncConfig {

    @Value("${showdown.worker.thread-count:3}")
    private int workerThreadCount;

    @Value("${showdown.backtest.thread-count:4}")
    private int backtestThreadCount;

    @Bean(name = "workerExecutorService", destroyMethod = "")
    public ExecutorService workerExecutorService() {
        return Executors.newFixedThreadPool(workerThreadCount, namedThreads("AnalysisWorker-", false));
    }

    @Bean(name = "backtestExecutorService", destroyMethod = "shutdown")
    public ExecutorService backtestExecutorService() {
        return Executors.newFixedThreadPool(backtestThreadCount, namedThreads("BacktestGame-", true));
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
