package com.showdownlab.optimizer.domain;

/**
 * Receives progress events from discovery and backtest pipelines.
 * Backtests report from worker threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);

    default void report(String message, int percent) {
        onProgress(new ProgressEvent(message, Math.max(0, Math.min(100, percent))));
    }
}
