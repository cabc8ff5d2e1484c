package com.showdownlab.optimizer.domain;

/**
 * Kinds of long-running pipelines executed by the background workers.
 */
public enum JobType {
    BACKTEST,
    MODEL_DISCOVERY
}
