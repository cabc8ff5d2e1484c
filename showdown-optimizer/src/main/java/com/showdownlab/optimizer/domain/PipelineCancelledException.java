package com.showdownlab.optimizer.domain;

/**
 * Thrown when a pipeline observes a cancellation request between steps.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
