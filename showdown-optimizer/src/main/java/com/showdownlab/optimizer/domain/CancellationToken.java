package com.showdownlab.optimizer.domain;

/**
 * Cooperative cancellation signal, polled between games and between models.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancelled(String step) {
        if (isCancellationRequested()) {
            throw new PipelineCancelledException("Cancelled during: " + step);
        }
    }
}
