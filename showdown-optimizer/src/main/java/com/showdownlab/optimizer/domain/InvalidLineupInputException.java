package com.showdownlab.optimizer.domain;

/**
 * Raised when a player pool, constraint set or pipeline request is malformed.
 * Thrown before any solver work starts.
 */
public class InvalidLineupInputException extends IllegalArgumentException {

    public InvalidLineupInputException(String message) {
        super(message);
    }
}
