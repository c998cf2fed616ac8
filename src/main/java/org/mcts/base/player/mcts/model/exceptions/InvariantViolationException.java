package org.mcts.base.player.mcts.model.exceptions;

/**
 * Thrown when the search statistics are not in the shape an internal step relies on.
 */
@SuppressWarnings("serial")
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
