package org.mcts.base.player.mcts.model.exceptions;

/**
 * Thrown when a search or state operation is called outside its precondition, e.g. asking a terminal state for a move.
 */
@SuppressWarnings("serial")
public class InvalidOperationException extends RuntimeException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
