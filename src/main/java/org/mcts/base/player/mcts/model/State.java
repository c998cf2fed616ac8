package org.mcts.base.player.mcts.model;

import java.util.Set;

/**
 * A single decision point of a two-player, zero-sum, perfect-information game.
 *
 * Implementations must be immutable values: equal states are interchangeable for every search purpose, and
 * {@link #equals(Object)} / {@link #hashCode()} must stay consistent for the lifetime of the state because states are
 * used as map keys by {@link SearchStatistics}.
 *
 * @param <S> the concrete state type
 */
public interface State<S extends State<S>> {

    /**
     * @return every state reachable by one legal move, empty iff this state is terminal. The iteration order of the
     * returned set is kept by the search and decides ties, so implementations should return a deterministic order.
     */
    Set<S> successors();

    /**
     * @return one successor sampled at random.
     *
     * @throws org.mcts.base.player.mcts.model.exceptions.InvalidOperationException if this state is terminal
     */
    S randomSuccessor();

    boolean isTerminal();

    /**
     * @return the outcome in [0, 1] for the player who is about to move in this (terminal) state.
     *
     * @throws org.mcts.base.player.mcts.model.exceptions.InvalidOperationException if this state is not terminal
     */
    double reward();
}
