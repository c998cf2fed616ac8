package org.mcts.base.player.mcts.event;

import org.mcts.base.player.mcts.model.MonteCarloTreeSearch;
import org.mcts.base.player.mcts.model.State;
import org.mcts.base.util.observer.Event;

public class TreeEvent<S extends State<S>> extends Event {

    private final MonteCarloTreeSearch<S> tree;
    private final S root;
    private final S chosen;
    private final int turnNumber;

    public TreeEvent(MonteCarloTreeSearch<S> tree, S root, S chosen, int turnNumber) {
        this.tree = tree;
        this.root = root;
        this.chosen = chosen;
        this.turnNumber = turnNumber;
    }

    public MonteCarloTreeSearch<S> getTree() {
        return tree;
    }

    public S getRoot() {
        return root;
    }

    public S getChosen() {
        return chosen;
    }

    public int getTurnNumber() {
        return turnNumber;
    }
}
