package org.mcts.base.player.mcts.model.strategy;

import org.mcts.base.player.mcts.model.SearchStatistics;
import org.mcts.base.player.mcts.model.State;

public class ExpansionStrategy {

    public <S extends State<S>> void execute(S node, SearchStatistics<S> statistics) {
        if (isNodeExpanded(node, statistics)) {
            return;
        }
        statistics.putChildren(node, node.successors());
    }

    private <S extends State<S>> boolean isNodeExpanded(S node, SearchStatistics<S> statistics) {
        return statistics.isExpanded(node);
    }
}
