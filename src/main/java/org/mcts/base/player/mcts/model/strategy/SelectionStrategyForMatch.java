package org.mcts.base.player.mcts.model.strategy;

import org.mcts.base.player.mcts.model.SearchStatistics;
import org.mcts.base.player.mcts.model.State;
import org.mcts.base.player.mcts.model.exceptions.InvalidOperationException;

public class SelectionStrategyForMatch {

    /**
     * Pick the successor with the best average reward, without any exploration bonus. Unvisited successors are never
     * preferred over visited ones; among equal scores the first successor in memoized order wins.
     */
    public <S extends State<S>> S execute(S node, SearchStatistics<S> statistics) {
        if (node.isTerminal()) {
            throw new InvalidOperationException("choose called on terminal state " + node);
        }

        // Nothing known yet
        if (!statistics.isExpanded(node)) {
            return node.randomSuccessor();
        }

        double bestScore = Double.NEGATIVE_INFINITY;
        S best = null;
        for (S child : statistics.getChildren(node)) {
            double score = getScore(statistics, child);
            if (best == null || score > bestScore) {
                bestScore = score;
                best = child;
            }
        }

        if (best == null) {
            throw new InvalidOperationException("choose called on state without successors " + node);
        }
        return best;
    }

    private <S extends State<S>> double getScore(SearchStatistics<S> statistics, S child) {
        int numVisits = statistics.getNumVisits(child);
        if (numVisits == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return statistics.getTotalReward(child) / numVisits;
    }
}
