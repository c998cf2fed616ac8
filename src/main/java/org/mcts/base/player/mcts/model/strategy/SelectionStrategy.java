package org.mcts.base.player.mcts.model.strategy;

import org.mcts.base.player.mcts.model.SearchStatistics;
import org.mcts.base.player.mcts.model.State;
import org.mcts.base.player.mcts.model.exceptions.InvariantViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;

public class SelectionStrategy {

    public static final double DEFAULT_EXPLORATION_WEIGHT = 1.0;

    private final double explorationWeight;

    public SelectionStrategy() {
        this(DEFAULT_EXPLORATION_WEIGHT);
    }

    public SelectionStrategy(double explorationWeight) {
        if (!Double.isFinite(explorationWeight) || explorationWeight < 0) {
            throw new IllegalArgumentException("Exploration weight must be finite and non-negative: " + explorationWeight);
        }
        this.explorationWeight = explorationWeight;
    }

    public double getExplorationWeight() {
        return explorationWeight;
    }

    /**
     * Walk down from the root through fully expanded states, stopping at the first frontier state.
     *
     * @return the path from the root to the state that should be expanded and played out next.
     */
    public <S extends State<S>> List<S> execute(S root, SearchStatistics<S> statistics) {
        List<S> path = new ArrayList<>();
        S node = root;
        while (true) {
            path.add(node);

            // Unexplored or terminal
            if (!statistics.isExpanded(node) || statistics.getChildren(node).isEmpty()) {
                return path;
            }

            S unexplored = getFirstUnexpanded(statistics.getChildren(node), statistics);
            if (unexplored != null) {
                path.add(unexplored);
                return path;
            }

            node = uctSelect(node, statistics);
        }
    }

    private <S extends State<S>> S getFirstUnexpanded(Set<S> children, SearchStatistics<S> statistics) {
        for (S child : children) {
            if (!statistics.isExpanded(child)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Pick the child with the highest upper confidence bound. Ties go to the child met first in memoized order.
     */
    public <S extends State<S>> S uctSelect(S node, SearchStatistics<S> statistics) {
        if (!statistics.isExpanded(node)) {
            throw new InvariantViolationException("UCT selection on unexpanded state " + node);
        }
        int parentNumVisits = statistics.getNumVisits(node);
        if (parentNumVisits == 0) {
            throw new InvariantViolationException("UCT selection on unvisited state " + node);
        }

        double logParentNumVisits = Math.log(parentNumVisits);
        double bestScore = Double.NEGATIVE_INFINITY;
        S best = null;
        for (S child : statistics.getChildren(node)) {
            int childNumVisits = statistics.getNumVisits(child);
            if (!statistics.isExpanded(child) || childNumVisits == 0) {
                throw new InvariantViolationException("UCT selection reached unexpanded or unvisited child " + child + " of " + node);
            }
            double score = getExploitationScore(statistics, child) +
                    getExplorationScore(logParentNumVisits, childNumVisits);
            if (score > bestScore) {
                bestScore = score;
                best = child;
            }
        }

        if (best == null) {
            throw new InvariantViolationException("UCT selection on state without children " + node);
        }
        return best;
    }

    private <S extends State<S>> double getExploitationScore(SearchStatistics<S> statistics, S child) {
        return statistics.getTotalReward(child) / statistics.getNumVisits(child);
    }

    private double getExplorationScore(double logParentNumVisits, int childNumVisits) {
        return explorationWeight * Math.sqrt(logParentNumVisits / childNumVisits);
    }

    // Each step up the path hands the reward to the opponent
    public <S extends State<S>> void backPropagation(List<S> path, double reward, SearchStatistics<S> statistics) {
        ListIterator<S> iterator = path.listIterator(path.size());
        while (iterator.hasPrevious()) {
            statistics.update(iterator.previous(), reward);
            reward = 1 - reward;
        }
    }
}
