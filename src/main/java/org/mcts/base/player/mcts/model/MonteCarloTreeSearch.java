package org.mcts.base.player.mcts.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.player.mcts.model.strategy.PoolOfStrategies;

import java.util.List;

/**
 * Monte Carlo tree search over any {@link State} graph.
 *
 * Statistics accumulate across calls, so repeated {@link #rollout(State)} calls from successive positions of the same
 * game reuse everything learnt so far. Not thread-safe.
 *
 * @param <S> the state type being searched
 */
public class MonteCarloTreeSearch<S extends State<S>> {

    private static final Logger LOGGER = LogManager.getLogger();

    private final SearchStatistics<S> statistics;
    private final PoolOfStrategies strategies;

    public MonteCarloTreeSearch() {
        this(new PoolOfStrategies());
    }

    public MonteCarloTreeSearch(PoolOfStrategies strategies) {
        this.strategies = strategies;
        statistics = new SearchStatistics<>();
    }

    /**
     * Run one select / expand / playout / back-propagate iteration from the given root.
     *
     * A terminal root is its own leaf: it is expanded to an empty successor set and credited with its terminal value
     * from the point of view of the player who moved into it.
     */
    public void rollout(S root) {
        // Select a path to an unexplored leaf
        List<S> path = strategies.getSelectionStrategy().execute(root, statistics);
        S leaf = path.get(path.size() - 1);

        strategies.getExpansionStrategy().execute(leaf, statistics);

        double reward = strategies.getPlayoutStrategy().execute(leaf);

        strategies.getSelectionStrategy().backPropagation(path, reward, statistics);

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Rollout reached depth " + (path.size() - 1) + ", reward " + reward + " for " + leaf);
        }
    }

    public void rollout(S root, int numRollouts) {
        if (numRollouts < 0) {
            throw new IllegalArgumentException("Number of rollouts must not be negative: " + numRollouts);
        }
        for (int i = 0; i < numRollouts; i++) {
            rollout(root);
        }
    }

    /**
     * @return the best known successor of the state, or a random one if the state was never expanded.
     */
    public S choose(S node) {
        S best = strategies.getSelectionStrategyForMatch().execute(node, statistics);
        LOGGER.debug("Chose " + best + " after " + statistics.getNumVisits(node) + " visits");
        return best;
    }

    public SearchStatistics<S> getStatistics() {
        return statistics;
    }

    public PoolOfStrategies getStrategies() {
        return strategies;
    }
}
