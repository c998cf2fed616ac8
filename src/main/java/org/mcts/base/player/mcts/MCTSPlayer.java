package org.mcts.base.player.mcts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.player.mcts.event.TreeEvent;
import org.mcts.base.player.mcts.event.TreeStartEvent;
import org.mcts.base.player.mcts.model.MonteCarloTreeSearch;
import org.mcts.base.player.mcts.model.State;
import org.mcts.base.player.mcts.model.strategy.PoolOfStrategies;
import org.mcts.base.util.observer.Event;
import org.mcts.base.util.observer.Observer;
import org.mcts.base.util.observer.Subject;

import java.util.ArrayList;
import java.util.List;

/**
 * Plays moves with a {@link MonteCarloTreeSearch}, deciding how much search to spend on each one.
 */
public class MCTSPlayer<S extends State<S>> implements Subject {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final long SAFETY_MARGIN = 50;

    private final PoolOfStrategies strategies;
    private final List<Observer> observers = new ArrayList<>();

    private MonteCarloTreeSearch<S> tree = null;
    private int turnCount = 0;

    public MCTSPlayer() {
        this(new PoolOfStrategies());
    }

    public MCTSPlayer(PoolOfStrategies strategies) {
        this.strategies = strategies;
    }

    // Starts a new game with an empty tree
    public void start() {
        tree = new MonteCarloTreeSearch<>(strategies);
        turnCount = 0;
        notifyObservers(new TreeStartEvent());
    }

    public S selectMove(S currentState, int numRollouts) {
        ensureStarted();
        LOGGER.debug("Starting turn " + turnCount);

        tree.rollout(currentState, numRollouts);

        return finishTurn(currentState, numRollouts);
    }

    // Searches until finishBy - SAFETY_MARGIN (epoch millis), always doing at least one rollout
    public S selectMoveBy(S currentState, long finishBy) {
        ensureStarted();
        LOGGER.debug("Starting turn " + turnCount);

        long stopAt = finishBy - SAFETY_MARGIN;
        int iterations = 0;
        do {
            iterations++;
            tree.rollout(currentState);
        } while (System.currentTimeMillis() < stopAt);

        return finishTurn(currentState, iterations);
    }

    private S finishTurn(S currentState, int iterations) {
        S bestMove = tree.choose(currentState);
        LOGGER.info("Processed " + iterations + " rollouts, and playing: " + bestMove);
        notifyObservers(new TreeEvent<>(tree, currentState, bestMove, turnCount));
        turnCount++;
        return bestMove;
    }

    private void ensureStarted() {
        if (tree == null) {
            start();
        }
    }

    public MonteCarloTreeSearch<S> getTree() {
        return tree;
    }

    public int getTurnCount() {
        return turnCount;
    }

    @Override
    public void addObserver(Observer observer) {
        observers.add(observer);
    }

    @Override
    public void notifyObservers(Event event) {
        for (Observer observer : observers) {
            observer.observe(event);
        }
    }
}
