package org.mcts.base.player.mcts.model;

import org.mcts.base.player.mcts.model.exceptions.InvariantViolationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class SearchStatistics<S extends State<S>> {

    private Map<S, Item> items; // Visit counts and accumulated rewards of every visited state
    private Map<S, Set<S>> children; // Memoized successors, only for expanded states

    public SearchStatistics() {
        items = new HashMap<>();
        children = new HashMap<>();
    }

    public int getNumVisits(S state) {
        Item item = items.get(state);
        return item == null ? 0 : item.numVisits;
    }

    public double getTotalReward(S state) {
        Item item = items.get(state);
        return item == null ? 0 : item.totalReward;
    }

    public double getAverageReward(S state) {
        int numVisits = getNumVisits(state);
        if (numVisits == 0) {
            throw new InvariantViolationException("No visits recorded for " + state);
        }
        return getTotalReward(state) / numVisits;
    }

    public void update(S state, double reward) {
        Item item = items.computeIfAbsent(state, s -> new Item());
        item.totalReward += reward;
        item.numVisits++;
    }

    public boolean isExpanded(S state) {
        return children.containsKey(state);
    }

    public Set<S> getChildren(S state) {
        Set<S> result = children.get(state);
        if (result == null) {
            throw new InvariantViolationException("State has not been expanded: " + state);
        }
        return result;
    }

    // Returns false if the state already had its successors memoized
    public boolean putChildren(S state, Set<S> successors) {
        if (children.containsKey(state)) {
            return false;
        }
        children.put(state, Collections.unmodifiableSet(new LinkedHashSet<>(successors)));
        return true;
    }

    public Set<S> getVisitedStates() {
        return Collections.unmodifiableSet(items.keySet());
    }

    public int size() {
        return items.size();
    }

    public int getExpandedCount() {
        return children.size();
    }

    private static class Item {
        private double totalReward;
        private int numVisits;
    }
}
