package org.mcts.base.player.mcts.model.strategy;

public class PoolOfStrategies {

    private SelectionStrategy selectionStrategy;
    private SelectionStrategyForMatch selectionStrategyForMatch;
    private ExpansionStrategy expansionStrategy;
    private PlayoutStrategy playoutStrategy;

    public PoolOfStrategies() {
        this(new SelectionStrategy(), new SelectionStrategyForMatch(), new ExpansionStrategy(), new PlayoutStrategy());
    }

    public PoolOfStrategies(SelectionStrategy selectionStrategy,
                            SelectionStrategyForMatch selectionStrategyForMatch,
                            ExpansionStrategy expansionStrategy,
                            PlayoutStrategy playoutStrategy) {
        this.selectionStrategy = selectionStrategy;
        this.selectionStrategyForMatch = selectionStrategyForMatch;
        this.expansionStrategy = expansionStrategy;
        this.playoutStrategy = playoutStrategy;
    }

    public static PoolOfStrategies withExplorationWeight(double explorationWeight) {
        return new PoolOfStrategies(new SelectionStrategy(explorationWeight), new SelectionStrategyForMatch(),
                new ExpansionStrategy(), new PlayoutStrategy());
    }

    public SelectionStrategy getSelectionStrategy() {
        return selectionStrategy;
    }

    public SelectionStrategyForMatch getSelectionStrategyForMatch() {
        return selectionStrategyForMatch;
    }

    public ExpansionStrategy getExpansionStrategy() {
        return expansionStrategy;
    }

    public PlayoutStrategy getPlayoutStrategy() {
        return playoutStrategy;
    }
}
