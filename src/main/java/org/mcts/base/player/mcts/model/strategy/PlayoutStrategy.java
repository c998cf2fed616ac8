package org.mcts.base.player.mcts.model.strategy;

import org.mcts.base.player.mcts.model.State;

public class PlayoutStrategy {

    // Return value is the reward for the player who moved into startNode
    public <S extends State<S>> double execute(S startNode) {
        S node = startNode;
        boolean invertReward = true;
        while (!node.isTerminal()) {
            node = node.randomSuccessor();
            invertReward = !invertReward;
        }

        double reward = node.reward();
        return invertReward ? 1 - reward : reward;
    }
}
