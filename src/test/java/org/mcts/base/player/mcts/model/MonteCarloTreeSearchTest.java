package org.mcts.base.player.mcts.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;

import org.mcts.base.game.tictactoe.Piece;
import org.mcts.base.game.tictactoe.TicTacToeBoard;
import org.mcts.base.player.mcts.model.exceptions.InvalidOperationException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MonteCarloTreeSearchTest {

    @Test
    void freshEngineHasNoStatistics() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        TicTacToeBoard root = TicTacToeBoard.newBoard();

        assertEquals(0, tree.getStatistics().getNumVisits(root));
        assertEquals(0.0, tree.getStatistics().getTotalReward(root));
        assertEquals(0, tree.getStatistics().size());
    }

    /** One rollout from the empty board visits the root once with a loss, tie or win. */
    @Test
    void singleRolloutFromEmptyBoard() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        TicTacToeBoard root = TicTacToeBoard.newBoard();

        tree.rollout(root);

        assertEquals(1, tree.getStatistics().getNumVisits(root));
        double q = tree.getStatistics().getTotalReward(root);
        assertTrue(q == 0.0 || q == 0.5 || q == 1.0, "unexpected reward " + q);
        assertTrue(tree.getStatistics().isExpanded(root));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 7, 50, 300})
    void rootIsVisitedByEveryRollout(int k) {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        TicTacToeBoard root = TicTacToeBoard.newBoard();

        tree.rollout(root, k);

        assertEquals(k, tree.getStatistics().getNumVisits(root));
        double average = tree.getStatistics().getAverageReward(root);
        assertTrue(average >= 0 && average <= 1);
    }

    @Test
    void negativeRolloutCountIsRejected() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        assertThrows(IllegalArgumentException.class, () -> tree.rollout(TicTacToeBoard.newBoard(), -1));
    }

    /** The second rollout's path is [root, first child]; the root is credited the complement of the child. */
    @Test
    void parentIsCreditedComplementOfChild() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        SearchStatistics<TicTacToeBoard> statistics = tree.getStatistics();
        TicTacToeBoard root = TicTacToeBoard.newBoard();

        tree.rollout(root);
        double rootBefore = statistics.getTotalReward(root);
        TicTacToeBoard firstChild = statistics.getChildren(root).iterator().next();

        tree.rollout(root);

        assertEquals(1, statistics.getNumVisits(firstChild));
        double childReward = statistics.getTotalReward(firstChild);
        assertEquals(1 - childReward, statistics.getTotalReward(root) - rootBefore, 1e-12);
    }

    @Test
    void identicalEnginesProduceIdenticalStatistics() {
        MonteCarloTreeSearch<FirstCellBoard> a = new MonteCarloTreeSearch<>();
        MonteCarloTreeSearch<FirstCellBoard> b = new MonteCarloTreeSearch<>();
        FirstCellBoard root = FirstCellBoard.newBoard();

        for (int i = 0; i < 120; i++) {
            a.rollout(root);
            b.rollout(root);
        }

        Set<FirstCellBoard> states = a.getStatistics().getVisitedStates();
        assertEquals(states, b.getStatistics().getVisitedStates());
        for (FirstCellBoard state : states) {
            assertEquals(a.getStatistics().getNumVisits(state), b.getStatistics().getNumVisits(state));
            assertEquals(a.getStatistics().getTotalReward(state), b.getStatistics().getTotalReward(state));
        }
        assertEquals(a.choose(root), b.choose(root));
    }

    @Test
    void chooseReturnsASuccessorOfTheRoot() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        TicTacToeBoard root = TicTacToeBoard.newBoard().makeMove(4);

        tree.rollout(root, 100);
        TicTacToeBoard chosen = tree.choose(root);

        assertNotEquals(root, chosen);
        assertTrue(root.successors().contains(chosen));
    }

    @Test
    void chooseOnUnexploredRootFallsBackToRandomSuccessor() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        TicTacToeBoard root = TicTacToeBoard.newBoard();

        TicTacToeBoard chosen = tree.choose(root);

        assertTrue(root.successors().contains(chosen));
        assertFalse(tree.getStatistics().isExpanded(root));
    }

    /** X to move with two in a row; the immediate win must be found almost every time. */
    @Test
    void findsImmediateWin() {
        TicTacToeBoard root = TicTacToeBoard.of("XX_OO____", Piece.X);
        TicTacToeBoard winningMove = root.makeMove(2);

        int found = 0;
        for (int trial = 0; trial < 20; trial++) {
            MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
            tree.rollout(root, 200);
            if (tree.choose(root).equals(winningMove)) {
                found++;
            }
        }
        assertTrue(found >= 18, "winning move chosen only " + found + " of 20 times");
    }

    @Test
    void terminalRootCannotBeChosenFrom() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        TicTacToeBoard root = TicTacToeBoard.of("XXXOO____", Piece.O);

        assertThrows(InvalidOperationException.class, () -> tree.choose(root));
        tree.rollout(root);
        assertThrows(InvalidOperationException.class, () -> tree.choose(root));
    }

    /** A terminal root is its own leaf and is credited from the view of the player who moved into it. */
    @Test
    void rolloutOnTerminalRootRecordsTerminalValue() {
        MonteCarloTreeSearch<TicTacToeBoard> tree = new MonteCarloTreeSearch<>();
        SearchStatistics<TicTacToeBoard> statistics = tree.getStatistics();
        TicTacToeBoard xWon = TicTacToeBoard.of("XXXOO____", Piece.O);

        tree.rollout(xWon);
        assertEquals(1, statistics.getNumVisits(xWon));
        assertEquals(1.0, statistics.getTotalReward(xWon));
        assertTrue(statistics.isExpanded(xWon));
        assertTrue(statistics.getChildren(xWon).isEmpty());

        tree.rollout(xWon);
        assertEquals(2, statistics.getNumVisits(xWon));
        assertEquals(2.0, statistics.getTotalReward(xWon));
        assertEquals(1, statistics.size());
    }
}
