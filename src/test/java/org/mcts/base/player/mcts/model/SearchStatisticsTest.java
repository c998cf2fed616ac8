package org.mcts.base.player.mcts.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.mcts.base.game.tictactoe.TicTacToeBoard;
import org.mcts.base.player.mcts.model.exceptions.InvariantViolationException;
import org.junit.jupiter.api.*;

class SearchStatisticsTest {

    private final TicTacToeBoard root = TicTacToeBoard.newBoard();
    private SearchStatistics<TicTacToeBoard> statistics;

    @BeforeEach
    void setUp() {
        statistics = new SearchStatistics<>();
    }

    @Test
    void unseenStatesReadAsZero() {
        assertEquals(0, statistics.getNumVisits(root));
        assertEquals(0.0, statistics.getTotalReward(root));
        assertFalse(statistics.isExpanded(root));
        assertEquals(0, statistics.size());
    }

    @Test
    void updateAccumulatesVisitsAndReward() {
        statistics.update(root, 1.0);
        statistics.update(root, 0.5);

        assertEquals(2, statistics.getNumVisits(root));
        assertEquals(1.5, statistics.getTotalReward(root), 1e-12);
        assertEquals(0.75, statistics.getAverageReward(root), 1e-12);
        assertEquals(Set.of(root), statistics.getVisitedStates());
    }

    @Test
    void averageOfUnvisitedStateIsRejected() {
        assertThrows(InvariantViolationException.class, () -> statistics.getAverageReward(root));
    }

    @Test
    void childrenOfUnexpandedStateAreRejected() {
        assertThrows(InvariantViolationException.class, () -> statistics.getChildren(root));
    }

    @Test
    void childrenKeepSuccessorOrderAndNeverChange() {
        assertTrue(statistics.putChildren(root, root.successors()));
        List<TicTacToeBoard> first = new ArrayList<>(statistics.getChildren(root));
        assertEquals(new ArrayList<>(root.successors()), first);

        assertFalse(statistics.putChildren(root, Set.of()));
        assertEquals(first, new ArrayList<>(statistics.getChildren(root)));
        assertEquals(1, statistics.getExpandedCount());

        assertThrows(UnsupportedOperationException.class, () -> statistics.getChildren(root).clear());
    }

    @Test
    void expandingDoesNotCountAsVisit() {
        statistics.putChildren(root, root.successors());
        assertEquals(0, statistics.getNumVisits(root));
        assertEquals(0, statistics.size());
    }
}
