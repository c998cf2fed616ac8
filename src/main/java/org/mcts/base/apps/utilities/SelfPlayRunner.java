package org.mcts.base.apps.utilities;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.game.tictactoe.Piece;
import org.mcts.base.game.tictactoe.TicTacToeBoard;
import org.mcts.base.player.mcts.MCTSPlayer;

/**
 * Plays a series of tic-tac-toe games between the MCTS player and a uniformly random opponent.
 *
 * Usage: {@code SelfPlayRunner [games] [rollouts per move]}
 */
public class SelfPlayRunner {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final int DEFAULT_GAMES = 10;
    public static final int DEFAULT_ROLLOUTS = 200;

    public static void main(String[] args) {
        int games = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_GAMES;
        int rollouts = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_ROLLOUTS;

        Results results = run(games, rollouts);
        LOGGER.info("MCTS won " + results.getWins() + ", lost " + results.getLosses() + ", tied " + results.getTies() +
                " of " + games + " games");
    }

    public static Results run(int games, int rollouts) {
        if (games < 0 || rollouts < 0) {
            throw new IllegalArgumentException("Games and rollouts must not be negative");
        }
        Results results = new Results();
        for (int i = 0; i < games; i++) {
            // The MCTS player alternates between moving first and second
            Piece mctsPiece = i % 2 == 0 ? Piece.X : Piece.O;
            Piece winner = playGame(mctsPiece, rollouts);
            results.record(mctsPiece, winner);
            LOGGER.info("Game " + (i + 1) + ": MCTS played " + mctsPiece + ", " +
                    (winner == Piece.EMPTY ? "tie" : winner + " wins"));
        }
        return results;
    }

    public static Piece playGame(Piece mctsPiece, int rollouts) {
        MCTSPlayer<TicTacToeBoard> player = new MCTSPlayer<>();
        player.start();

        TicTacToeBoard board = TicTacToeBoard.newBoard();
        while (!board.isTerminal()) {
            if (board.getTurn() == mctsPiece) {
                board = player.selectMove(board, rollouts);
            } else {
                board = board.randomSuccessor();
            }
            LOGGER.debug(board);
        }
        return board.getWinner();
    }

    public static class Results {
        private int wins;
        private int losses;
        private int ties;

        void record(Piece mctsPiece, Piece winner) {
            if (winner == Piece.EMPTY) {
                ties++;
            } else if (winner == mctsPiece) {
                wins++;
            } else {
                losses++;
            }
        }

        public int getWins() {
            return wins;
        }

        public int getLosses() {
            return losses;
        }

        public int getTies() {
            return ties;
        }
    }
}
