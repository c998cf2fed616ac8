package org.mcts.base.game.tictactoe;

import org.mcts.base.player.mcts.model.State;
import org.mcts.base.player.mcts.model.exceptions.InvalidOperationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * An immutable 3x3 tic-tac-toe position together with the player to move.
 *
 * Cells are indexed by row:
 * <pre>
 *   0 1 2
 *   3 4 5
 *   6 7 8
 * </pre>
 */
public final class TicTacToeBoard implements State<TicTacToeBoard> {

    public static final double LOSS_REWARD = 0;
    public static final double TIE_REWARD = 0.5;

    public static final int BOARD_SIZE = 3;
    public static final int NUM_CELLS = BOARD_SIZE * BOARD_SIZE;

    private static final int[][] WINNING_LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8}, // rows
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8}, // columns
            {0, 4, 8}, {2, 4, 6}             // diagonals
    };

    private final Piece[] cells;
    private final Piece turn;
    private final Piece winner;
    private final boolean terminal;

    private TicTacToeBoard(Piece[] cells, Piece turn) {
        this.cells = cells;
        this.turn = turn;
        this.winner = findWinner(cells);
        this.terminal = winner != Piece.EMPTY || !Arrays.asList(cells).contains(Piece.EMPTY);
    }

    public static TicTacToeBoard newBoard() {
        Piece[] cells = new Piece[NUM_CELLS];
        Arrays.fill(cells, Piece.EMPTY);
        return new TicTacToeBoard(cells, Piece.X);
    }

    /**
     * Build a position from nine symbols in index order, e.g. {@code "XX_OO____"}.
     */
    public static TicTacToeBoard of(String symbols, Piece turn) {
        if (symbols.length() != NUM_CELLS) {
            throw new IllegalArgumentException("Expected " + NUM_CELLS + " cells but got: " + symbols);
        }
        if (turn == Piece.EMPTY) {
            throw new IllegalArgumentException("The player to move must be X or O");
        }
        Piece[] cells = new Piece[NUM_CELLS];
        for (int i = 0; i < NUM_CELLS; i++) {
            cells[i] = Piece.fromSymbol(symbols.charAt(i));
        }
        return new TicTacToeBoard(cells, turn);
    }

    public static int rowColToIndex(int row, int col) {
        if (row < 0 || row >= BOARD_SIZE || col < 0 || col >= BOARD_SIZE) {
            throw new IllegalArgumentException("Cell out of range: " + row + "," + col);
        }
        return row * BOARD_SIZE + col;
    }

    public TicTacToeBoard makeMove(int index) {
        if (terminal) {
            throw new InvalidOperationException("makeMove called on finished board " + this);
        }
        if (index < 0 || index >= NUM_CELLS) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
        if (cells[index] != Piece.EMPTY) {
            throw new IllegalArgumentException("Cell " + index + " is already taken");
        }
        Piece[] next = cells.clone();
        next[index] = turn;
        return new TicTacToeBoard(next, turn.opponent());
    }

    public List<Integer> emptyCells() {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < NUM_CELLS; i++) {
            if (cells[i] == Piece.EMPTY) {
                result.add(i);
            }
        }
        return result;
    }

    @Override
    public Set<TicTacToeBoard> successors() {
        if (terminal) {
            return Collections.emptySet();
        }
        Set<TicTacToeBoard> result = new LinkedHashSet<>();
        for (int index : emptyCells()) {
            result.add(makeMove(index));
        }
        return result;
    }

    @Override
    public TicTacToeBoard randomSuccessor() {
        if (terminal) {
            throw new InvalidOperationException("randomSuccessor called on finished board " + this);
        }
        List<Integer> empty = emptyCells();
        return makeMove(empty.get(ThreadLocalRandom.current().nextInt(empty.size())));
    }

    @Override
    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public double reward() {
        if (!terminal) {
            throw new InvalidOperationException("reward called on nonterminal board " + this);
        }
        if (winner == turn) {
            // The player to move cannot have won already
            throw new InvalidOperationException("reward called on unreachable board " + this);
        }
        if (winner == turn.opponent()) {
            return LOSS_REWARD;
        }
        return TIE_REWARD;
    }

    public Piece getCell(int index) {
        return cells[index];
    }

    public Piece getTurn() {
        return turn;
    }

    public Piece getWinner() {
        return winner;
    }

    private static Piece findWinner(Piece[] cells) {
        for (int[] line : WINNING_LINES) {
            Piece first = cells[line[0]];
            if (first != Piece.EMPTY && first == cells[line[1]] && first == cells[line[2]]) {
                return first;
            }
        }
        return Piece.EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TicTacToeBoard)) {
            return false;
        }
        TicTacToeBoard other = (TicTacToeBoard) o;
        return turn == other.turn && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(cells) + turn.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("\n ");
        for (int col = 0; col < BOARD_SIZE; col++) {
            sb.append(' ').append(col + 1);
        }
        sb.append('\n');
        for (int row = 0; row < BOARD_SIZE; row++) {
            sb.append(row + 1);
            for (int col = 0; col < BOARD_SIZE; col++) {
                sb.append(' ').append(cells[rowColToIndex(row, col)]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
