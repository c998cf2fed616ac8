package org.mcts.base.game.tictactoe;

public enum Piece {
    EMPTY, X, O;

    public Piece opponent() {
        switch (this) {
            case X:
                return O;
            case O:
                return X;
            default:
                return EMPTY;
        }
    }

    public static Piece fromSymbol(char symbol) {
        switch (symbol) {
            case 'X':
                return X;
            case 'O':
                return O;
            case '_':
                return EMPTY;
            default:
                throw new IllegalArgumentException("Unknown piece symbol: " + symbol);
        }
    }

    @Override
    public String toString() {
        return this == EMPTY ? "_" : name();
    }
}
