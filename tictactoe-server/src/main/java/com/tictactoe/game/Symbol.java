package com.tictactoe.game;

/**
 * The mark a participant places on the board.
 * X always moves first.
 */
public enum Symbol {
    X,
    O;

    public Symbol opposite() {
        return this == X ? O : X;
    }
}
