package com.tictactoe.game;

/**
 * Why a move was refused. The board and turn are untouched in every case.
 */
public enum MoveRejection {
    /** Not the requester's turn, or the game is already over. */
    NOT_YOUR_TURN,
    /** Position is not a row/column pair inside the board. */
    OUT_OF_BOUNDS,
    /** Target cell already holds a symbol. */
    CELL_OCCUPIED
}
