package com.tictactoe.game;

/**
 * Tic-tac-toe rules as pure functions over a board.
 *
 * Holds no state and takes no locks; {@link GameSession} calls it while holding
 * its own lock, tests call it directly.
 */
public final class GameRules {

    // 3 rows, 3 columns, 2 diagonals as {row, col} triples
    private static final int[][][] LINES = {
            {{0, 0}, {0, 1}, {0, 2}},
            {{1, 0}, {1, 1}, {1, 2}},
            {{2, 0}, {2, 1}, {2, 2}},
            {{0, 0}, {1, 0}, {2, 0}},
            {{0, 1}, {1, 1}, {2, 1}},
            {{0, 2}, {1, 2}, {2, 2}},
            {{0, 0}, {1, 1}, {2, 2}},
            {{0, 2}, {1, 1}, {2, 0}}
    };

    private GameRules() {
    }

    /** Whether the cell is on the board and still empty. */
    public static boolean isLegal(Board board, int row, int col) {
        return Board.inBounds(row, col) && board.isEmpty(row, col);
    }

    /**
     * Evaluates the board. Returns the first complete line found; with legal
     * alternating play at most one line can be complete, so line order does not
     * change the result.
     */
    public static Outcome evaluate(Board board) {
        for (int[][] line : LINES) {
            Symbol first = board.get(line[0][0], line[0][1]);
            if (first != null
                    && first == board.get(line[1][0], line[1][1])
                    && first == board.get(line[2][0], line[2][1])) {
                return Outcome.winOf(first);
            }
        }
        if (board.isFull()) {
            return Outcome.DRAW;
        }
        return Outcome.ONGOING;
    }
}
