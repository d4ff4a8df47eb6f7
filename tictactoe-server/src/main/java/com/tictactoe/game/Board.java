package com.tictactoe.game;

/**
 * 3x3 tic-tac-toe grid.
 *
 * A cell holds a {@link Symbol} or {@code null} when empty. The board does no
 * legality checks of its own; {@link GameRules} decides whether a placement is
 * allowed and {@link GameSession} is the only writer.
 *
 * Not thread-safe. Callers that share a board must guard it externally.
 */
public class Board {

    public static final int SIZE = 3;

    /** Wire representation of an empty cell. */
    public static final String EMPTY_CELL = "";

    private final Symbol[][] grid = new Symbol[SIZE][SIZE];

    public Board() {
    }

    /**
     * Builds a board from rows such as {@code "XO."}, where any character other
     * than X or O is an empty cell. Mostly useful for setting up positions.
     */
    public static Board of(String... rows) {
        if (rows.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows, got " + rows.length);
        }
        Board board = new Board();
        for (int row = 0; row < SIZE; row++) {
            String line = rows[row];
            if (line.length() != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have " + SIZE + " cells: '" + line + "'");
            }
            for (int col = 0; col < SIZE; col++) {
                char c = line.charAt(col);
                if (c == 'X') {
                    board.grid[row][col] = Symbol.X;
                } else if (c == 'O') {
                    board.grid[row][col] = Symbol.O;
                }
            }
        }
        return board;
    }

    public static boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** Returns the symbol at the cell, or null if the cell is empty. */
    public Symbol get(int row, int col) {
        return grid[row][col];
    }

    public boolean isEmpty(int row, int col) {
        return grid[row][col] == null;
    }

    public void place(int row, int col, Symbol symbol) {
        grid[row][col] = symbol;
    }

    public boolean isFull() {
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                if (grid[row][col] == null) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Detached snapshot in wire form: "X", "O" or "" per cell.
     * Safe to hand to another thread after the board keeps changing.
     */
    public String[][] view() {
        String[][] view = new String[SIZE][SIZE];
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                Symbol symbol = grid[row][col];
                view[row][col] = symbol == null ? EMPTY_CELL : symbol.name();
            }
        }
        return view;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                Symbol symbol = grid[row][col];
                sb.append(symbol == null ? '.' : symbol.name().charAt(0));
            }
            if (row < SIZE - 1) {
                sb.append('/');
            }
        }
        return "Board{" + sb + '}';
    }
}
