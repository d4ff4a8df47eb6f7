package com.tictactoe.game;

/**
 * Detached copy of a session's visible state, taken under the session lock and
 * broadcast after the lock is released. Immutable.
 */
public final class GameSnapshot {

    /** Winner marker sent when the board fills with no line. */
    public static final String DRAW_MARKER = "draw";

    private final String gameId;
    private final String[][] board;
    private final GameStatus status;
    private final String nextPlayer;
    private final String winner;
    private final long version;

    GameSnapshot(String gameId, String[][] board, GameStatus status,
                 String nextPlayer, String winner, long version) {
        this.gameId = gameId;
        this.board = board;
        this.status = status;
        this.nextPlayer = nextPlayer;
        this.winner = winner;
        this.version = version;
    }

    public String getGameId() {
        return gameId;
    }

    /** Rows of "X", "O" or "". Each call returns a fresh copy. */
    public String[][] getBoard() {
        String[][] copy = new String[board.length][];
        for (int i = 0; i < board.length; i++) {
            copy[i] = board[i].clone();
        }
        return copy;
    }

    public String cell(int row, int col) {
        return board[row][col];
    }

    public GameStatus getStatus() {
        return status;
    }

    /** Display name of the player to move, or null once the game is over. */
    public String getNextPlayer() {
        return nextPlayer;
    }

    /** Display name of the winner, {@link #DRAW_MARKER}, or null. */
    public String getWinner() {
        return winner;
    }

    public long getVersion() {
        return version;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "GameSnapshot{" +
                "gameId='" + gameId + '\'' +
                ", status=" + status +
                ", nextPlayer='" + nextPlayer + '\'' +
                ", winner='" + winner + '\'' +
                ", version=" + version +
                '}';
    }
}
