package com.tictactoe.game;

/**
 * Lifecycle of a {@link GameSession}. Everything but IN_PROGRESS is terminal.
 */
public enum GameStatus {
    IN_PROGRESS,
    WON,
    DRAW,
    ABANDONED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
