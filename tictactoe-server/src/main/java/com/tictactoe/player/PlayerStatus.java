package com.tictactoe.player;

/**
 * Where a connected player currently stands. A player is in exactly one of
 * these at any time.
 */
public enum PlayerStatus {
    /** Connected, not waiting and not in a game. */
    IDLE,
    /** Holding the matchmaking slot. */
    WAITING,
    /** Participant of a live game. */
    IN_GAME
}
