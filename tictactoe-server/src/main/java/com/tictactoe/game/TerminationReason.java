package com.tictactoe.game;

public enum TerminationReason {
    QUIT,
    DISCONNECT
}
