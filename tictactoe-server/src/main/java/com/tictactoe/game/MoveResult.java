package com.tictactoe.game;

/**
 * Outcome of {@link GameSession#submitMove}. Either accepted, or rejected with
 * a reason; both carry the session state as of the decision.
 */
public final class MoveResult {

    private final MoveRejection rejection;
    private final GameSnapshot snapshot;

    private MoveResult(MoveRejection rejection, GameSnapshot snapshot) {
        this.rejection = rejection;
        this.snapshot = snapshot;
    }

    static MoveResult accepted(GameSnapshot snapshot) {
        return new MoveResult(null, snapshot);
    }

    static MoveResult rejected(MoveRejection rejection, GameSnapshot snapshot) {
        return new MoveResult(rejection, snapshot);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    /** Null when the move was accepted. */
    public MoveRejection getRejection() {
        return rejection;
    }

    public GameSnapshot getSnapshot() {
        return snapshot;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "MoveResult{accepted, " + snapshot + '}'
                : "MoveResult{rejected=" + rejection + ", " + snapshot + '}';
    }
}
