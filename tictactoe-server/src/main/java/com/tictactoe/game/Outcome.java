package com.tictactoe.game;

/**
 * Result of evaluating a board: still going, won by one symbol, or drawn.
 * Immutable.
 */
public final class Outcome {

    public static final Outcome ONGOING = new Outcome(Kind.ONGOING, null);
    public static final Outcome DRAW = new Outcome(Kind.DRAW, null);

    private static final Outcome X_WINS = new Outcome(Kind.WON, Symbol.X);
    private static final Outcome O_WINS = new Outcome(Kind.WON, Symbol.O);

    public enum Kind {
        ONGOING,
        WON,
        DRAW
    }

    private final Kind kind;
    private final Symbol winner;

    private Outcome(Kind kind, Symbol winner) {
        this.kind = kind;
        this.winner = winner;
    }

    public static Outcome winOf(Symbol symbol) {
        return symbol == Symbol.X ? X_WINS : O_WINS;
    }

    public Kind getKind() {
        return kind;
    }

    /** The winning symbol, or null unless {@link #isWon()}. */
    public Symbol getWinner() {
        return winner;
    }

    public boolean isWon() {
        return kind == Kind.WON;
    }

    public boolean isDraw() {
        return kind == Kind.DRAW;
    }

    public boolean isTerminal() {
        return kind != Kind.ONGOING;
    }

    @Override
    public String toString() {
        return kind == Kind.WON ? "WON(" + winner + ")" : kind.name();
    }
}
