package com.tictactoe.game;

import com.tictactoe.player.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * One two-player game: the board, whose turn it is, and how it ended.
 *
 * Thread Safety Strategy:
 * - Every read or write of board/turn/status/version happens inside the
 *   session's monitor, so exactly one mutator runs against a game at a time
 * - Sessions share nothing with each other; two games never contend
 * - Callers get {@link GameSnapshot}s and must do their network I/O after the
 *   synchronized method has returned
 *
 * Concurrent moves from both players are decided by monitor acquisition order:
 * whichever request enters first is checked against the current turn, the other
 * is then checked against the updated state.
 */
public class GameSession {

    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    private final String gameId;
    private final Player playerX;
    private final Player playerO;

    // Guarded by this
    private final Board board;
    private Symbol turn;
    private GameStatus status;
    private Symbol winner;
    private long version;

    public GameSession(Player playerX, Player playerO) {
        this(UUID.randomUUID().toString(), playerX, playerO);
    }

    GameSession(String gameId, Player playerX, Player playerO) {
        if (playerX.getId().equals(playerO.getId())) {
            throw new IllegalArgumentException("A player cannot play against itself: " + playerX.getId());
        }
        this.gameId = gameId;
        this.playerX = playerX;
        this.playerO = playerO;
        this.board = new Board();
        this.turn = Symbol.X;
        this.status = GameStatus.IN_PROGRESS;
        this.version = 0;
    }

    // === Mutations ===

    /**
     * Applies a move for the given player.
     *
     * Checks run in a fixed order: turn (including game already over), then
     * bounds, then occupancy. A rejected move leaves the session untouched.
     *
     * @param playerId the requesting participant
     * @param position {row, col}; anything other than two in-range ints is out of bounds
     */
    public synchronized MoveResult submitMove(String playerId, int[] position) {
        Symbol mover = symbolOf(playerId);

        if (status != GameStatus.IN_PROGRESS || mover == null || mover != turn) {
            return MoveResult.rejected(MoveRejection.NOT_YOUR_TURN, snapshot());
        }
        if (position == null || position.length != 2) {
            return MoveResult.rejected(MoveRejection.OUT_OF_BOUNDS, snapshot());
        }
        int row = position[0];
        int col = position[1];
        if (!GameRules.isLegal(board, row, col)) {
            MoveRejection rejection = Board.inBounds(row, col)
                    ? MoveRejection.CELL_OCCUPIED
                    : MoveRejection.OUT_OF_BOUNDS;
            return MoveResult.rejected(rejection, snapshot());
        }

        board.place(row, col, mover);
        version++;

        Outcome outcome = GameRules.evaluate(board);
        if (outcome.isWon()) {
            status = GameStatus.WON;
            winner = outcome.getWinner();
            logger.info("Game {} won by {} ({})", gameId, participant(winner).getDisplayName(), winner);
        } else if (outcome.isDraw()) {
            status = GameStatus.DRAW;
            logger.info("Game {} ended in a draw", gameId);
        } else {
            turn = turn.opposite();
        }

        return MoveResult.accepted(snapshot());
    }

    /**
     * Abandons the game on behalf of a participant who quit or dropped.
     *
     * Only the first call that finds the game in progress performs the
     * transition; later calls, and calls on a game that already finished,
     * return false. The caller that gets true owns notifying the survivor.
     *
     * @return true if this call moved the session to ABANDONED
     */
    public synchronized boolean terminate(String playerId, TerminationReason reason) {
        if (symbolOf(playerId) == null) {
            throw new IllegalArgumentException("Player " + playerId + " is not part of game " + gameId);
        }
        if (status.isTerminal()) {
            return false;
        }
        status = GameStatus.ABANDONED;
        version++;
        logger.info("Game {} abandoned by {} ({})", gameId, playerId, reason);
        return true;
    }

    // === State Retrieval ===

    public synchronized GameSnapshot snapshot() {
        String nextPlayer = status == GameStatus.IN_PROGRESS ? participant(turn).getDisplayName() : null;
        String winnerMarker = null;
        if (status == GameStatus.WON) {
            winnerMarker = participant(winner).getDisplayName();
        } else if (status == GameStatus.DRAW) {
            winnerMarker = GameSnapshot.DRAW_MARKER;
        }
        return new GameSnapshot(gameId, board.view(), status, nextPlayer, winnerMarker, version);
    }

    public synchronized GameStatus getStatus() {
        return status;
    }

    public synchronized boolean isActive() {
        return status == GameStatus.IN_PROGRESS;
    }

    public synchronized Symbol getTurn() {
        return turn;
    }

    public synchronized long getVersion() {
        return version;
    }

    // === Participants (immutable, no lock needed) ===

    /** The symbol the player holds in this game, or null if not a participant. */
    public Symbol symbolOf(String playerId) {
        if (playerX.getId().equals(playerId)) {
            return Symbol.X;
        }
        if (playerO.getId().equals(playerId)) {
            return Symbol.O;
        }
        return null;
    }

    public boolean isParticipant(String playerId) {
        return symbolOf(playerId) != null;
    }

    public Player participant(Symbol symbol) {
        return symbol == Symbol.X ? playerX : playerO;
    }

    /** The other participant, or null if the given player is not in this game. */
    public Player opponentOf(String playerId) {
        Symbol symbol = symbolOf(playerId);
        return symbol == null ? null : participant(symbol.opposite());
    }

    public Player getPlayerX() {
        return playerX;
    }

    public Player getPlayerO() {
        return playerO;
    }

    public String getGameId() {
        return gameId;
    }

    @Override
    public synchronized String toString() {
        return "GameSession{" +
                "gameId='" + gameId + '\'' +
                ", x=" + playerX.getDisplayName() +
                ", o=" + playerO.getDisplayName() +
                ", status=" + status +
                ", turn=" + turn +
                ", version=" + version +
                '}';
    }
}
