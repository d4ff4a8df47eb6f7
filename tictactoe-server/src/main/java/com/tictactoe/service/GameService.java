package com.tictactoe.service;

import com.tictactoe.game.GameRegistry;
import com.tictactoe.game.GameSession;
import com.tictactoe.game.GameSnapshot;
import com.tictactoe.game.Matchmaker;
import com.tictactoe.game.MoveResult;
import com.tictactoe.game.TerminationReason;
import com.tictactoe.player.Player;
import com.tictactoe.player.PlayerRegistry;
import com.tictactoe.player.PlayerStatus;
import com.tictactoe.protocol.ChatRequest;
import com.tictactoe.protocol.ErrorCode;
import com.tictactoe.protocol.JoinRequest;
import com.tictactoe.protocol.MoveRequest;
import com.tictactoe.protocol.QuitRequest;
import com.tictactoe.protocol.Responses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs the game protocol for decoded requests: matchmaking, moves, chat, and
 * teardown on quit or disconnect.
 *
 * Methods are called concurrently from every connection's event loop. All
 * shared state lives in {@link Matchmaker} and {@link GameSession}, each with
 * its own lock; this class only sequences calls to them and sends results once
 * those locks are released.
 */
public class GameService {

    private static final Logger logger = LoggerFactory.getLogger(GameService.class);

    private final PlayerRegistry playerRegistry;
    private final GameRegistry gameRegistry;
    private final Matchmaker matchmaker;
    private final Broadcaster broadcaster;
    private final Responses responses;

    public GameService(PlayerRegistry playerRegistry, GameRegistry gameRegistry, Matchmaker matchmaker,
                       Broadcaster broadcaster, Responses responses) {
        this.playerRegistry = playerRegistry;
        this.gameRegistry = gameRegistry;
        this.matchmaker = matchmaker;
        this.broadcaster = broadcaster;
        this.responses = responses;
    }

    /**
     * Handles a join: the player either waits or starts a game with the
     * player who was waiting. The joiner's ack is sent first, then the waiting
     * player is told the game has started.
     */
    public void join(Player player, JoinRequest request) {
        if (player.getStatus() != PlayerStatus.IDLE) {
            sendError(player, ErrorCode.ALREADY_JOINED, "Already " +
                    (player.getStatus() == PlayerStatus.WAITING ? "waiting for an opponent." : "in a game."));
            return;
        }

        playerRegistry.identify(player, request.getUsername(), request.getAvatar());
        Optional<GameSession> paired = matchmaker.tryPair(player);

        if (paired.isEmpty()) {
            broadcaster.sendTo(player, responses.joinWaiting(player.getId()));
            return;
        }

        GameSession session = paired.get();
        Player opponent = session.opponentOf(player.getId());
        broadcaster.sendTo(player, responses.joinSuccess(
                session.getGameId(), player.getId(), session.symbolOf(player.getId()), opponent.getDisplayName()));
        broadcaster.sendTo(opponent, responses.joinSuccess(
                session.getGameId(), opponent.getId(), session.symbolOf(opponent.getId()), player.getDisplayName()));
    }

    /**
     * Handles a move. A rejected move is answered to the requester only; an
     * accepted one is broadcast to both players with the full board.
     */
    public void move(Player player, MoveRequest request) {
        GameSession session = requireParticipation(player, request.getGameId());
        if (session == null) {
            return;
        }

        MoveResult result = session.submitMove(player.getId(), request.getPosition());
        GameSnapshot snapshot = result.getSnapshot();

        if (!result.isAccepted()) {
            logger.debug("Rejected move from {} in game {}: {}",
                    player.getDisplayName(), session.getGameId(), result.getRejection());
            ErrorCode code;
            String reason;
            switch (result.getRejection()) {
                case NOT_YOUR_TURN -> {
                    code = ErrorCode.NOT_YOUR_TURN;
                    reason = snapshot.isTerminal() ? "The game is over." : "It is not your turn.";
                }
                case OUT_OF_BOUNDS -> {
                    code = ErrorCode.INVALID_MOVE;
                    reason = "Position must be [row, col] with values 0 to 2.";
                }
                default -> {
                    code = ErrorCode.INVALID_MOVE;
                    reason = "Position already occupied.";
                }
            }
            broadcaster.sendTo(player, responses.moveRejected(snapshot, code, reason));
            return;
        }

        if (snapshot.isTerminal()) {
            // Free both players before they learn the result so an immediate re-join is accepted
            release(session);
            logger.info("Game {} ended. Winner: {}", session.getGameId(), snapshot.getWinner());
        }
        broadcaster.broadcast(session, responses.moveAccepted(snapshot));
    }

    /**
     * Relays a chat line to both participants, sender included.
     */
    public void chat(Player player, ChatRequest request) {
        GameSession session = requireParticipation(player, request.getGameId());
        if (session == null) {
            return;
        }
        if (!session.isActive()) {
            sendError(player, ErrorCode.GAME_OVER, "The game is over.");
            return;
        }

        logger.info("Game {}: {} says: {}", session.getGameId(), player.getDisplayName(), request.getMessage());
        broadcaster.broadcast(session,
                responses.chatBroadcast(session.getGameId(), player.getDisplayName(), request.getMessage()));
    }

    /**
     * Leaves a game on request. The requester always gets a quit_ack.
     */
    public void quit(Player player, QuitRequest request) {
        GameSession session = requireParticipation(player, request.getGameId());
        if (session == null) {
            return;
        }
        terminate(session, player, TerminationReason.QUIT);
    }

    /**
     * Cleans up after a closed connection: leaves the waiting slot, or abandons
     * the game the player was in. Nothing is sent to the disconnected side.
     */
    public void disconnect(Player player) {
        if (matchmaker.withdraw(player)) {
            return;
        }
        String gameId = player.getCurrentGameId();
        GameSession session = gameRegistry.get(gameId);
        if (session != null && session.isParticipant(player.getId())) {
            terminate(session, player, TerminationReason.DISCONNECT);
        }
    }

    /**
     * Single teardown path for quit and disconnect.
     *
     * Only the call that actually moved the game to ABANDONED notifies the
     * surviving participant, so the survivor hears about it exactly once even
     * when both sides leave at the same time.
     */
    private void terminate(GameSession session, Player player, TerminationReason reason) {
        boolean abandoned = session.terminate(player.getId(), reason);
        Player opponent = session.opponentOf(player.getId());
        release(session);

        if (reason == TerminationReason.QUIT) {
            broadcaster.sendTo(player, responses.quitAck(session.getGameId()));
        }
        if (abandoned) {
            logger.info("Game {}: {} has left the game ({})",
                    session.getGameId(), player.getDisplayName(), reason);
            broadcaster.sendTo(opponent,
                    responses.opponentLeft(session.getGameId(), player.getDisplayName(), reason));
        }
    }

    private void release(GameSession session) {
        gameRegistry.remove(session);
        session.getPlayerX().leaveGame(session.getGameId());
        session.getPlayerO().leaveGame(session.getGameId());
    }

    /**
     * Looks up the game and checks the player belongs to it, answering with an
     * error otherwise.
     *
     * @return the session, or null if an error has been sent
     */
    private GameSession requireParticipation(Player player, String gameId) {
        GameSession session = gameRegistry.get(gameId);
        if (session == null) {
            sendError(player, ErrorCode.INVALID_GAME, "Game not found.");
            return null;
        }
        if (!session.isParticipant(player.getId())) {
            sendError(player, ErrorCode.NOT_IN_GAME, "You are not a player in this game.");
            return null;
        }
        return session;
    }

    private void sendError(Player player, ErrorCode code, String message) {
        broadcaster.sendTo(player, responses.error(code, message));
    }
}
