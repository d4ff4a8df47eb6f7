package com.tictactoe.protocol;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tictactoe.game.GameSnapshot;
import com.tictactoe.game.Symbol;
import com.tictactoe.game.TerminationReason;

/**
 * Builds every server-to-client message. Field names here are the wire
 * contract shared with clients.
 */
public class Responses {

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_FAILURE = "failure";
    static final String STATUS_WAITING = "waiting";

    private final MessageSerializer serializer;

    public Responses(MessageSerializer serializer) {
        this.serializer = serializer;
    }

    public Message joinWaiting(String playerId) {
        ObjectNode data = serializer.createObjectNode();
        data.put("status", STATUS_WAITING);
        data.put("player_id", playerId);
        data.put("message", "Waiting for an opponent...");
        return message(MessageType.JOIN_ACK, data);
    }

    public Message joinSuccess(String gameId, String playerId, Symbol symbol, String opponentName) {
        ObjectNode data = serializer.createObjectNode();
        data.put("status", STATUS_SUCCESS);
        data.put("game_id", gameId);
        data.put("player_id", playerId);
        data.put("player_symbol", symbol.name());
        data.put("opponent", opponentName);
        return message(MessageType.JOIN_ACK, data);
    }

    /** Broadcast after an accepted move. */
    public Message moveAccepted(GameSnapshot snapshot) {
        ObjectNode data = gameState(snapshot);
        data.put("status", STATUS_SUCCESS);
        return message(MessageType.MOVE_ACK, data);
    }

    /** Sent to the requester only; the state is unchanged. */
    public Message moveRejected(GameSnapshot snapshot, ErrorCode code, String reason) {
        ObjectNode data = gameState(snapshot);
        data.put("status", STATUS_FAILURE);
        data.put("code", code.getCode());
        data.put("message", reason);
        return message(MessageType.MOVE_ACK, data);
    }

    public Message chatBroadcast(String gameId, String username, String text) {
        ObjectNode data = serializer.createObjectNode();
        data.put("game_id", gameId);
        data.put("username", username);
        data.put("message", text);
        return message(MessageType.CHAT_BROADCAST, data);
    }

    /** Confirms a quit to the player who asked for it. */
    public Message quitAck(String gameId) {
        ObjectNode data = serializer.createObjectNode();
        data.put("status", STATUS_SUCCESS);
        data.put("game_id", gameId);
        data.put("message", "You have left the game.");
        return message(MessageType.QUIT_ACK, data);
    }

    /** Tells the remaining participant the game is over because the other side left. */
    public Message opponentLeft(String gameId, String leaverName, TerminationReason reason) {
        ObjectNode data = serializer.createObjectNode();
        data.put("status", STATUS_SUCCESS);
        data.put("game_id", gameId);
        data.put("reason", reason == TerminationReason.QUIT ? "opponent_left" : "opponent_disconnected");
        data.put("message", leaverName + " has left the game.");
        return message(MessageType.QUIT_ACK, data);
    }

    public Message error(ErrorCode code, String text) {
        ObjectNode data = serializer.createObjectNode();
        data.put("code", code.getCode());
        data.put("message", text);
        return message(MessageType.ERROR, data);
    }

    private ObjectNode gameState(GameSnapshot snapshot) {
        ArrayNode rows = serializer.createArrayNode();
        for (String[] row : snapshot.getBoard()) {
            ArrayNode cells = rows.addArray();
            for (String cell : row) {
                cells.add(cell);
            }
        }

        ObjectNode data = serializer.createObjectNode();
        data.put("game_id", snapshot.getGameId());
        data.set("game_state", rows);
        // null values are written explicitly; clients read them as "game over" / "no winner yet"
        data.put("next_player", snapshot.getNextPlayer());
        data.put("winner", snapshot.getWinner());
        data.put("version", snapshot.getVersion());
        return data;
    }

    private Message message(MessageType type, ObjectNode data) {
        return Message.builder()
                .type(type)
                .data(data)
                .build();
    }
}
