package com.tictactoe.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code chat}: {"game_id": "...", "message": "..."}.
 */
public final class ChatRequest extends Request {

    private final String gameId;
    private final String message;

    public ChatRequest(String gameId, String message) {
        this.gameId = gameId;
        this.message = message;
    }

    static ChatRequest fromData(JsonNode data) {
        return new ChatRequest(requireText(data, "game_id"), requireText(data, "message"));
    }

    @Override
    public MessageType getType() {
        return MessageType.CHAT;
    }

    public String getGameId() {
        return gameId;
    }

    public String getMessage() {
        return message;
    }
}
