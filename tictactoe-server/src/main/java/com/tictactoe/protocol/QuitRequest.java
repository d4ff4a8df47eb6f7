package com.tictactoe.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code quit}: {"game_id": "..."}.
 */
public final class QuitRequest extends Request {

    private final String gameId;

    public QuitRequest(String gameId) {
        this.gameId = gameId;
    }

    static QuitRequest fromData(JsonNode data) {
        return new QuitRequest(requireText(data, "game_id"));
    }

    @Override
    public MessageType getType() {
        return MessageType.QUIT;
    }

    public String getGameId() {
        return gameId;
    }
}
