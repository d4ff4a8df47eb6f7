package com.tictactoe.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code move}: {"game_id": "...", "position": [row, col]}.
 *
 * The position must be an array of integers. Its length and range are not
 * checked here, and integers beyond the int range are mapped to an off-board
 * index; an array that is not an on-board pair is a rule violation
 * decided by the game, not a protocol error.
 */
public final class MoveRequest extends Request {

    private static final int OFF_BOARD = -1;

    private final String gameId;
    private final int[] position;

    public MoveRequest(String gameId, int[] position) {
        this.gameId = gameId;
        this.position = position.clone();
    }

    static MoveRequest fromData(JsonNode data) {
        String gameId = requireText(data, "game_id");

        JsonNode node = data.get("position");
        if (node == null || node.isNull()) {
            throw new ProtocolException(ErrorCode.MISSING_DATA, "Field 'position' is required.");
        }
        if (!node.isArray()) {
            throw new ProtocolException(ErrorCode.INVALID_DATA, "Field 'position' must be an array [row, col].");
        }
        int[] position = new int[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isIntegralNumber()) {
                throw new ProtocolException(ErrorCode.INVALID_DATA, "Field 'position' must contain integers.");
            }
            // too large for an int: still off the board
            position[i] = element.canConvertToInt() ? element.intValue() : OFF_BOARD;
        }
        return new MoveRequest(gameId, position);
    }

    @Override
    public MessageType getType() {
        return MessageType.MOVE;
    }

    public String getGameId() {
        return gameId;
    }

    public int[] getPosition() {
        return position.clone();
    }
}
