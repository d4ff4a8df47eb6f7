package com.tictactoe.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Codes carried in {@code error} messages and rejected {@code move_ack}s.
 */
public enum ErrorCode {
    INVALID_JSON("invalid_json"),
    UNKNOWN_TYPE("unknown_type"),
    MISSING_DATA("missing_data"),
    INVALID_DATA("invalid_data"),
    MESSAGE_TOO_LONG("message_too_long"),
    ALREADY_JOINED("already_joined"),
    INVALID_GAME("invalid_game"),
    NOT_IN_GAME("not_in_game"),
    GAME_OVER("game_over"),
    NOT_YOUR_TURN("not_your_turn"),
    INVALID_MOVE("invalid_move"),
    SERVER_FULL("server_full"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
