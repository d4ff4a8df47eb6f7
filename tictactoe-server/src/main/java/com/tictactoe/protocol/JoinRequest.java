package com.tictactoe.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code join}: {"username": "...", "avatar": "..."}. Both fields optional; the
 * server generates a name when none is given.
 */
public final class JoinRequest extends Request {

    private final String username;
    private final String avatar;

    public JoinRequest(String username, String avatar) {
        this.username = username;
        this.avatar = avatar;
    }

    static JoinRequest fromData(JsonNode data) {
        return new JoinRequest(optionalText(data, "username"), optionalText(data, "avatar"));
    }

    @Override
    public MessageType getType() {
        return MessageType.JOIN;
    }

    /** Requested display name, or null. */
    public String getUsername() {
        return username;
    }

    public String getAvatar() {
        return avatar;
    }
}
