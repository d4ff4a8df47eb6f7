package com.tictactoe.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Defines all message types of the game protocol.
 *
 * Client → Server:
 * - JOIN: Ask to be matched with an opponent
 * - MOVE: Place a symbol
 * - CHAT: Send a chat line to both participants
 * - QUIT: Leave the current game
 *
 * Server → Client:
 * - JOIN_ACK: Waiting for an opponent, or game started
 * - MOVE_ACK: Updated board (broadcast) or rejected move (requester only)
 * - CHAT_BROADCAST: Chat line from a participant
 * - QUIT_ACK: Own quit confirmed, or opponent left
 * - ERROR: Protocol or request error
 */
public enum MessageType {
    // Client → Server
    JOIN("join", true),
    MOVE("move", true),
    CHAT("chat", true),
    QUIT("quit", true),

    // Server → Client
    JOIN_ACK("join_ack", false),
    MOVE_ACK("move_ack", false),
    CHAT_BROADCAST("chat_broadcast", false),
    QUIT_ACK("quit_ack", false),
    ERROR("error", false);

    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;
    private final boolean clientToServer;

    MessageType(String wireName, boolean clientToServer) {
        this.wireName = wireName;
        this.clientToServer = clientToServer;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isClientToServer() {
        return clientToServer;
    }

    /**
     * Looks up a type by its wire name.
     *
     * @return the type, or null if the name is not part of the protocol
     */
    public static MessageType fromWireName(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }
}
