package com.tictactoe.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope of every message on the wire.
 *
 * This class is immutable for thread safety - once created, it cannot be modified.
 * The same instance is serialized once and sent to both participants.
 *
 * JSON format (one object per line):
 * {
 *     "type": "move_ack",
 *     "data": { ... }
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Message {

    private final MessageType type;
    private final JsonNode data;

    private Message(MessageType type, JsonNode data) {
        this.type = type;
        this.data = data;
    }

    public MessageType getType() {
        return type;
    }

    public JsonNode getData() {
        return data;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MessageType type;
        private JsonNode data;

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder data(JsonNode data) {
            this.data = data;
            return this;
        }

        public Message build() {
            if (type == null) {
                throw new IllegalStateException("Message type is required");
            }
            return new Message(type, data);
        }
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type +
                ", data=" + data +
                '}';
    }
}
