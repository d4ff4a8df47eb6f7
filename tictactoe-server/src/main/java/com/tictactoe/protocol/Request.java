package com.tictactoe.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded client request. One subclass per client-to-server
 * {@link MessageType}, each with its own typed fields.
 */
public abstract class Request {

    public abstract MessageType getType();

    static String requireText(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            throw new ProtocolException(ErrorCode.MISSING_DATA, "Field '" + field + "' is required.");
        }
        if (!node.isTextual()) {
            throw new ProtocolException(ErrorCode.INVALID_DATA, "Field '" + field + "' must be a string.");
        }
        if (node.asText().isBlank()) {
            throw new ProtocolException(ErrorCode.MISSING_DATA, "Field '" + field + "' must not be empty.");
        }
        return node.asText();
    }

    /** Returns the text value, or null when the field is absent, null or blank. */
    static String optionalText(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ProtocolException(ErrorCode.INVALID_DATA, "Field '" + field + "' must be a string.");
        }
        return node.asText().isBlank() ? null : node.asText();
    }
}
