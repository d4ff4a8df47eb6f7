package com.tictactoe.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between wire text and {@link Message}/{@link Request} objects.
 *
 * Decoding happens at the connection boundary: text either becomes one of the
 * typed requests or a {@link ProtocolException} with the matching error code.
 *
 * The serializer is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Serializes a Message to a single-line JSON string (no trailing newline).
     */
    public String serialize(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * Parses the envelope of any protocol message, in either direction.
     *
     * @throws ProtocolException with INVALID_JSON, UNKNOWN_TYPE or INVALID_DATA
     */
    public Message deserialize(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.debug("Undecodable input: {}", json);
            throw new ProtocolException(ErrorCode.INVALID_JSON, "Invalid JSON format.", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(ErrorCode.INVALID_JSON, "Message must be a JSON object.");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException(ErrorCode.UNKNOWN_TYPE, "Message type is missing.");
        }
        MessageType type = MessageType.fromWireName(typeNode.asText());
        if (type == null) {
            throw new ProtocolException(ErrorCode.UNKNOWN_TYPE, "Unknown message type: " + typeNode.asText());
        }

        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            data = objectMapper.createObjectNode();
        } else if (!data.isObject()) {
            throw new ProtocolException(ErrorCode.INVALID_DATA, "Field 'data' must be an object.");
        }

        return Message.builder()
                .type(type)
                .data(data)
                .build();
    }

    /**
     * Decodes a client request into its typed form.
     *
     * @throws ProtocolException if the text is not a valid client request
     */
    public Request decodeRequest(String json) {
        Message message = deserialize(json);
        if (!message.getType().isClientToServer()) {
            throw new ProtocolException(ErrorCode.UNKNOWN_TYPE,
                    "Unknown message type: " + message.getType().getWireName());
        }
        JsonNode data = message.getData();

        return switch (message.getType()) {
            case JOIN -> JoinRequest.fromData(data);
            case MOVE -> MoveRequest.fromData(data);
            case CHAT -> ChatRequest.fromData(data);
            case QUIT -> QuitRequest.fromData(data);
            default -> throw new IllegalStateException("Unhandled request type: " + message.getType());
        };
    }

    /**
     * Creates a new JSON object node for building payloads.
     */
    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    public ArrayNode createArrayNode() {
        return objectMapper.createArrayNode();
    }

    /**
     * Gets the underlying ObjectMapper for advanced operations.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
