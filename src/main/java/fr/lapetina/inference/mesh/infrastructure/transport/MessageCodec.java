package fr.lapetina.inference.mesh.infrastructure.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON wire codec for {@link P2PMessage}.
 *
 * The envelope is a flat object ({@code messageId, type, senderId, payload, ttl, timestamp, path});
 * the payload's record class is chosen from {@code type}.
 */
public final class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(P2PMessage message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to encode message " + message.messageId(), e);
        }
    }

    /**
     * Decodes an envelope.
     *
     * @throws CodecException if the bytes are not a well-formed message
     */
    public P2PMessage decode(byte[] data) {
        try {
            JsonNode root = objectMapper.readTree(data);
            if (root == null || !root.isObject()) {
                throw new CodecException("Message is not a JSON object");
            }

            MessageType type = MessageType.valueOf(requiredText(root, "type"));
            JsonNode payloadNode = root.get("payload");
            if (payloadNode == null || payloadNode.isNull()) {
                throw new CodecException("Missing payload for " + type);
            }
            MessagePayload payload = objectMapper.treeToValue(payloadNode, type.payloadClass());

            List<String> path = new ArrayList<>();
            JsonNode pathNode = root.get("path");
            if (pathNode != null && pathNode.isArray()) {
                pathNode.forEach(hop -> path.add(hop.asText()));
            }

            return new P2PMessage(
                    requiredText(root, "messageId"),
                    type,
                    requiredText(root, "senderId"),
                    payload,
                    root.path("ttl").asInt(P2PMessage.DEFAULT_TTL),
                    root.path("timestamp").asLong(),
                    path.isEmpty() ? null : path
            );
        } catch (IOException e) {
            throw new CodecException("Malformed message: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CodecException("Invalid message: " + e.getMessage(), e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            throw new CodecException("Missing field: " + field);
        }
        return node.asText();
    }

    /**
     * Raised when a message cannot be encoded or decoded.
     */
    public static class CodecException extends RuntimeException {
        public CodecException(String message) {
            super(message);
        }

        public CodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
