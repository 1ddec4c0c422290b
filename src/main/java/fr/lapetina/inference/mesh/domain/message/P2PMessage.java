package fr.lapetina.inference.mesh.domain.message;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope for every message exchanged between peers.
 * Immutable; forwarding produces a new envelope with a lower TTL and a longer path.
 *
 * @param messageId unique id used for de-duplication
 * @param ttl       remaining hops; a message whose TTL is zero or less is never transmitted
 * @param timestamp sender clock, epoch millis
 * @param path      node ids the message has traversed, starting with the sender
 */
public record P2PMessage(
        String messageId,
        MessageType type,
        String senderId,
        MessagePayload payload,
        int ttl,
        long timestamp,
        List<String> path
) {
    public static final int DEFAULT_TTL = 10;

    public P2PMessage {
        Objects.requireNonNull(messageId, "Message ID is required");
        Objects.requireNonNull(type, "Message type is required");
        Objects.requireNonNull(senderId, "Sender ID is required");
        Objects.requireNonNull(payload, "Payload is required");
        if (!type.payloadClass().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " does not match message type " + type);
        }
        path = path != null ? List.copyOf(path) : List.of(senderId);
    }

    /**
     * Creates a fresh message originating at {@code senderId}.
     */
    public static P2PMessage create(MessageType type, String senderId, MessagePayload payload,
                                    int ttl, long timestamp) {
        return new P2PMessage(UUID.randomUUID().toString(), type, senderId, payload,
                ttl, timestamp, List.of(senderId));
    }

    public static P2PMessage create(MessageType type, String senderId, MessagePayload payload,
                                    long timestamp) {
        return create(type, senderId, payload, DEFAULT_TTL, timestamp);
    }

    /**
     * Returns the copy relayed by {@code nodeId}: TTL decremented, node appended to the path
     * unless already present.
     */
    public P2PMessage forwardedBy(String nodeId) {
        List<String> newPath = path;
        if (!path.contains(nodeId)) {
            newPath = new ArrayList<>(path);
            newPath.add(nodeId);
        }
        return new P2PMessage(messageId, type, senderId, payload, ttl - 1, timestamp, newPath);
    }

    public boolean hasTraversed(String nodeId) {
        return path.contains(nodeId);
    }

    /**
     * Node that handed this message to the receiver.
     */
    public String lastHop() {
        return path.isEmpty() ? senderId : path.get(path.size() - 1);
    }

    public <T extends MessagePayload> T payloadAs(Class<T> payloadType) {
        return payloadType.cast(payload);
    }
}
