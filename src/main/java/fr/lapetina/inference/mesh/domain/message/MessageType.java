package fr.lapetina.inference.mesh.domain.message;

/**
 * Kinds of message exchanged between peers.
 *
 * Gossip types are re-broadcast by every receiver until their TTL runs out.
 * Direct types travel point to point and are never forwarded.
 */
public enum MessageType {
    NODE_ANNOUNCE(true, MessagePayload.NodeAnnounce.class),
    NODE_QUERY(false, MessagePayload.NodeQuery.class),
    NODE_RESPONSE(false, MessagePayload.NodeResponse.class),
    MODEL_ANNOUNCE(true, MessagePayload.ModelAnnounce.class),
    MODEL_REQUEST(true, MessagePayload.ModelRequest.class),
    INFERENCE_REQUEST(false, MessagePayload.InferenceRequest.class),
    INFERENCE_RESPONSE(false, MessagePayload.InferenceResponse.class),
    HEARTBEAT(true, MessagePayload.Heartbeat.class),
    NETWORK_UPDATE(true, MessagePayload.NetworkUpdate.class);

    private final boolean gossip;
    private final Class<? extends MessagePayload> payloadClass;

    MessageType(boolean gossip, Class<? extends MessagePayload> payloadClass) {
        this.gossip = gossip;
        this.payloadClass = payloadClass;
    }

    public boolean isGossip() {
        return gossip;
    }

    public Class<? extends MessagePayload> payloadClass() {
        return payloadClass;
    }
}
