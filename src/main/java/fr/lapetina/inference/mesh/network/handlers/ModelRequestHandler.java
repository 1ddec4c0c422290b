package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Answers a model lookup with a direct MODEL_ANNOUNCE when this node hosts the model.
 * The reply carries a TTL of one so the requester does not re-gossip it.
 */
public final class ModelRequestHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(ModelRequestHandler.class);

    private final NodeContext context;

    public ModelRequestHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        String modelId = message.payloadAs(MessagePayload.ModelRequest.class).modelId();
        if (modelId == null || !context.self().hostsModel(modelId)) {
            return;
        }

        Map<String, Object> modelInfo = context.dht().getData("model:" + modelId)
                .filter(MessagePayload.ModelAnnounce.class::isInstance)
                .map(MessagePayload.ModelAnnounce.class::cast)
                .filter(announce -> context.selfId().equals(announce.nodeId()))
                .map(MessagePayload.ModelAnnounce::modelInfo)
                .orElse(Map.of());

        MessagePayload.ModelAnnounce reply = new MessagePayload.ModelAnnounce(
                modelId, context.selfId(), modelInfo, context.clock().millis(), null, null);
        P2PMessage response = P2PMessage.create(
                MessageType.MODEL_ANNOUNCE, context.selfId(), reply, 1, context.clock().millis());

        context.router().send(message.senderId(), response);
        log.debug("Answered model request: modelId={}, requester={}", modelId, message.senderId());
    }
}
