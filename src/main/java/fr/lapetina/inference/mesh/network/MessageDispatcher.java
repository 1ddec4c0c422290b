package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.disruptor.handlers.InboundMessageHandler;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.handlers.HeartbeatHandler;
import fr.lapetina.inference.mesh.network.handlers.InferenceRequestHandler;
import fr.lapetina.inference.mesh.network.handlers.InferenceResponseHandler;
import fr.lapetina.inference.mesh.network.handlers.MessageHandler;
import fr.lapetina.inference.mesh.network.handlers.ModelAnnounceHandler;
import fr.lapetina.inference.mesh.network.handlers.ModelRequestHandler;
import fr.lapetina.inference.mesh.network.handlers.NetworkUpdateHandler;
import fr.lapetina.inference.mesh.network.handlers.NodeAnnounceHandler;
import fr.lapetina.inference.mesh.network.handlers.NodeQueryHandler;
import fr.lapetina.inference.mesh.network.handlers.NodeResponseHandler;

/**
 * Routes each inbound message to the handler for its type, after refreshing the
 * last-seen time of the originator and of the peer that relayed it.
 */
public final class MessageDispatcher implements InboundMessageHandler {

    private final NodeContext context;
    private final PeerTable peerTable;

    private final MessageHandler nodeAnnounce;
    private final MessageHandler nodeQuery;
    private final MessageHandler nodeResponse;
    private final MessageHandler modelAnnounce;
    private final MessageHandler modelRequest;
    private final MessageHandler inferenceRequest;
    private final MessageHandler inferenceResponse;
    private final MessageHandler heartbeat;
    private final MessageHandler networkUpdate;

    public MessageDispatcher(NodeContext context, PeerTable peerTable) {
        this.context = context;
        this.peerTable = peerTable;
        this.nodeAnnounce = new NodeAnnounceHandler(context);
        this.nodeQuery = new NodeQueryHandler(context);
        this.nodeResponse = new NodeResponseHandler(context);
        this.modelAnnounce = new ModelAnnounceHandler(context);
        this.modelRequest = new ModelRequestHandler(context);
        this.inferenceRequest = new InferenceRequestHandler(context);
        this.inferenceResponse = new InferenceResponseHandler(context);
        this.heartbeat = new HeartbeatHandler(context);
        this.networkUpdate = new NetworkUpdateHandler(context);
    }

    @Override
    public void handle(P2PMessage message, String fromPeerId) {
        refresh(message.senderId());
        refresh(message.lastHop());
        if (fromPeerId != null) {
            refresh(fromPeerId);
        }
        handlerFor(message).handle(message);
    }

    private void refresh(String nodeId) {
        if (nodeId.equals(context.selfId())) {
            return;
        }
        context.dht().touch(nodeId);
        peerTable.touch(nodeId);
    }

    MessageHandler handlerFor(P2PMessage message) {
        return switch (message.type()) {
            case NODE_ANNOUNCE -> nodeAnnounce;
            case NODE_QUERY -> nodeQuery;
            case NODE_RESPONSE -> nodeResponse;
            case MODEL_ANNOUNCE -> modelAnnounce;
            case MODEL_REQUEST -> modelRequest;
            case INFERENCE_REQUEST -> inferenceRequest;
            case INFERENCE_RESPONSE -> inferenceResponse;
            case HEARTBEAT -> heartbeat;
            case NETWORK_UPDATE -> networkUpdate;
        };
    }
}
