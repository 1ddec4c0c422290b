package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.NodeDescriptor;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Learns every peer listed in a discovery reply.
 */
public final class NodeResponseHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(NodeResponseHandler.class);

    private final NodeContext context;

    public NodeResponseHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        MessagePayload.NodeResponse response = message.payloadAs(MessagePayload.NodeResponse.class);
        for (NodeDescriptor peer : response.peers()) {
            context.learnPeer(peer);
        }
        log.info("Discovered peers: from={}, count={}, knownNodes={}",
                message.senderId(), response.peers().size(), context.dht().knownNodeCount());
    }
}
