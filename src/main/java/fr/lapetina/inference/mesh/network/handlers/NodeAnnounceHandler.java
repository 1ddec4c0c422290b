package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.NodeDescriptor;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds the announced peer to the DHT and connects to it.
 */
public final class NodeAnnounceHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(NodeAnnounceHandler.class);

    private final NodeContext context;

    public NodeAnnounceHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        NodeDescriptor node = message.payloadAs(MessagePayload.NodeAnnounce.class).node();
        context.learnPeer(node);
        log.debug("Node announced: nodeId={}, type={}, models={}, via={}",
                node.nodeId(), node.nodeType(), node.models(), message.lastHop());
    }
}
