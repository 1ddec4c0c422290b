package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.NodeDescriptor;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers peer discovery with this node's own descriptor followed by up to {@code count}
 * known peers closest to the requester.
 */
public final class NodeQueryHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(NodeQueryHandler.class);

    private final NodeContext context;

    public NodeQueryHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        MessagePayload.NodeQuery query = message.payloadAs(MessagePayload.NodeQuery.class);
        if (!MessagePayload.NodeQuery.DISCOVER_PEERS.equals(query.queryType())) {
            log.debug("Unsupported node query ignored: queryType={}, sender={}",
                    query.queryType(), message.senderId());
            return;
        }

        String requester = message.senderId();
        List<NodeDescriptor> peers = new ArrayList<>();
        peers.add(NodeDescriptor.from(context.self()));
        for (NodeCapability node : context.dht().findClosestNodes(requester, query.count() + 1)) {
            if (peers.size() > query.count()) {
                break;
            }
            if (!node.getNodeId().equals(requester)) {
                peers.add(NodeDescriptor.from(node));
            }
        }

        context.router().send(requester, context.newMessage(
                MessageType.NODE_RESPONSE, new MessagePayload.NodeResponse(peers)));
        log.debug("Answered peer discovery: requester={}, peers={}", requester, peers.size() - 1);
    }
}
