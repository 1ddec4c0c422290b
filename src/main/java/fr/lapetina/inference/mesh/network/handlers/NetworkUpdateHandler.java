package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evicts a node that announced it is leaving. Only the leaving node itself may announce it.
 */
public final class NetworkUpdateHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(NetworkUpdateHandler.class);

    private final NodeContext context;

    public NetworkUpdateHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        MessagePayload.NetworkUpdate update = message.payloadAs(MessagePayload.NetworkUpdate.class);
        if (!update.announcesLeave()) {
            log.debug("Unsupported network update ignored: updateType={}, sender={}",
                    update.updateType(), message.senderId());
            return;
        }
        String leaving = update.nodeId() != null ? update.nodeId() : message.senderId();
        if (!leaving.equals(message.senderId())) {
            log.warn("Ignoring leave announced on behalf of another node: nodeId={}, sender={}",
                    leaving, message.senderId());
            return;
        }
        context.dht().removeNode(leaving);
        context.router().disconnect(leaving);
        log.info("Node left the network: nodeId={}", leaving);
    }
}
