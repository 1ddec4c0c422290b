package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes the sender's last-seen time and reported load.
 */
public final class HeartbeatHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatHandler.class);

    private final NodeContext context;

    public HeartbeatHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        MessagePayload.Heartbeat heartbeat = message.payloadAs(MessagePayload.Heartbeat.class);
        String sender = message.senderId();
        context.dht().touch(sender);
        context.dht().getNode(sender).ifPresent(node -> node.setCurrentLoad(heartbeat.load()));
        log.trace("Heartbeat: sender={}, load={}, activeInferences={}",
                sender, heartbeat.load(), heartbeat.activeInferences());
    }
}
