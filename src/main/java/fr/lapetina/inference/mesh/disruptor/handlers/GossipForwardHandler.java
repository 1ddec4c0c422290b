package fr.lapetina.inference.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fourth stage handler: relays gossip types. Direct types stop here.
 */
public final class GossipForwardHandler implements EventHandler<MessageEvent> {

    private static final Logger log = LoggerFactory.getLogger(GossipForwardHandler.class);

    private final GossipForwarder forwarder;

    public GossipForwardHandler(GossipForwarder forwarder) {
        this.forwarder = forwarder;
    }

    @Override
    public void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }
        P2PMessage message = event.getMessage();
        if (!message.type().isGossip()) {
            return;
        }
        int peers = forwarder.forward(message);
        if (peers > 0) {
            event.markForwarded(peers);
            log.debug("Gossip forwarded: messageId={}, type={}, ttl={}, peers={}",
                    message.messageId(), message.type(), message.ttl() - 1, peers);
        }
    }
}
