package fr.lapetina.inference.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.mesh.domain.event.EventState;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.domain.message.MessageCache;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second stage handler: drops messages whose id was already seen, including echoes of
 * messages this node originated.
 */
public final class DeduplicationHandler implements EventHandler<MessageEvent> {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationHandler.class);

    private final MessageCache messageCache;

    public DeduplicationHandler(MessageCache messageCache) {
        this.messageCache = messageCache;
    }

    @Override
    public void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }
        P2PMessage message = event.getMessage();
        if (!messageCache.markSeen(message.messageId())) {
            event.markDropped(EventState.DUPLICATE, "duplicate");
            log.debug("Duplicate dropped: messageId={}, type={}, from={}",
                    message.messageId(), message.type(), event.getFromPeerId());
        }
    }
}
