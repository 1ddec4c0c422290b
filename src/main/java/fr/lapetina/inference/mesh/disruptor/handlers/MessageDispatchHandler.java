package fr.lapetina.inference.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Third stage handler: hands the message to its type handler.
 * A failing handler marks the event but does not stop forwarding.
 */
public final class MessageDispatchHandler implements EventHandler<MessageEvent> {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatchHandler.class);

    private final InboundMessageHandler inboundHandler;

    public MessageDispatchHandler(InboundMessageHandler inboundHandler) {
        this.inboundHandler = inboundHandler;
    }

    @Override
    public void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }
        P2PMessage message = event.getMessage();
        try {
            inboundHandler.handle(message, event.getFromPeerId());
            event.markHandled();
        } catch (RuntimeException e) {
            event.markHandlerFailed(e.getMessage());
            log.error("Message handler failed: messageId={}, type={}, sender={}",
                    message.messageId(), message.type(), message.senderId(), e);
        }
    }
}
