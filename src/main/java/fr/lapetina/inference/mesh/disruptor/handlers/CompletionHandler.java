package fr.lapetina.inference.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.mesh.domain.event.EventState;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: logs the outcome and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<MessageEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        try {
            logSummary(event);
            event.markCompleted();
        } finally {
            event.clear();
        }
    }

    private void logSummary(MessageEvent event) {
        P2PMessage message = event.getMessage();
        if (message == null) {
            return;
        }
        if (event.getState() == EventState.HANDLER_FAILED) {
            log.warn("Message processed with errors: messageId={}, type={}, sender={}, error={}",
                    message.messageId(), message.type(), message.senderId(), event.getErrorMessage());
        } else if (log.isTraceEnabled()) {
            log.trace("Message processed: messageId={}, type={}, sender={}, state={}, forwardedTo={}",
                    message.messageId(), message.type(), message.senderId(),
                    event.getState(), event.getForwardedTo());
        }
    }
}
