package fr.lapetina.inference.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.mesh.domain.event.EventState;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.infrastructure.transport.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: turns raw transport bytes into a {@link P2PMessage}.
 * Undecodable input is dropped, never propagated.
 */
public final class DecodeHandler implements EventHandler<MessageEvent> {

    private static final Logger log = LoggerFactory.getLogger(DecodeHandler.class);

    private final MessageCodec codec;

    public DecodeHandler(MessageCodec codec) {
        this.codec = codec;
    }

    @Override
    public void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        if (event.getData() == null) {
            event.markDropped(EventState.DECODE_FAILED, "decode");
            return;
        }
        try {
            P2PMessage message = codec.decode(event.getData());
            event.markDecoded(message);
            log.debug("Message decoded: messageId={}, type={}, from={}, ttl={}, sequence={}",
                    message.messageId(), message.type(), event.getFromPeerId(), message.ttl(), sequence);
        } catch (MessageCodec.CodecException e) {
            event.markDropped(EventState.DECODE_FAILED, "decode");
            log.warn("Dropping undecodable message: from={}, bytes={}, reason={}",
                    event.getFromPeerId(), event.getData().length, e.getMessage());
        }
    }
}
