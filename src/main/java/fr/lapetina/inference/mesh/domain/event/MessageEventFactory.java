package fr.lapetina.inference.mesh.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link MessageEvent} slots for the inbound ring buffer.
 */
public final class MessageEventFactory implements EventFactory<MessageEvent> {

    @Override
    public MessageEvent newInstance() {
        return new MessageEvent();
    }
}
