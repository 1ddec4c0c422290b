package fr.lapetina.inference.mesh.disruptor.handlers;

import fr.lapetina.inference.mesh.domain.message.P2PMessage;

/**
 * Applies a decoded, de-duplicated message to node state.
 */
@FunctionalInterface
public interface InboundMessageHandler {

    void handle(P2PMessage message, String fromPeerId);
}
