package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.P2PMessage;

/**
 * Applies one message type to node state. One implementation per {@code MessageType}.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(P2PMessage message);
}
