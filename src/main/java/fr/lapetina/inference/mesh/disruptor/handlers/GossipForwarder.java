package fr.lapetina.inference.mesh.disruptor.handlers;

import fr.lapetina.inference.mesh.domain.message.P2PMessage;

/**
 * Relays a received gossip message to the next ring of peers.
 */
@FunctionalInterface
public interface GossipForwarder {

    /**
     * @return number of peers the relayed copy was sent to
     */
    int forward(P2PMessage message);
}
