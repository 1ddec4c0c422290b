package fr.lapetina.inference.mesh.infrastructure.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Point-to-point byte transport between peers.
 *
 * Framing, encryption and NAT traversal are the implementation's concern.
 * Implementations must deliver messages from one sender to one receiver in order.
 */
public interface Transport extends AutoCloseable {

    /**
     * Address other peers use to reach this node.
     */
    String localAddress();

    /**
     * Opens a connection to the peer listening at {@code address}.
     *
     * @return future completing with the remote peer's node id, or failing with
     *         {@link TransportException} if the address is unreachable
     */
    CompletableFuture<String> connect(String address);

    /**
     * Sends an encoded message to a peer.
     *
     * @return future completing once the bytes are handed off, or failing with
     *         {@link TransportException}
     */
    CompletableFuture<Void> send(String peerId, byte[] data);

    /**
     * Registers the single inbound listener. Replaces any previous listener.
     */
    void onMessage(MessageListener listener);

    void disconnect(String peerId);

    @Override
    void close();

    /**
     * Receives raw inbound bytes along with the id of the peer that sent them.
     */
    @FunctionalInterface
    interface MessageListener {
        void onMessage(String fromPeerId, byte[] data);
    }
}
