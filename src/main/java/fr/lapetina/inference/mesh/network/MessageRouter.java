package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.disruptor.handlers.GossipForwarder;
import fr.lapetina.inference.mesh.domain.message.MessageCache;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.mesh.infrastructure.transport.MessageCodec;
import fr.lapetina.inference.mesh.infrastructure.transport.Transport;
import fr.lapetina.inference.mesh.infrastructure.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of the message substrate: direct sends, broadcasts and gossip relays.
 *
 * Every relay, including the first broadcast by the originator, produces a copy with the
 * TTL decremented and this node appended to the path. A copy whose TTL reaches zero is
 * dropped, and peers already on the path are skipped.
 */
public final class MessageRouter implements GossipForwarder {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final String selfId;
    private final Transport transport;
    private final MessageCodec codec;
    private final PeerTable peerTable;
    private final MessageCache messageCache;
    private final MetricsRegistry metricsRegistry;

    public MessageRouter(
            String selfId,
            Transport transport,
            MessageCodec codec,
            PeerTable peerTable,
            MessageCache messageCache,
            MetricsRegistry metricsRegistry
    ) {
        this.selfId = selfId;
        this.transport = transport;
        this.codec = codec;
        this.peerTable = peerTable;
        this.messageCache = messageCache;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Connects to the peer at {@code address} and adds it to the peer table.
     *
     * @return future completing with the remote node id
     */
    public CompletableFuture<String> connect(String address) {
        return transport.connect(address).thenApply(peerId -> {
            if (selfId.equals(peerId)) {
                throw new TransportException(address, "Address resolves to this node");
            }
            if (!peerTable.add(peerId, address)) {
                log.debug("Connected but peer table is full: peerId={}, address={}", peerId, address);
            }
            return peerId;
        });
    }

    /**
     * Connects to a newly learned peer unless already connected, the peer is this node, or
     * the peer table is full. Failures are logged and otherwise ignored.
     */
    public void ensureConnected(String peerId, String address) {
        if (selfId.equals(peerId) || peerTable.isConnected(peerId) || peerTable.isFull()) {
            return;
        }
        connect(address).whenComplete((connected, ex) -> {
            if (ex != null) {
                log.debug("Could not connect to learned peer: peerId={}, address={}, reason={}",
                        peerId, address, ex.getMessage());
            }
        });
    }

    public void disconnect(String peerId) {
        peerTable.remove(peerId);
        transport.disconnect(peerId);
    }

    /**
     * Sends a message to one peer, whether or not it is in the peer table.
     */
    public CompletableFuture<Void> send(String peerId, P2PMessage message) {
        byte[] data;
        try {
            data = codec.encode(message);
        } catch (MessageCodec.CodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendEncoded(peerId, message, data);
    }

    /**
     * Originates a gossip message: records its id so echoes are ignored, then relays it.
     *
     * @return number of peers the message was sent to
     */
    public int broadcast(P2PMessage message) {
        messageCache.markSeen(message.messageId());
        return relay(message);
    }

    /**
     * Relays a received gossip message. Its id was recorded when it was received.
     */
    @Override
    public int forward(P2PMessage message) {
        return relay(message);
    }

    private int relay(P2PMessage message) {
        P2PMessage copy = message.forwardedBy(selfId);
        if (copy.ttl() <= 0) {
            log.debug("TTL exhausted, not relaying: messageId={}, type={}", message.messageId(), message.type());
            return 0;
        }

        byte[] data;
        try {
            data = codec.encode(copy);
        } catch (MessageCodec.CodecException e) {
            log.error("Cannot encode message for relay: messageId={}, type={}",
                    message.messageId(), message.type(), e);
            return 0;
        }

        int sent = 0;
        for (String peerId : peerTable.connectedPeerIds()) {
            if (copy.hasTraversed(peerId)) {
                continue;
            }
            sendEncoded(peerId, copy, data);
            sent++;
        }
        return sent;
    }

    private CompletableFuture<Void> sendEncoded(String peerId, P2PMessage message, byte[] data) {
        CompletableFuture<Void> sent;
        try {
            sent = transport.send(peerId, data);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        metricsRegistry.incrementMessageSent(message.type());
        return sent.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Send failed: peer={}, messageId={}, type={}, reason={}",
                        peerId, message.messageId(), message.type(), ex.getMessage());
            }
        });
    }

    public String getSelfId() {
        return selfId;
    }

    public PeerTable getPeerTable() {
        return peerTable;
    }
}
