package fr.lapetina.inference.mesh.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Peers this node holds an open connection to.
 *
 * Thread-safe. The table is bounded: once {@code maxPeers} entries exist, new peers are
 * refused until one is removed.
 */
public final class PeerTable {

    private static final Logger log = LoggerFactory.getLogger(PeerTable.class);

    private final Map<String, PeerConnection> peers = new ConcurrentHashMap<>();
    private final int maxPeers;
    private final Clock clock;

    public PeerTable(int maxPeers, Clock clock) {
        if (maxPeers < 1) {
            throw new IllegalArgumentException("maxPeers must be at least 1, got " + maxPeers);
        }
        this.maxPeers = maxPeers;
        this.clock = clock;
    }

    /**
     * Registers a connection, or refreshes an existing one.
     *
     * @return false if the table is full and the peer was not already present
     */
    public boolean add(String peerId, String address) {
        long now = clock.millis();
        synchronized (peers) {
            PeerConnection existing = peers.get(peerId);
            if (existing != null) {
                existing.lastMessageAt = now;
                return true;
            }
            if (peers.size() >= maxPeers) {
                log.debug("Peer table full, refusing peer: peerId={}, maxPeers={}", peerId, maxPeers);
                return false;
            }
            peers.put(peerId, new PeerConnection(peerId, address, now));
        }
        log.info("Peer connected: peerId={}, address={}", peerId, address);
        return true;
    }

    public Optional<PeerConnection> remove(String peerId) {
        PeerConnection removed = peers.remove(peerId);
        if (removed != null) {
            log.info("Peer disconnected: peerId={}", peerId);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Records traffic from a connected peer. Unknown peers are ignored.
     */
    public void touch(String peerId) {
        PeerConnection connection = peers.get(peerId);
        if (connection != null) {
            connection.lastMessageAt = clock.millis();
        }
    }

    public boolean isConnected(String peerId) {
        return peers.containsKey(peerId);
    }

    public boolean isFull() {
        return peers.size() >= maxPeers;
    }

    /**
     * Ids of peers with no traffic within {@code idleMillis}.
     */
    public List<String> idlePeers(long idleMillis) {
        long cutoff = clock.millis() - idleMillis;
        return peers.values().stream()
                .filter(c -> c.lastMessageAt < cutoff)
                .map(PeerConnection::getPeerId)
                .toList();
    }

    public List<String> connectedPeerIds() {
        return new ArrayList<>(peers.keySet());
    }

    public Optional<PeerConnection> get(String peerId) {
        return Optional.ofNullable(peers.get(peerId));
    }

    public int size() {
        return peers.size();
    }

    public int getMaxPeers() {
        return maxPeers;
    }

    /**
     * One open connection.
     */
    public static final class PeerConnection {
        private final String peerId;
        private final String address;
        private volatile long lastMessageAt;

        PeerConnection(String peerId, String address, long connectedAt) {
            this.peerId = peerId;
            this.address = address;
            this.lastMessageAt = connectedAt;
        }

        public String getPeerId() {
            return peerId;
        }

        public String getAddress() {
            return address;
        }

    }
}
