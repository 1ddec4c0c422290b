package fr.lapetina.inference.mesh.infrastructure.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single-JVM mesh: every endpoint registered on the hub can reach every other one.
 *
 * Deliveries run on one dispatcher thread, so messages between any two endpoints arrive
 * in send order. {@link #isolate(String)} cuts a node off in both directions to simulate
 * a crash or partition without tearing down its state.
 */
public final class InMemoryTransportHub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransportHub.class);

    private final Map<String, Endpoint> byNodeId = new ConcurrentHashMap<>();
    private final Map<String, Endpoint> byAddress = new ConcurrentHashMap<>();
    private final Set<String> isolated = ConcurrentHashMap.newKeySet();
    private final ExecutorService dispatcher;

    public InMemoryTransportHub() {
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mesh-hub-dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates the transport for one node.
     *
     * @throws IllegalStateException if the node id or address is already taken
     */
    public Transport register(String nodeId, String address) {
        Endpoint endpoint = new Endpoint(nodeId, address);
        if (byNodeId.putIfAbsent(nodeId, endpoint) != null) {
            throw new IllegalStateException("Node already registered: " + nodeId);
        }
        if (byAddress.putIfAbsent(address, endpoint) != null) {
            byNodeId.remove(nodeId);
            throw new IllegalStateException("Address already in use: " + address);
        }
        log.debug("Endpoint registered: nodeId={}, address={}", nodeId, address);
        return endpoint;
    }

    public Transport register(String nodeId) {
        return register(nodeId, "mem://" + nodeId);
    }

    /**
     * Drops all traffic to and from the node.
     */
    public void isolate(String nodeId) {
        isolated.add(nodeId);
        log.info("Node isolated: nodeId={}", nodeId);
    }

    public int endpointCount() {
        return byNodeId.size();
    }

    private void unregister(Endpoint endpoint) {
        byNodeId.remove(endpoint.nodeId, endpoint);
        byAddress.remove(endpoint.address, endpoint);
        log.debug("Endpoint unregistered: nodeId={}", endpoint.nodeId);
    }

    private boolean reachable(String from, String to) {
        return !isolated.contains(from) && !isolated.contains(to);
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class Endpoint implements Transport {
        private final String nodeId;
        private final String address;
        private volatile MessageListener listener = (from, data) -> { };
        private volatile boolean open = true;

        Endpoint(String nodeId, String address) {
            this.nodeId = nodeId;
            this.address = address;
        }

        @Override
        public String localAddress() {
            return address;
        }

        @Override
        public CompletableFuture<String> connect(String remoteAddress) {
            Endpoint remote = byAddress.get(remoteAddress);
            if (!open) {
                return CompletableFuture.failedFuture(
                        new TransportException(remoteAddress, "Transport closed"));
            }
            if (remote == null || !reachable(nodeId, remote.nodeId)) {
                return CompletableFuture.failedFuture(
                        new TransportException(remoteAddress, "Address unreachable"));
            }
            return CompletableFuture.completedFuture(remote.nodeId);
        }

        @Override
        public CompletableFuture<Void> send(String peerId, byte[] data) {
            Endpoint remote = byNodeId.get(peerId);
            if (!open) {
                return CompletableFuture.failedFuture(new TransportException(peerId, "Transport closed"));
            }
            if (remote == null || !reachable(nodeId, peerId)) {
                return CompletableFuture.failedFuture(new TransportException(peerId, "Peer unreachable"));
            }
            byte[] copy = data.clone();
            try {
                dispatcher.execute(() -> remote.deliver(nodeId, copy));
            } catch (RejectedExecutionException e) {
                return CompletableFuture.failedFuture(new TransportException(peerId, "Hub stopped", e));
            }
            return CompletableFuture.completedFuture(null);
        }

        private void deliver(String fromPeerId, byte[] data) {
            if (!open || !reachable(fromPeerId, nodeId)) {
                log.debug("Dropping in-flight message: from={}, to={}", fromPeerId, nodeId);
                return;
            }
            try {
                listener.onMessage(fromPeerId, data);
            } catch (RuntimeException e) {
                log.error("Listener failed: from={}, to={}", fromPeerId, nodeId, e);
            }
        }

        @Override
        public void onMessage(MessageListener listener) {
            this.listener = listener;
        }

        @Override
        public void disconnect(String peerId) {
            log.debug("Disconnected: nodeId={}, peer={}", nodeId, peerId);
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                unregister(this);
            }
        }
    }
}
