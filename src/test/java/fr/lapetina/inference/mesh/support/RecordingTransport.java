package fr.lapetina.inference.mesh.support;

import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.infrastructure.transport.MessageCodec;
import fr.lapetina.inference.mesh.infrastructure.transport.Transport;
import fr.lapetina.inference.mesh.infrastructure.transport.TransportException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transport that records outbound messages instead of delivering them.
 * Addresses are resolved to peer ids through {@link #knowAddress(String, String)}.
 */
public final class RecordingTransport implements Transport {

    private final String localAddress;
    private final MessageCodec codec = new MessageCodec();
    private final Map<String, String> peerIdByAddress = new ConcurrentHashMap<>();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile MessageListener listener = (from, data) -> { };

    public RecordingTransport(String localAddress) {
        this.localAddress = localAddress;
    }

    public void knowAddress(String address, String peerId) {
        peerIdByAddress.put(address, peerId);
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<String> recipients() {
        return sent.stream().map(Sent::peerId).toList();
    }

    public void clear() {
        sent.clear();
    }

    /**
     * Hands raw bytes to the registered listener as if they came from {@code fromPeerId}.
     */
    public void receive(String fromPeerId, P2PMessage message) {
        listener.onMessage(fromPeerId, codec.encode(message));
    }

    @Override
    public String localAddress() {
        return localAddress;
    }

    @Override
    public CompletableFuture<String> connect(String address) {
        String peerId = peerIdByAddress.get(address);
        if (peerId == null) {
            return CompletableFuture.failedFuture(new TransportException(address, "Address unreachable"));
        }
        return CompletableFuture.completedFuture(peerId);
    }

    @Override
    public CompletableFuture<Void> send(String peerId, byte[] data) {
        sent.add(new Sent(peerId, codec.decode(data)));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onMessage(MessageListener listener) {
        this.listener = listener;
    }

    @Override
    public void disconnect(String peerId) {
    }

    @Override
    public void close() {
    }

    public record Sent(String peerId, P2PMessage message) {
    }
}
