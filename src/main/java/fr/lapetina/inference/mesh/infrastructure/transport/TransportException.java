package fr.lapetina.inference.mesh.infrastructure.transport;

/**
 * Failure at the send/receive boundary. The cause is opaque to callers.
 */
public final class TransportException extends RuntimeException {

    private final String peer;

    public TransportException(String peer, String message) {
        super(message + ": peer=" + peer);
        this.peer = peer;
    }

    public TransportException(String peer, String message, Throwable cause) {
        super(message + ": peer=" + peer, cause);
        this.peer = peer;
    }

    /**
     * Peer id or address involved in the failure.
     */
    public String getPeer() {
        return peer;
    }
}
