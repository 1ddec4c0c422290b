package fr.lapetina.inference.mesh.domain.event;

import fr.lapetina.inference.mesh.domain.message.P2PMessage;

import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class MessageEvent {

    private String fromPeerId;
    private byte[] data;

    private P2PMessage message;
    private EventState state;
    private String dropReason;
    private String errorMessage;
    private int forwardedTo;

    private Instant receivedAt;
    private Instant decodedAt;
    private Instant handledAt;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.fromPeerId = null;
        this.data = null;
        this.message = null;
        this.state = null;
        this.dropReason = null;
        this.errorMessage = null;
        this.forwardedTo = 0;
        this.receivedAt = null;
        this.decodedAt = null;
        this.handledAt = null;
        this.sequence = -1;
    }

    public void initialize(String fromPeerId, byte[] data) {
        clear();
        this.fromPeerId = fromPeerId;
        this.data = data;
        this.state = EventState.RECEIVED;
        this.receivedAt = Instant.now();
    }

    public String getFromPeerId() {
        return fromPeerId;
    }

    public byte[] getData() {
        return data;
    }

    public P2PMessage getMessage() {
        return message;
    }

    public EventState getState() {
        return state;
    }

    public String getDropReason() {
        return dropReason;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getForwardedTo() {
        return forwardedTo;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public Instant getDecodedAt() {
        return decodedAt;
    }

    public Instant getHandledAt() {
        return handledAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markDecoded(P2PMessage message) {
        this.message = message;
        this.state = EventState.DECODED;
        this.decodedAt = Instant.now();
    }

    public void markDropped(EventState state, String reason) {
        this.state = state;
        this.dropReason = reason;
    }

    public void markHandled() {
        this.state = EventState.HANDLED;
        this.handledAt = Instant.now();
    }

    public void markHandlerFailed(String errorMessage) {
        this.state = EventState.HANDLER_FAILED;
        this.errorMessage = errorMessage;
        this.handledAt = Instant.now();
    }

    public void markForwarded(int peerCount) {
        this.state = EventState.FORWARDED;
        this.forwardedTo = peerCount;
    }

    public void markCompleted() {
        this.state = EventState.COMPLETED;
    }

    /**
     * Checks if processing should skip the remaining message handlers.
     */
    public boolean shouldSkip() {
        return state == null || state.isDropped();
    }

    @Override
    public String toString() {
        return "MessageEvent{" +
                "from=" + fromPeerId +
                ", messageId=" + (message != null ? message.messageId() : "null") +
                ", type=" + (message != null ? message.type() : "null") +
                ", state=" + state +
                ", seq=" + sequence +
                '}';
    }
}
