package fr.lapetina.inference.mesh.disruptor.exception;

/**
 * Raised when an inbound frame cannot enter the event loop. The frame is dropped.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;
    private final String fromPeerId;

    public BackpressureException(BackpressureReason reason, String fromPeerId) {
        super(reason.getMessage() + ": from=" + fromPeerId);
        this.reason = reason;
        this.fromPeerId = fromPeerId;
    }

    public BackpressureException(BackpressureReason reason, String fromPeerId, long remainingCapacity) {
        super(reason.getMessage() + ": from=" + fromPeerId + ", remaining=" + remainingCapacity);
        this.reason = reason;
        this.fromPeerId = fromPeerId;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public String getFromPeerId() {
        return fromPeerId;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Inbound ring buffer full"),
        PIPELINE_STOPPED("Inbound pipeline stopped");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
