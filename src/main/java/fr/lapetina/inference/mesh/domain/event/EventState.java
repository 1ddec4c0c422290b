package fr.lapetina.inference.mesh.domain.event;

/**
 * Lifecycle state of an inbound message event in the Disruptor pipeline.
 */
public enum EventState {
    /** Raw bytes accepted from the transport */
    RECEIVED,

    /** Envelope decoded */
    DECODED,

    /** Bytes could not be decoded into an envelope */
    DECODE_FAILED,

    /** Message id already seen */
    DUPLICATE,

    /** Type handler ran */
    HANDLED,

    /** Type handler threw */
    HANDLER_FAILED,

    /** Gossip copy relayed to peers */
    FORWARDED,

    /** Processing finished */
    COMPLETED;

    public boolean isDropped() {
        return this == DECODE_FAILED || this == DUPLICATE;
    }
}
