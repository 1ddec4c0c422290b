package fr.lapetina.inference.mesh.domain.model;

/**
 * Error taxonomy for distributed inference.
 * Carried by {@link InferenceResult} so the hosting agent can decide whether to retry.
 */
public enum ErrorType {
    /** No peer advertises the requested model */
    NO_NODES_AVAILABLE,

    /** No peer holds a shard required by the pipeline */
    SHARD_UNAVAILABLE,

    /** A pipeline stage's remote call failed or returned an error */
    STAGE_FAILURE,

    /** Replicas answered but no group met the agreement threshold */
    CONSENSUS_NOT_REACHED,

    /** Task deadline exceeded before any usable result */
    TIMEOUT,

    /** Opaque failure from the send/receive boundary */
    TRANSPORT_ERROR,

    /** Unexpected failure inside the node */
    INTERNAL_ERROR
}
