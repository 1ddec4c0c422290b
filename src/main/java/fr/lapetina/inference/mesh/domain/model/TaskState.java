package fr.lapetina.inference.mesh.domain.model;

/**
 * Lifecycle of a coordinated inference task.
 *
 * State transitions:
 * PLANNING -> DISPATCHED -> COLLECTING -> CONSENSUS_REACHED | NO_CONSENSUS | FAILED
 *
 * Any non-terminal state may also transition to FAILED.
 */
public enum TaskState {
    /** Looking up capable peers and building the execution plan */
    PLANNING,

    /** Requests sent to the selected peers */
    DISPATCHED,

    /** Waiting for stage outputs or replica responses */
    COLLECTING,

    /** A final result was produced (directly or by agreement) */
    CONSENSUS_REACHED,

    /** Replicas answered but did not agree */
    NO_CONSENSUS,

    /** The task failed with a typed error */
    FAILED;

    public boolean isTerminal() {
        return this == CONSENSUS_REACHED || this == NO_CONSENSUS || this == FAILED;
    }
}
