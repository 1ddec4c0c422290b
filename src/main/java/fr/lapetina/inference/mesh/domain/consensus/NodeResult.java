package fr.lapetina.inference.mesh.domain.consensus;

import java.util.Objects;

/**
 * A result reported by one peer for one task.
 */
public record NodeResult(String nodeId, Object value) {
    public NodeResult {
        Objects.requireNonNull(nodeId, "Node ID is required");
    }
}
