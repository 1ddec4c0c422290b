package fr.lapetina.inference.mesh.domain.strategy;

import fr.lapetina.inference.mesh.domain.model.NodeCapability;

import java.util.List;

/**
 * Chooses which capable peers run a replicated task.
 *
 * Implementations must be thread-safe; several tasks may be planned concurrently.
 */
public interface NodeSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Ranks the candidates and returns at most {@code count} of them, best first.
     *
     * @param candidates peers hosting the requested model
     * @param count      number of replicas wanted
     */
    List<NodeCapability> selectNodes(List<NodeCapability> candidates, int count);

    /**
     * Called when a peer answered a dispatch successfully.
     *
     * @param node      the peer that answered
     * @param latencyMs round-trip time of the dispatch
     */
    default void recordSuccess(NodeCapability node, long latencyMs) {
        node.recordSuccess();
    }

    /**
     * Called when a peer failed or did not answer in time.
     */
    default void recordFailure(NodeCapability node) {
        node.recordFailure();
    }
}
