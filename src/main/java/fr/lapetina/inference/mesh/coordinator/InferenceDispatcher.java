package fr.lapetina.inference.mesh.coordinator;

import fr.lapetina.inference.mesh.domain.model.InferenceTask;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;

import java.util.concurrent.CompletableFuture;

/**
 * Sends one unit of work to one peer and returns its output.
 */
@FunctionalInterface
public interface InferenceDispatcher {

    /**
     * @param node    peer that should run the work, possibly this node
     * @param task    owning task
     * @param shardId shard to run, or {@code null} for the whole model
     * @param input   stage input; the task input for the first stage or a replica
     * @return future completing with the peer's output, or failing if the peer reported an
     *         error or could not be reached
     */
    CompletableFuture<Object> dispatch(NodeCapability node, InferenceTask task, String shardId, Object input);
}
