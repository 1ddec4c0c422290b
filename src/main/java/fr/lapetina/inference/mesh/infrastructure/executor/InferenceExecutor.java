package fr.lapetina.inference.mesh.infrastructure.executor;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a model, or one shard of it, on this node.
 * The mesh treats inputs and outputs as opaque values.
 */
public interface InferenceExecutor extends AutoCloseable {

    /**
     * @param modelId model to run
     * @param shardId shard to run, or {@code null} for the whole model
     * @param input   opaque input
     * @return future completing with the output, or failing with
     *         {@link InferenceExecutionException}
     */
    CompletableFuture<Object> execute(String modelId, String shardId, Object input);

    /**
     * Name used in configuration and logs.
     */
    String getName();

    @Override
    default void close() {
        // Default no-op
    }
}
