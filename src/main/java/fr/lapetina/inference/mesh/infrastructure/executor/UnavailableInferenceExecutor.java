package fr.lapetina.inference.mesh.infrastructure.executor;

import java.util.concurrent.CompletableFuture;

/**
 * Executor for nodes that only route and coordinate. Every call fails.
 */
public final class UnavailableInferenceExecutor implements InferenceExecutor {

    public static final String NAME = "none";

    @Override
    public CompletableFuture<Object> execute(String modelId, String shardId, Object input) {
        return CompletableFuture.failedFuture(
                new InferenceExecutionException("No inference backend configured on this node"));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
