package fr.lapetina.inference.mesh.infrastructure.executor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Loopback backend: returns the input unchanged for a whole-model call, and wraps it with
 * the shard id for a shard call so pipelines show every stage they went through.
 * Deterministic, which makes replicas always agree.
 */
public final class EchoInferenceExecutor implements InferenceExecutor {

    public static final String NAME = "echo";

    @Override
    public CompletableFuture<Object> execute(String modelId, String shardId, Object input) {
        if (shardId == null) {
            return CompletableFuture.completedFuture(input);
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("shard", shardId);
        output.put("input", input);
        return CompletableFuture.completedFuture(output);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
