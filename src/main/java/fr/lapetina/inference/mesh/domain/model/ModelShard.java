package fr.lapetina.inference.mesh.domain.model;

import java.util.Objects;

/**
 * A contiguous slice of a model's layers, {@code [layerStart, layerEnd]} inclusive.
 * Immutable once created.
 */
public record ModelShard(
        String modelId,
        String shardId,
        int layerStart,
        int layerEnd,
        double sizeMb,
        String checksum
) {
    public ModelShard {
        Objects.requireNonNull(modelId, "Model ID is required");
        Objects.requireNonNull(shardId, "Shard ID is required");
        if (layerStart < 0 || layerEnd < layerStart) {
            throw new IllegalArgumentException(
                    "Invalid layer range [" + layerStart + ", " + layerEnd + "] for shard " + shardId);
        }
    }

    public int layerCount() {
        return layerEnd - layerStart + 1;
    }
}
