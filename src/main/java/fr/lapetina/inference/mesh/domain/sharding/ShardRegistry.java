package fr.lapetina.inference.mesh.domain.sharding;

import fr.lapetina.inference.mesh.domain.model.ModelShard;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known shard plans per model and which peers hold each shard.
 */
public final class ShardRegistry {

    private final Map<String, List<ModelShard>> shardsByModel = new ConcurrentHashMap<>();
    private final Map<String, List<String>> locations = new ConcurrentHashMap<>();

    /**
     * Replaces the plan for the shards' model. Shards are kept in layer order.
     */
    public void register(List<ModelShard> shards, Map<String, List<String>> placement) {
        if (shards.isEmpty()) {
            return;
        }
        String modelId = shards.get(0).modelId();
        List<ModelShard> ordered = shards.stream()
                .sorted(Comparator.comparingInt(ModelShard::layerStart))
                .toList();
        List<ModelShard> previous = shardsByModel.put(modelId, ordered);
        if (previous != null) {
            previous.forEach(s -> locations.remove(s.shardId()));
        }
        placement.forEach((shardId, holders) -> locations.put(shardId, List.copyOf(holders)));
    }

    public List<ModelShard> shardsFor(String modelId) {
        return shardsByModel.getOrDefault(modelId, List.of());
    }

    public boolean isSharded(String modelId) {
        return !shardsFor(modelId).isEmpty();
    }

    public List<String> holdersOf(String shardId) {
        return locations.getOrDefault(shardId, List.of());
    }

    /**
     * Number of registered shards placed on the given peer.
     */
    public int shardsHeldBy(String nodeId) {
        return (int) locations.values().stream()
                .filter(holders -> holders.contains(nodeId))
                .count();
    }

    /**
     * Total number of shards across all registered models.
     */
    public int shardCount() {
        return shardsByModel.values().stream().mapToInt(List::size).sum();
    }
}
