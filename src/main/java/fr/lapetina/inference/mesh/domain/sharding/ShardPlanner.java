package fr.lapetina.inference.mesh.domain.sharding;

import fr.lapetina.inference.mesh.domain.model.ModelShard;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a model's layers across peers and chooses replica holders for each shard.
 *
 * Layers are allocated in proportion to compute power, strongest peer first. Every
 * included peer receives at least one layer and the last included peer receives whatever
 * remains, so the shards always partition {@code [0, totalLayers)} exactly.
 */
public final class ShardPlanner {

    private static final Logger log = LoggerFactory.getLogger(ShardPlanner.class);

    public static final double MB_PER_LAYER = 10.0;
    public static final double MEMORY_HEADROOM = 1.5;
    public static final int REPLICAS_PER_SHARD = 3;

    /**
     * Ranks peers by reliability, then compute power, both descending.
     */
    public static final Comparator<NodeCapability> BEST_FIRST =
            Comparator.comparingDouble(NodeCapability::getReliabilityScore)
                    .thenComparingDouble(NodeCapability::getComputePower)
                    .reversed();

    private final Clock clock;

    public ShardPlanner(Clock clock) {
        this.clock = clock;
    }

    public ShardPlanner() {
        this(Clock.systemUTC());
    }

    public List<ModelShard> createShardingPlan(String modelId, int totalLayers, List<NodeCapability> nodes) {
        if (totalLayers < 1) {
            throw new IllegalArgumentException("Model must have at least one layer, got " + totalLayers);
        }
        if (nodes.isEmpty()) {
            return List.of();
        }

        List<NodeCapability> ranked = new ArrayList<>(nodes);
        ranked.sort(Comparator.comparingDouble(NodeCapability::getComputePower).reversed());

        double totalPower = ranked.stream().mapToDouble(NodeCapability::getComputePower).sum();
        List<ModelShard> shards = new ArrayList<>();
        int currentLayer = 0;

        for (int i = 0; i < ranked.size() && currentLayer < totalLayers; i++) {
            int remaining = totalLayers - currentLayer;
            int layers;
            if (i == ranked.size() - 1) {
                layers = remaining;
            } else {
                double share = totalPower > 0
                        ? ranked.get(i).getComputePower() / totalPower
                        : 1.0 / ranked.size();
                layers = Math.min(remaining, Math.max(1, (int) Math.floor(totalLayers * share)));
            }

            shards.add(new ModelShard(
                    modelId,
                    modelId + "_shard_" + i,
                    currentLayer,
                    currentLayer + layers - 1,
                    layers * MB_PER_LAYER,
                    checksum(modelId, currentLayer, layers)
            ));
            currentLayer += layers;
        }

        log.info("Sharding plan created: modelId={}, layers={}, candidates={}, shards={}",
                modelId, totalLayers, nodes.size(), shards.size());
        return List.copyOf(shards);
    }

    /**
     * Picks up to three holders per shard among peers with enough memory.
     *
     * @return shard id to holder node ids, best first, in shard order
     */
    public Map<String, List<String>> optimizeShardPlacement(List<ModelShard> shards, List<NodeCapability> nodes) {
        Map<String, List<String>> placement = new LinkedHashMap<>();
        for (ModelShard shard : shards) {
            double requiredMb = shard.sizeMb() * MEMORY_HEADROOM;
            List<String> holders = nodes.stream()
                    .filter(n -> n.getMemoryGb() * 1024 >= requiredMb)
                    .sorted(BEST_FIRST)
                    .limit(REPLICAS_PER_SHARD)
                    .map(NodeCapability::getNodeId)
                    .toList();
            placement.put(shard.shardId(), holders);
            if (holders.isEmpty()) {
                log.warn("No peer can hold shard: shardId={}, requiredMb={}", shard.shardId(), requiredMb);
            }
        }
        return placement;
    }

    private String checksum(String modelId, int layerStart, int layerCount) {
        String tag = modelId + ":" + layerStart + ":" + layerCount + ":" + clock.millis();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(tag.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
