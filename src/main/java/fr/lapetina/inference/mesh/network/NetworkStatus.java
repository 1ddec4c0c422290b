package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.domain.model.NodeType;

import java.util.Map;

/**
 * Point-in-time view of a node and its neighbourhood.
 *
 * @param localShards   registered shards placed on this node
 * @param metrics       message and inference counters
 * @param networkHealth score in [0, 1]
 */
public record NetworkStatus(
        String nodeId,
        NodeType nodeType,
        boolean running,
        int connectedPeers,
        int knownNodes,
        int localShards,
        int activeInferences,
        Map<String, Long> metrics,
        double networkHealth
) {
    public NetworkStatus {
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }
}
