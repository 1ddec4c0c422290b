package fr.lapetina.inference.mesh.domain.message;

import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.model.NodeType;

import java.util.Objects;
import java.util.Set;

/**
 * Wire form of a {@link NodeCapability}. Carries the advertised profile only;
 * last-seen time is always assigned by the receiver's clock.
 */
public record NodeDescriptor(
        String nodeId,
        String address,
        NodeType nodeType,
        Set<String> models,
        double computePower,
        double memoryGb,
        double bandwidthMbps,
        boolean gpuAvailable,
        double reliabilityScore,
        double currentLoad
) {
    public NodeDescriptor {
        Objects.requireNonNull(nodeId, "Node ID is required");
        models = models != null ? Set.copyOf(models) : Set.of();
        if (nodeType == null) {
            nodeType = NodeType.FULL_NODE;
        }
    }

    public static NodeDescriptor from(NodeCapability capability) {
        return new NodeDescriptor(
                capability.getNodeId(),
                capability.getAddress(),
                capability.getNodeType(),
                capability.getModels(),
                capability.getComputePower(),
                capability.getMemoryGb(),
                capability.getBandwidthMbps(),
                capability.isGpuAvailable(),
                capability.getReliabilityScore(),
                capability.getCurrentLoad()
        );
    }

    public NodeCapability toCapability(long lastSeen) {
        return toCapability(lastSeen, reliabilityScore);
    }

    /**
     * Builds a capability that keeps a locally tracked reliability score instead of the
     * advertised one.
     */
    public NodeCapability toCapability(long lastSeen, double localReliability) {
        return NodeCapability.builder()
                .nodeId(nodeId)
                .address(address)
                .nodeType(nodeType)
                .models(models)
                .computePower(computePower)
                .memoryGb(memoryGb)
                .bandwidthMbps(bandwidthMbps)
                .gpuAvailable(gpuAvailable)
                .reliabilityScore(localReliability)
                .currentLoad(currentLoad)
                .lastSeen(lastSeen)
                .build();
    }
}
