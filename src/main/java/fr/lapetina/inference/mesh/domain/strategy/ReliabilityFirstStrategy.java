package fr.lapetina.inference.mesh.domain.strategy;

import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.sharding.ShardPlanner;

import java.util.List;

/**
 * Prefers the most reliable peers, breaking ties by compute power.
 * This is the default ranking for replicated execution.
 */
public final class ReliabilityFirstStrategy implements NodeSelectionStrategy {

    public static final String NAME = "reliability-first";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<NodeCapability> selectNodes(List<NodeCapability> candidates, int count) {
        if (candidates == null || candidates.isEmpty() || count <= 0) {
            return List.of();
        }
        return candidates.stream()
                .sorted(ShardPlanner.BEST_FIRST)
                .limit(count)
                .toList();
    }
}
