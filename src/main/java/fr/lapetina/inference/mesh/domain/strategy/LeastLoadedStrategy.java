package fr.lapetina.inference.mesh.domain.strategy;

import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.sharding.ShardPlanner;

import java.util.Comparator;
import java.util.List;

/**
 * Prefers peers reporting the lowest load in their last heartbeat.
 *
 * Peers at or above the overload threshold are only used when there are not enough
 * others. Equal loads fall back to reliability, then compute power.
 */
public final class LeastLoadedStrategy implements NodeSelectionStrategy {

    public static final String NAME = "least-loaded";
    public static final double DEFAULT_OVERLOAD_THRESHOLD = 0.8;

    private final Comparator<NodeCapability> ranking;

    public LeastLoadedStrategy(double overloadThreshold) {
        this.ranking = Comparator
                .comparing((NodeCapability n) -> n.getCurrentLoad() >= overloadThreshold)
                .thenComparingDouble(NodeCapability::getCurrentLoad)
                .thenComparing(ShardPlanner.BEST_FIRST);
    }

    public LeastLoadedStrategy() {
        this(DEFAULT_OVERLOAD_THRESHOLD);
    }

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
                .sorted(ranking)
                .limit(count)
                .toList();
    }
}
