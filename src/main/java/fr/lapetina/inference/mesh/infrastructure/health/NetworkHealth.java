package fr.lapetina.inference.mesh.infrastructure.health;

import fr.lapetina.inference.mesh.domain.model.NodeType;

/**
 * Health score of the mesh as seen from one node, in [0, 1].
 *
 * Mean of three factors:
 * connectivity {@code min(1, connectedPeers / targetPeers)},
 * diversity {@code distinctNodeTypes / NodeType count},
 * success rate {@code succeeded / completed}, or 0.5 before any inference completed.
 */
public final class NetworkHealth {

    public static final int DEFAULT_TARGET_PEERS = 10;
    static final double NEUTRAL_SUCCESS_RATE = 0.5;

    private NetworkHealth() {
    }

    public static double score(int connectedPeers, int distinctNodeTypes, long succeeded, long completed,
                               int targetPeers) {
        double connectivity = Math.min(1.0, connectedPeers / (double) Math.max(1, targetPeers));
        double diversity = Math.min(1.0, distinctNodeTypes / (double) NodeType.values().length);
        double successRate = completed > 0
                ? Math.min(1.0, succeeded / (double) completed)
                : NEUTRAL_SUCCESS_RATE;
        return (connectivity + diversity + successRate) / 3.0;
    }

    public static double score(int connectedPeers, int distinctNodeTypes, long succeeded, long completed) {
        return score(connectedPeers, distinctNodeTypes, succeeded, completed, DEFAULT_TARGET_PEERS);
    }
}
