package fr.lapetina.inference.mesh.domain.consensus;

import java.util.List;

/**
 * Result of clustering replica outputs: either an agreed value or an explicit refusal.
 */
public sealed interface ConsensusOutcome permits ConsensusOutcome.Agreed, ConsensusOutcome.NoConsensus {

    boolean reached();

    /**
     * @param value          merged value of the winning cluster
     * @param agreeingNodes  peers whose results formed the winning cluster
     * @param required       agreement threshold that was applied
     */
    record Agreed(Object value, List<String> agreeingNodes, int required) implements ConsensusOutcome {
        public Agreed {
            agreeingNodes = List.copyOf(agreeingNodes);
        }

        @Override
        public boolean reached() {
            return true;
        }
    }

    record NoConsensus(int largestCluster, int required, int responses) implements ConsensusOutcome {
        @Override
        public boolean reached() {
            return false;
        }
    }
}
