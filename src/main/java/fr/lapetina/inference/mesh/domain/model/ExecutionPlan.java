package fr.lapetina.inference.mesh.domain.model;

import java.util.List;

/**
 * How a task is executed across the mesh.
 */
public sealed interface ExecutionPlan permits ExecutionPlan.PipelinePlan, ExecutionPlan.ReplicationPlan {

    /**
     * Peers participating in this plan, in dispatch order.
     */
    List<NodeCapability> nodes();

    /**
     * One stage of a pipeline: a shard and the peer that runs it.
     */
    record Stage(ModelShard shard, NodeCapability node) {
    }

    /**
     * Shards executed strictly in layer order; each stage consumes the previous output.
     */
    record PipelinePlan(List<Stage> stages) implements ExecutionPlan {
        public PipelinePlan {
            stages = List.copyOf(stages);
            if (stages.isEmpty()) {
                throw new IllegalArgumentException("Pipeline requires at least one stage");
            }
        }

        @Override
        public List<NodeCapability> nodes() {
            return stages.stream().map(Stage::node).toList();
        }
    }

    /**
     * The whole model executed independently on each selected peer.
     */
    record ReplicationPlan(List<NodeCapability> nodes) implements ExecutionPlan {
        public ReplicationPlan {
            nodes = List.copyOf(nodes);
            if (nodes.isEmpty()) {
                throw new IllegalArgumentException("Replication requires at least one node");
            }
        }
    }
}
