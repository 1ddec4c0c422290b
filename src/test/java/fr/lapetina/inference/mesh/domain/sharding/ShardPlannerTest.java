package fr.lapetina.inference.mesh.domain.sharding;

import fr.lapetina.inference.mesh.domain.model.ModelShard;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShardPlannerTest {

    private final ShardPlanner planner = new ShardPlanner(new MutableClock());

    private static NodeCapability node(String id, double computePower, double memoryGb, double reliability) {
        return NodeCapability.builder()
                .nodeId(id)
                .computePower(computePower)
                .memoryGb(memoryGb)
                .reliabilityScore(reliability)
                .build();
    }

    private static NodeCapability node(String id, double computePower) {
        return node(id, computePower, 16.0, 1.0);
    }

    private static void assertExactPartition(List<ModelShard> shards, int totalLayers) {
        int expectedStart = 0;
        for (ModelShard shard : shards) {
            assertThat(shard.layerStart()).isEqualTo(expectedStart);
            assertThat(shard.layerEnd()).isGreaterThanOrEqualTo(shard.layerStart());
            expectedStart = shard.layerEnd() + 1;
        }
        assertThat(expectedStart).isEqualTo(totalLayers);
    }

    @Nested
    @DisplayName("createShardingPlan")
    class CreateShardingPlan {

        @Test
        @DisplayName("should allocate layers in proportion to compute power")
        void shouldAllocateProportionally() {
            List<ModelShard> shards = planner.createShardingPlan("llama2", 10,
                    List.of(node("slow", 2), node("fast", 4), node("mid", 2)));

            assertThat(shards).extracting(ModelShard::layerCount).containsExactly(5, 2, 3);
            assertThat(shards).extracting(ModelShard::shardId)
                    .containsExactly("llama2_shard_0", "llama2_shard_1", "llama2_shard_2");
            assertThat(shards.get(0).sizeMb()).isEqualTo(5 * ShardPlanner.MB_PER_LAYER);
        }

        @Test
        @DisplayName("should partition the layers exactly for any node count")
        void shouldPartitionExactly() {
            for (int layers = 1; layers <= 40; layers += 3) {
                for (int nodes = 1; nodes <= 7; nodes++) {
                    List<NodeCapability> candidates = new ArrayList<>();
                    for (int i = 0; i < nodes; i++) {
                        candidates.add(node("n" + i, 1.0 + i * 0.7));
                    }
                    assertExactPartition(planner.createShardingPlan("m", layers, candidates), layers);
                }
            }
        }

        @Test
        @DisplayName("should stop once layers run out when nodes outnumber them")
        void shouldStopWhenLayersRunOut() {
            List<ModelShard> shards = planner.createShardingPlan("m", 2,
                    List.of(node("a", 1), node("b", 1), node("c", 1), node("d", 1), node("e", 1)));

            assertThat(shards).hasSize(2);
            assertExactPartition(shards, 2);
        }

        @Test
        @DisplayName("should give every layer to a single node")
        void shouldUseSingleNode() {
            List<ModelShard> shards = planner.createShardingPlan("m", 32, List.of(node("a", 3)));

            assertThat(shards).hasSize(1);
            assertThat(shards.get(0).layerStart()).isZero();
            assertThat(shards.get(0).layerEnd()).isEqualTo(31);
        }

        @Test
        @DisplayName("should return no shards without nodes")
        void shouldReturnEmptyWithoutNodes() {
            assertThat(planner.createShardingPlan("m", 10, List.of())).isEmpty();
        }

        @Test
        @DisplayName("should reject a model without layers")
        void shouldRejectZeroLayers() {
            assertThatThrownBy(() -> planner.createShardingPlan("m", 0, List.of(node("a", 1))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should attach a short checksum")
        void shouldAttachChecksum() {
            ModelShard shard = planner.createShardingPlan("m", 4, List.of(node("a", 1))).get(0);

            assertThat(shard.checksum()).hasSize(16).matches("[0-9a-f]+");
        }
    }

    @Nested
    @DisplayName("optimizeShardPlacement")
    class OptimizeShardPlacement {

        @Test
        @DisplayName("should place each shard on at most three nodes, most reliable first")
        void shouldPickBestThree() {
            List<NodeCapability> nodes = List.of(
                    node("a", 1, 16, 0.5),
                    node("b", 1, 16, 0.9),
                    node("c", 2, 16, 0.9),
                    node("d", 1, 16, 0.7));
            List<ModelShard> shards = planner.createShardingPlan("m", 4, List.of(node("x", 1)));

            Map<String, List<String>> placement = planner.optimizeShardPlacement(shards, nodes);

            assertThat(placement.get("m_shard_0")).containsExactly("c", "b", "d");
        }

        @Test
        @DisplayName("should skip nodes without enough memory")
        void shouldSkipSmallNodes() {
            // 5 layers = 50 MB, needs 75 MB with headroom
            List<ModelShard> shards = planner.createShardingPlan("m", 5, List.of(node("x", 1)));
            List<NodeCapability> nodes = List.of(
                    node("tiny", 1, 0.05, 1.0),
                    node("big", 1, 1.0, 0.5));

            Map<String, List<String>> placement = planner.optimizeShardPlacement(shards, nodes);

            assertThat(placement.get("m_shard_0")).containsExactly("big");
        }
    }
}
