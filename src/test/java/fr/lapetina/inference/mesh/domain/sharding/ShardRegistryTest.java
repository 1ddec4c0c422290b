package fr.lapetina.inference.mesh.domain.sharding;

import fr.lapetina.inference.mesh.domain.model.ModelShard;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShardRegistryTest {

    private final ShardRegistry registry = new ShardRegistry();

    private static ModelShard shard(int index, int start, int end) {
        return new ModelShard("m", "m_shard_" + index, start, end, (end - start + 1) * 10.0, "abc");
    }

    @Test
    @DisplayName("should keep shards in layer order")
    void shouldOrderShards() {
        registry.register(List.of(shard(1, 5, 9), shard(0, 0, 4)),
                Map.of("m_shard_0", List.of("a"), "m_shard_1", List.of("b")));

        assertThat(registry.shardsFor("m")).extracting(ModelShard::shardId)
                .containsExactly("m_shard_0", "m_shard_1");
        assertThat(registry.isSharded("m")).isTrue();
        assertThat(registry.holdersOf("m_shard_1")).containsExactly("b");
    }

    @Test
    @DisplayName("should replace a previous plan for the same model")
    void shouldReplacePlan() {
        registry.register(List.of(shard(0, 0, 4), shard(1, 5, 9)),
                Map.of("m_shard_0", List.of("a"), "m_shard_1", List.of("a")));
        registry.register(List.of(shard(0, 0, 9)), Map.of("m_shard_0", List.of("b")));

        assertThat(registry.shardsFor("m")).hasSize(1);
        assertThat(registry.holdersOf("m_shard_1")).isEmpty();
        assertThat(registry.shardsHeldBy("a")).isZero();
        assertThat(registry.shardsHeldBy("b")).isEqualTo(1);
    }

    @Test
    @DisplayName("should treat unknown models as unsharded")
    void shouldReportUnknownModel() {
        assertThat(registry.isSharded("other")).isFalse();
        assertThat(registry.shardsFor("other")).isEmpty();
        assertThat(registry.shardCount()).isZero();
    }
}
