package fr.lapetina.inference.mesh.domain.strategy;

import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NodeSelectionStrategyTest {

    private List<NodeCapability> candidates;

    @BeforeEach
    void setUp() {
        candidates = List.of(
                NodeCapability.builder().nodeId("node-1").reliabilityScore(0.6).computePower(4).currentLoad(0.1).build(),
                NodeCapability.builder().nodeId("node-2").reliabilityScore(0.9).computePower(1).currentLoad(0.9).build(),
                NodeCapability.builder().nodeId("node-3").reliabilityScore(0.9).computePower(2).currentLoad(0.5).build(),
                NodeCapability.builder().nodeId("node-4").reliabilityScore(0.3).computePower(1).currentLoad(0.1).build()
        );
    }

    @Nested
    @DisplayName("ReliabilityFirstStrategy")
    class ReliabilityFirstTests {

        private final NodeSelectionStrategy strategy = new ReliabilityFirstStrategy();

        @Test
        @DisplayName("should rank by reliability then compute power")
        void shouldRankByReliability() {
            assertThat(strategy.selectNodes(candidates, 3))
                    .extracting(NodeCapability::getNodeId)
                    .containsExactly("node-3", "node-2", "node-1");
        }

        @Test
        @DisplayName("should return nothing for no candidates or zero count")
        void shouldHandleEmptyInput() {
            assertThat(strategy.selectNodes(List.of(), 3)).isEmpty();
            assertThat(strategy.selectNodes(candidates, 0)).isEmpty();
        }

        @Test
        @DisplayName("should adjust reliability on outcomes")
        void shouldAdjustReliability() {
            NodeCapability node = candidates.get(0);

            strategy.recordFailure(node);
            assertThat(node.getReliabilityScore()).isCloseTo(0.54, within(1e-9));

            strategy.recordSuccess(node, 12);
            assertThat(node.getReliabilityScore()).isCloseTo(0.56, within(1e-9));
        }
    }

    @Nested
    @DisplayName("LeastLoadedStrategy")
    class LeastLoadedTests {

        private final NodeSelectionStrategy strategy = new LeastLoadedStrategy();

        @Test
        @DisplayName("should prefer the least loaded peers and use overloaded ones last")
        void shouldPreferLowLoad() {
            assertThat(strategy.selectNodes(candidates, 4))
                    .extracting(NodeCapability::getNodeId)
                    .containsExactly("node-1", "node-4", "node-3", "node-2");
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class FactoryTests {

        @Test
        @DisplayName("should create strategies by name, ignoring case")
        void shouldCreateByName() {
            assertThat(StrategyFactory.create("least-loaded").orElseThrow().getName())
                    .isEqualTo(LeastLoadedStrategy.NAME);
            assertThat(StrategyFactory.create("Reliability-First")).isPresent();
        }

        @Test
        @DisplayName("should fall back to reliability-first for unknown names")
        void shouldFallBack() {
            assertThat(StrategyFactory.create("round-robin")).isEmpty();
            assertThat(StrategyFactory.createOrDefault("round-robin").getName())
                    .isEqualTo(ReliabilityFirstStrategy.NAME);
            assertThat(StrategyFactory.createOrDefault(null).getName())
                    .isEqualTo(ReliabilityFirstStrategy.NAME);
        }
    }
}
