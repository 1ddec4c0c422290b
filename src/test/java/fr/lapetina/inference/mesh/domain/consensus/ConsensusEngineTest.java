package fr.lapetina.inference.mesh.domain.consensus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConsensusEngineTest {

    private final ConsensusEngine engine = new ConsensusEngine();

    private static List<NodeResult> results(Object... values) {
        NodeResult[] results = new NodeResult[values.length];
        for (int i = 0; i < values.length; i++) {
            results[i] = new NodeResult("node-" + i, values[i]);
        }
        return List.of(results);
    }

    @Nested
    @DisplayName("requiredAgreement")
    class RequiredAgreement {

        @Test
        @DisplayName("should require two of three with the default tolerance")
        void shouldRequireTwoOfThree() {
            assertThat(engine.requiredAgreement(3)).isEqualTo(2);
        }

        @Test
        @DisplayName("should never require more than the number of responses")
        void shouldCapAtResponses() {
            assertThat(engine.requiredAgreement(1)).isEqualTo(1);
            assertThat(engine.requiredAgreement(2)).isEqualTo(2);
        }

        @Test
        @DisplayName("should scale with the number of responses")
        void shouldScale() {
            assertThat(engine.requiredAgreement(10)).isEqualTo(6);
            assertThat(new ConsensusEngine(0.0, 0.01).requiredAgreement(5)).isEqualTo(5);
        }

        @Test
        @DisplayName("should reject a tolerance outside [0, 1)")
        void shouldRejectInvalidTolerance() {
            assertThatThrownBy(() -> new ConsensusEngine(1.0, 0.01))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ConsensusEngine(-0.1, 0.01))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        @DisplayName("should agree on the majority value")
        void shouldAgreeOnMajority() {
            ConsensusOutcome outcome = engine.decide("t", results("positive", "positive", "negative"));

            assertThat(outcome.reached()).isTrue();
            ConsensusOutcome.Agreed agreed = (ConsensusOutcome.Agreed) outcome;
            assertThat(agreed.value()).isEqualTo("positive");
            assertThat(agreed.agreeingNodes()).containsExactly("node-0", "node-1");
        }

        @Test
        @DisplayName("should refuse when every result differs")
        void shouldRefuseDivergentNumbers() {
            ConsensusOutcome outcome = engine.decide("t", results(0.1, 0.5, 0.9));

            assertThat(outcome.reached()).isFalse();
            ConsensusOutcome.NoConsensus refused = (ConsensusOutcome.NoConsensus) outcome;
            assertThat(refused.largestCluster()).isEqualTo(1);
            assertThat(refused.required()).isEqualTo(2);
            assertThat(refused.responses()).isEqualTo(3);
        }

        @Test
        @DisplayName("should merge close numbers into their mean")
        void shouldAverageNumbers() {
            ConsensusOutcome outcome = engine.decide("t", results(1.0, 1.005, 0.999));

            Object value = ((ConsensusOutcome.Agreed) outcome).value();
            assertThat((Double) value).isCloseTo(1.001333, within(1e-5));
        }

        @Test
        @DisplayName("should cluster maps with similar values")
        void shouldClusterMaps() {
            ConsensusOutcome outcome = engine.decide("t", results(
                    Map.of("label", "cat", "score", 0.900),
                    Map.of("label", "cat", "score", 0.901),
                    Map.of("label", "dog", "score", 0.9)));

            assertThat(outcome.reached()).isTrue();
            assertThat(((ConsensusOutcome.Agreed) outcome).agreeingNodes()).containsExactly("node-0", "node-1");
        }

        @Test
        @DisplayName("should accept a single response")
        void shouldAcceptSingleResponse() {
            ConsensusOutcome outcome = engine.decide("t", results("only"));

            assertThat(outcome.reached()).isTrue();
            assertThat(((ConsensusOutcome.Agreed) outcome).value()).isEqualTo("only");
        }

        @Test
        @DisplayName("should refuse an empty result set")
        void shouldRefuseEmpty() {
            assertThat(engine.decide("t", List.of()).reached()).isFalse();
        }
    }

    @Nested
    @DisplayName("similar")
    class Similar {

        @Test
        @DisplayName("should compare numbers by relative difference")
        void shouldCompareNumbers() {
            assertThat(engine.similar(100, 100.5)).isTrue();
            assertThat(engine.similar(100, 102)).isFalse();
            assertThat(engine.similar(0, 0.0)).isTrue();
            assertThat(engine.similar(0, 0.005)).isTrue();
            assertThat(engine.similar(0, 0.5)).isFalse();
        }

        @Test
        @DisplayName("should compare lists element by element")
        void shouldCompareLists() {
            assertThat(engine.similar(List.of(1.0, 2.0), List.of(1.001, 2.0))).isTrue();
            assertThat(engine.similar(List.of(1.0, 2.0), List.of(1.0))).isFalse();
        }

        @Test
        @DisplayName("should require identical key sets for maps")
        void shouldCompareMapKeys() {
            assertThat(engine.similar(Map.of("a", 1), Map.of("b", 1))).isFalse();
        }

        @Test
        @DisplayName("should fall back to equality")
        void shouldUseEquality() {
            assertThat(engine.similar("x", "x")).isTrue();
            assertThat(engine.similar("x", 1)).isFalse();
            assertThat(engine.similar(null, null)).isTrue();
        }
    }
}
