package fr.lapetina.inference.mesh.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static MeshConfig parse(String yaml) {
        return new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should load every section from the classpath")
        void shouldLoadFromClasspath() {
            MeshConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getNode().getId()).isEqualTo("test-node");
            assertThat(config.getNode().getType()).isEqualTo("compute");
            assertThat(config.getNode().getModels()).containsExactlyInAnyOrder("test-model", "other-model");
            assertThat(config.getNode().getComputePower()).isEqualTo(2.5);
            assertThat(config.getNode().isGpuAvailable()).isTrue();
            assertThat(config.getNode().getMaxConcurrentInferences()).isEqualTo(8);

            assertThat(config.getNetwork().getBootstrap()).containsExactly("mem://seed");
            assertThat(config.getNetwork().getMessageTtl()).isEqualTo(5);
            assertThat(config.getNetwork().getMaxPeers()).isEqualTo(12);
            assertThat(config.getNetwork().getHeartbeatIntervalMs()).isEqualTo(1000);

            assertThat(config.getDht().getBucketSize()).isEqualTo(8);
            assertThat(config.getConsensus().getByzantineTolerance()).isEqualTo(0.25);
            assertThat(config.getInference().getRedundancy()).isEqualTo(2);
            assertThat(config.getInference().getSelectionStrategy()).isEqualTo("least-loaded");
            assertThat(config.getDisruptor().getRingBufferSize()).isEqualTo(256);
            assertThat(config.getDisruptor().getWaitStrategy()).isEqualTo("sleeping");
            assertThat(config.getExecutor().getType()).isEqualTo("echo");
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_mesh");
            assertThat(config.getMetrics().isJvmMetrics()).isFalse();
        }

        @Test
        @DisplayName("should keep defaults for omitted values")
        void shouldKeepDefaults() {
            MeshConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getNetwork().getDiscoveryCount()).isEqualTo(20);
            assertThat(config.getNetwork().getMessageCacheTtlMs()).isEqualTo(3_600_000);
            assertThat(config.getConsensus().getNumericTolerance()).isEqualTo(0.01);
            assertThat(config.getExecutor().getBaseUrl()).isEqualTo("http://localhost:11434");
        }

        @Test
        @DisplayName("should fall back to defaults for an empty document")
        void shouldHandleEmptyDocument() {
            MeshConfig config = parse("");

            assertThat(config.getInference().getRedundancy()).isEqualTo(3);
            assertThat(config.getNetwork().getStaleThresholdMs()).isEqualTo(300_000);
        }

        @Test
        @DisplayName("should fail for a missing file")
        void shouldFailForMissingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of two")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> parse("disruptor:\n  ringBufferSize: 1000\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("ringBufferSize");
        }

        @Test
        @DisplayName("should reject a byzantine tolerance of one")
        void shouldRejectTolerance() {
            assertThatThrownBy(() -> parse("consensus:\n  byzantineTolerance: 1.0\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject zero redundancy")
        void shouldRejectRedundancy() {
            assertThatThrownBy(() -> parse("inference:\n  redundancy: 0\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should wrap malformed YAML")
        void shouldWrapMalformedYaml() {
            assertThatThrownBy(() -> parse("node: [unclosed"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid YAML");
        }
    }
}
