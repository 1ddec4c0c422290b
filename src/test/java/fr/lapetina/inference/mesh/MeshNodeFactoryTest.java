package fr.lapetina.inference.mesh;

import fr.lapetina.inference.mesh.infrastructure.config.MeshConfig;
import fr.lapetina.inference.mesh.infrastructure.executor.EchoInferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.executor.InferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.executor.OllamaInferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.executor.UnavailableInferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.transport.InMemoryTransportHub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MeshNodeFactoryTest {

    private static MeshConfig.ExecutorConfig executorConfig(String type) {
        MeshConfig.ExecutorConfig config = new MeshConfig.ExecutorConfig();
        config.setType(type);
        return config;
    }

    @Nested
    @DisplayName("executor selection")
    class ExecutorSelection {

        @Test
        @DisplayName("should create the echo executor")
        void shouldCreateEcho() throws Exception {
            try (InferenceExecutor executor = MeshNodeFactory.createExecutor(executorConfig("echo"))) {
                assertThat(executor).isInstanceOf(EchoInferenceExecutor.class);
            }
        }

        @Test
        @DisplayName("should create the Ollama executor regardless of case")
        void shouldCreateOllama() throws Exception {
            try (InferenceExecutor executor = MeshNodeFactory.createExecutor(executorConfig(" Ollama "))) {
                assertThat(executor).isInstanceOf(OllamaInferenceExecutor.class);
            }
        }

        @Test
        @DisplayName("should disable local inference for an unknown type")
        void shouldFallBackForUnknownType() throws Exception {
            try (InferenceExecutor executor = MeshNodeFactory.createExecutor(executorConfig("gpu-cluster"))) {
                assertThat(executor).isInstanceOf(UnavailableInferenceExecutor.class);
            }
        }
    }

    @Nested
    @DisplayName("wiring")
    class Wiring {

        private final InMemoryTransportHub hub = new InMemoryTransportHub();

        @AfterEach
        void tearDown() {
            hub.close();
        }

        @Test
        @DisplayName("should build a node from a classpath configuration file")
        void shouldBuildFromConfigFile() {
            try (MeshNodeFactory node = MeshNodeFactory.create("test-config.yaml", hub)) {
                assertThat(node.getNetworkManager().getNodeId()).isEqualTo("test-node");
                assertThat(node.getTransport().localAddress()).isEqualTo("mem://test-node");
                assertThat(node.getExecutor().getName()).isEqualTo("echo");
                assertThat(node.getNetworkManager().getSelf().getModels())
                        .containsExactlyInAnyOrder("test-model", "other-model");
            }
        }

        @Test
        @DisplayName("should generate a node id when none is configured")
        void shouldGenerateNodeId() {
            MeshConfig config = new MeshConfig();
            config.getMetrics().setJvmMetrics(false);

            try (MeshNodeFactory node = MeshNodeFactory.create(config, hub)) {
                assertThat(node.getNetworkManager().getNodeId()).startsWith("node-");
                assertThat(node.getConfig().getNode().getId()).isEqualTo(node.getNetworkManager().getNodeId());
            }
        }

        @Test
        @DisplayName("should start a lone node when the bootstrap peer is unreachable")
        void shouldStartAlone() {
            MeshConfig config = new MeshConfig();
            config.getNode().setId("lonely");
            config.getMetrics().setJvmMetrics(false);
            config.getNetwork().getBootstrap().add("mem://nobody");

            try (MeshNodeFactory node = MeshNodeFactory.create(config, hub).start()) {
                assertThat(node.getNetworkManager().isRunning()).isTrue();
                assertThat(node.getNetworkManager().getPeerTable().size()).isZero();
            }
        }
    }
}
