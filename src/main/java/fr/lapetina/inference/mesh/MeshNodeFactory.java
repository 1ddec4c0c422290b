package fr.lapetina.inference.mesh;

import fr.lapetina.inference.mesh.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.mesh.infrastructure.config.MeshConfig;
import fr.lapetina.inference.mesh.infrastructure.executor.CircuitBreaker;
import fr.lapetina.inference.mesh.infrastructure.executor.EchoInferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.executor.InferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.executor.OllamaInferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.executor.UnavailableInferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.mesh.infrastructure.transport.InMemoryTransportHub;
import fr.lapetina.inference.mesh.infrastructure.transport.Transport;
import fr.lapetina.inference.mesh.network.NetworkManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Factory for creating fully-wired mesh nodes from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (InMemoryTransportHub hub = new InMemoryTransportHub();
 *      MeshNodeFactory node = MeshNodeFactory.create("config.yaml", hub).start()) {
 *     node.getNetworkManager().requestInference("llama2", "Hello!").join();
 * }
 * }</pre>
 */
public class MeshNodeFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshNodeFactory.class);

    private final MeshConfig config;
    private final MetricsRegistry metricsRegistry;
    private final InferenceExecutor executor;
    private final Transport transport;
    private final NetworkManager networkManager;

    protected MeshNodeFactory(MeshConfig config, Transport transport, InferenceExecutor executorOverride) {
        this.config = config;
        this.transport = transport;

        MeshConfig.MetricsConfig metricsConfig = config.getMetrics();
        this.metricsRegistry = new MetricsRegistry(
                metricsConfig.getPrefix(),
                metricsConfig.isEnabled() && metricsConfig.isJvmMetrics());

        // Allow override for testing
        this.executor = executorOverride != null ? executorOverride : createExecutor(config.getExecutor());

        this.networkManager = new NetworkManager(config, transport, executor, metricsRegistry);
        log.info("Mesh node initialized: nodeId={}, executor={}", networkManager.getNodeId(), executor.getName());
    }

    /**
     * Creates a node from the given configuration file, attached to an in-process hub.
     */
    public static MeshNodeFactory create(String configPath, InMemoryTransportHub hub) {
        return create(new ConfigLoader(configPath).load(), hub);
    }

    /**
     * Creates a node attached to an in-process hub. A node without a configured id gets
     * a generated one.
     */
    public static MeshNodeFactory create(MeshConfig config, InMemoryTransportHub hub) {
        config.getNode().setId(NetworkManager.resolveNodeId(config.getNode()));
        return new MeshNodeFactory(config, hub.register(config.getNode().getId()), null);
    }

    public static MeshNodeFactory create(MeshConfig config, Transport transport, InferenceExecutor executor) {
        return new MeshNodeFactory(config, transport, executor);
    }

    /**
     * Starts the node and joins through the configured bootstrap addresses.
     */
    public MeshNodeFactory start() {
        return start(config.getNetwork().getBootstrap());
    }

    public MeshNodeFactory start(List<String> bootstrapAddresses) {
        networkManager.startNetwork(bootstrapAddresses).join();
        log.info("Mesh node started: nodeId={}, address={}",
                networkManager.getNodeId(), transport.localAddress());
        return this;
    }

    public NetworkManager getNetworkManager() {
        return networkManager;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public InferenceExecutor getExecutor() {
        return executor;
    }

    public Transport getTransport() {
        return transport;
    }

    public MeshConfig getConfig() {
        return config;
    }

    static InferenceExecutor createExecutor(MeshConfig.ExecutorConfig executorConfig) {
        String type = executorConfig.getType() == null ? "" : executorConfig.getType().trim().toLowerCase();
        switch (type) {
            case OllamaInferenceExecutor.NAME:
                return new OllamaInferenceExecutor(
                        executorConfig.getBaseUrl(),
                        Duration.ofMillis(executorConfig.getConnectTimeoutMs()),
                        Duration.ofMillis(executorConfig.getRequestTimeoutMs()),
                        new CircuitBreaker(
                                executorConfig.getBaseUrl(),
                                executorConfig.getCircuitBreakerFailureThreshold(),
                                Duration.ofMillis(executorConfig.getCircuitBreakerRecoveryMs())));
            case EchoInferenceExecutor.NAME:
                return new EchoInferenceExecutor();
            case UnavailableInferenceExecutor.NAME:
                return new UnavailableInferenceExecutor();
            default:
                log.warn("Unknown executor type '{}', local inference disabled", executorConfig.getType());
                return new UnavailableInferenceExecutor();
        }
    }

    @Override
    public void close() {
        log.info("Shutting down mesh node {}...", networkManager.getNodeId());

        try {
            networkManager.close();
        } catch (Exception e) {
            log.warn("Error stopping network", e);
        }

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport", e);
        }

        try {
            executor.close();
        } catch (Exception e) {
            log.warn("Error closing executor", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("Mesh node shut down");
    }
}
