package fr.lapetina.inference.mesh.infrastructure.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for a mesh node.
 * Designed to be populated from YAML.
 */
public class MeshConfig {

    private NodeConfig node = new NodeConfig();
    private NetworkConfig network = new NetworkConfig();
    private DhtConfig dht = new DhtConfig();
    private ConsensusConfig consensus = new ConsensusConfig();
    private InferenceConfig inference = new InferenceConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private ExecutorConfig executor = new ExecutorConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public NodeConfig getNode() { return node; }
    public void setNode(NodeConfig node) { this.node = node; }

    public NetworkConfig getNetwork() { return network; }
    public void setNetwork(NetworkConfig network) { this.network = network; }

    public DhtConfig getDht() { return dht; }
    public void setDht(DhtConfig dht) { this.dht = dht; }

    public ConsensusConfig getConsensus() { return consensus; }
    public void setConsensus(ConsensusConfig consensus) { this.consensus = consensus; }

    public InferenceConfig getInference() { return inference; }
    public void setInference(InferenceConfig inference) { this.inference = inference; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public ExecutorConfig getExecutor() { return executor; }
    public void setExecutor(ExecutorConfig executor) { this.executor = executor; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * This node's identity and advertised profile.
     * An empty id is replaced by a generated one at startup.
     */
    public static class NodeConfig {
        private String id = "";
        private String address = "";
        private String type = "full";
        private Set<String> models = new HashSet<>();
        private double computePower = 1.0;
        private double memoryGb = 8.0;
        private double bandwidthMbps = 100.0;
        private boolean gpuAvailable = false;
        private int maxConcurrentInferences = 4;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public Set<String> getModels() { return models; }
        public void setModels(Set<String> models) { this.models = models; }

        public double getComputePower() { return computePower; }
        public void setComputePower(double computePower) { this.computePower = computePower; }

        public double getMemoryGb() { return memoryGb; }
        public void setMemoryGb(double memoryGb) { this.memoryGb = memoryGb; }

        public double getBandwidthMbps() { return bandwidthMbps; }
        public void setBandwidthMbps(double bandwidthMbps) { this.bandwidthMbps = bandwidthMbps; }

        public boolean isGpuAvailable() { return gpuAvailable; }
        public void setGpuAvailable(boolean gpuAvailable) { this.gpuAvailable = gpuAvailable; }

        public int getMaxConcurrentInferences() { return maxConcurrentInferences; }
        public void setMaxConcurrentInferences(int max) { this.maxConcurrentInferences = max; }
    }

    /**
     * Membership, gossip and background loop settings.
     */
    public static class NetworkConfig {
        private List<String> bootstrap = new ArrayList<>();
        private int messageTtl = 10;
        private int maxPeers = 50;
        private int discoveryCount = 20;
        private long heartbeatIntervalMs = 30_000;
        private long maintenanceIntervalMs = 60_000;
        private long staleThresholdMs = 300_000;
        private double reannounceProbability = 0.1;
        private long cacheCleanupIntervalMs = 300_000;
        private long messageCacheTtlMs = 3_600_000;
        private int healthTargetPeers = 10;

        public List<String> getBootstrap() { return bootstrap; }
        public void setBootstrap(List<String> bootstrap) { this.bootstrap = bootstrap; }

        public int getMessageTtl() { return messageTtl; }
        public void setMessageTtl(int messageTtl) { this.messageTtl = messageTtl; }

        public int getMaxPeers() { return maxPeers; }
        public void setMaxPeers(int maxPeers) { this.maxPeers = maxPeers; }

        public int getDiscoveryCount() { return discoveryCount; }
        public void setDiscoveryCount(int discoveryCount) { this.discoveryCount = discoveryCount; }

        public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }

        public long getMaintenanceIntervalMs() { return maintenanceIntervalMs; }
        public void setMaintenanceIntervalMs(long maintenanceIntervalMs) { this.maintenanceIntervalMs = maintenanceIntervalMs; }

        public long getStaleThresholdMs() { return staleThresholdMs; }
        public void setStaleThresholdMs(long staleThresholdMs) { this.staleThresholdMs = staleThresholdMs; }

        public double getReannounceProbability() { return reannounceProbability; }
        public void setReannounceProbability(double reannounceProbability) { this.reannounceProbability = reannounceProbability; }

        public long getCacheCleanupIntervalMs() { return cacheCleanupIntervalMs; }
        public void setCacheCleanupIntervalMs(long cacheCleanupIntervalMs) { this.cacheCleanupIntervalMs = cacheCleanupIntervalMs; }

        public long getMessageCacheTtlMs() { return messageCacheTtlMs; }
        public void setMessageCacheTtlMs(long messageCacheTtlMs) { this.messageCacheTtlMs = messageCacheTtlMs; }

        public int getHealthTargetPeers() { return healthTargetPeers; }
        public void setHealthTargetPeers(int healthTargetPeers) { this.healthTargetPeers = healthTargetPeers; }
    }

    /**
     * Routing table settings.
     */
    public static class DhtConfig {
        private int bucketSize = 20;

        public int getBucketSize() { return bucketSize; }
        public void setBucketSize(int bucketSize) { this.bucketSize = bucketSize; }
    }

    /**
     * Result agreement settings.
     */
    public static class ConsensusConfig {
        private double byzantineTolerance = 0.33;
        private double numericTolerance = 0.01;

        public double getByzantineTolerance() { return byzantineTolerance; }
        public void setByzantineTolerance(double byzantineTolerance) { this.byzantineTolerance = byzantineTolerance; }

        public double getNumericTolerance() { return numericTolerance; }
        public void setNumericTolerance(double numericTolerance) { this.numericTolerance = numericTolerance; }
    }

    /**
     * Task defaults and replica selection.
     */
    public static class InferenceConfig {
        private int redundancy = 3;
        private int defaultPriority = 5;
        private long defaultTimeoutMs = 30_000;
        private String selectionStrategy = "reliability-first";

        public int getRedundancy() { return redundancy; }
        public void setRedundancy(int redundancy) { this.redundancy = redundancy; }

        public int getDefaultPriority() { return defaultPriority; }
        public void setDefaultPriority(int defaultPriority) { this.defaultPriority = defaultPriority; }

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

        public String getSelectionStrategy() { return selectionStrategy; }
        public void setSelectionStrategy(String selectionStrategy) { this.selectionStrategy = selectionStrategy; }
    }

    /**
     * LMAX Disruptor configuration for the inbound message loop.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Local inference backend.
     */
    public static class ExecutorConfig {
        private String type = "none";
        private String baseUrl = "http://localhost:11434";
        private long connectTimeoutMs = 10_000;
        private long requestTimeoutMs = 60_000;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30_000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "inference_mesh";
        private boolean jvmMetrics = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }
    }
}
