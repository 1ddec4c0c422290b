package fr.lapetina.inference.mesh.domain.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Advertised profile of one peer in the mesh.
 *
 * The hardware profile is fixed at announcement time. Hosted models, last-seen time,
 * reported load and reliability change as announcements, heartbeats and dispatch
 * outcomes arrive, and are safe to update from multiple threads.
 */
public final class NodeCapability {

    static final double FAILURE_DECAY = 0.9;
    static final double SUCCESS_RECOVERY = 0.02;

    private final String nodeId;
    private final String address;
    private final NodeType nodeType;
    private final double computePower;
    private final double memoryGb;
    private final double bandwidthMbps;
    private final boolean gpuAvailable;

    // Mutable state - thread-safe
    private final Set<String> models;
    private final AtomicReference<Double> reliabilityScore;
    private volatile long lastSeen;
    private volatile double currentLoad;

    private NodeCapability(Builder builder) {
        this.nodeId = Objects.requireNonNull(builder.nodeId, "Node ID is required");
        this.address = builder.address != null ? builder.address : builder.nodeId;
        this.nodeType = Objects.requireNonNull(builder.nodeType, "Node type is required");
        this.computePower = builder.computePower;
        this.memoryGb = builder.memoryGb;
        this.bandwidthMbps = builder.bandwidthMbps;
        this.gpuAvailable = builder.gpuAvailable;
        this.models = ConcurrentHashMap.newKeySet();
        this.models.addAll(builder.models);
        this.reliabilityScore = new AtomicReference<>(clamp(builder.reliabilityScore));
        this.lastSeen = builder.lastSeen;
        this.currentLoad = builder.currentLoad;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getAddress() {
        return address;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public double getComputePower() {
        return computePower;
    }

    public double getMemoryGb() {
        return memoryGb;
    }

    public double getBandwidthMbps() {
        return bandwidthMbps;
    }

    public boolean isGpuAvailable() {
        return gpuAvailable;
    }

    public Set<String> getModels() {
        return Collections.unmodifiableSet(models);
    }

    public boolean hostsModel(String modelId) {
        return models.contains(modelId);
    }

    public void addModel(String modelId) {
        models.add(modelId);
    }

    public double getReliabilityScore() {
        return reliabilityScore.get();
    }

    /**
     * Lowers reliability after a failed or timed-out dispatch.
     *
     * @return the new score
     */
    public double recordFailure() {
        return reliabilityScore.updateAndGet(score -> clamp(score * FAILURE_DECAY));
    }

    /**
     * Raises reliability after a successful dispatch, capped at 1.0.
     *
     * @return the new score
     */
    public double recordSuccess() {
        return reliabilityScore.updateAndGet(score -> clamp(score + SUCCESS_RECOVERY));
    }

    public long getLastSeen() {
        return lastSeen;
    }

    public void touch(long nowMillis) {
        if (nowMillis > lastSeen) {
            this.lastSeen = nowMillis;
        }
    }

    public double getCurrentLoad() {
        return currentLoad;
    }

    public void setCurrentLoad(double load) {
        this.currentLoad = Math.max(0.0, Math.min(1.0, load));
    }

    /**
     * Checks whether this peer has been heard from within the staleness window.
     */
    public boolean isFresh(long nowMillis, long staleThresholdMillis) {
        return nowMillis - lastSeen <= staleThresholdMillis;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeCapability that = (NodeCapability) o;
        return nodeId.equals(that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId);
    }

    @Override
    public String toString() {
        return "NodeCapability{" +
                "nodeId='" + nodeId + '\'' +
                ", type=" + nodeType +
                ", models=" + models +
                ", computePower=" + computePower +
                ", reliability=" + String.format("%.2f", reliabilityScore.get()) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String nodeId;
        private String address;
        private NodeType nodeType = NodeType.FULL_NODE;
        private final Set<String> models = ConcurrentHashMap.newKeySet();
        private double computePower = 1.0;
        private double memoryGb = 8.0;
        private double bandwidthMbps = 100.0;
        private boolean gpuAvailable;
        private double reliabilityScore = 1.0;
        private long lastSeen;
        private double currentLoad;

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder nodeType(NodeType nodeType) {
            this.nodeType = nodeType;
            return this;
        }

        public Builder addModel(String model) {
            this.models.add(model);
            return this;
        }

        public Builder models(Set<String> models) {
            if (models != null) {
                this.models.addAll(models);
            }
            return this;
        }

        public Builder computePower(double computePower) {
            this.computePower = computePower;
            return this;
        }

        public Builder memoryGb(double memoryGb) {
            this.memoryGb = memoryGb;
            return this;
        }

        public Builder bandwidthMbps(double bandwidthMbps) {
            this.bandwidthMbps = bandwidthMbps;
            return this;
        }

        public Builder gpuAvailable(boolean gpuAvailable) {
            this.gpuAvailable = gpuAvailable;
            return this;
        }

        public Builder reliabilityScore(double reliabilityScore) {
            this.reliabilityScore = reliabilityScore;
            return this;
        }

        public Builder lastSeen(long lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder currentLoad(double currentLoad) {
            this.currentLoad = currentLoad;
            return this;
        }

        public NodeCapability build() {
            return new NodeCapability(this);
        }
    }
}
