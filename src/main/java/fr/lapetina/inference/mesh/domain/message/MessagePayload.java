package fr.lapetina.inference.mesh.domain.message;

import fr.lapetina.inference.mesh.domain.model.ModelShard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed body of a {@link P2PMessage}, one record per {@link MessageType}.
 */
public sealed interface MessagePayload {

    /**
     * A peer advertising its capability profile.
     */
    record NodeAnnounce(NodeDescriptor node) implements MessagePayload {
        public NodeAnnounce {
            Objects.requireNonNull(node, "Node descriptor is required");
        }
    }

    /**
     * Asks the receiver for up to {@code count} peers it knows.
     */
    record NodeQuery(String queryType, int count) implements MessagePayload {
        public static final String DISCOVER_PEERS = "discover_peers";

        public static NodeQuery discoverPeers(int count) {
            return new NodeQuery(DISCOVER_PEERS, count);
        }
    }

    record NodeResponse(List<NodeDescriptor> peers) implements MessagePayload {
        public NodeResponse {
            peers = peers != null ? List.copyOf(peers) : List.of();
        }
    }

    /**
     * A peer announcing that it hosts a model. May carry a shard plan and its placement
     * (shard id to holder node ids).
     */
    record ModelAnnounce(
            String modelId,
            String nodeId,
            Map<String, Object> modelInfo,
            long timestamp,
            List<ModelShard> shards,
            Map<String, List<String>> placement
    ) implements MessagePayload {
        public ModelAnnounce {
            Objects.requireNonNull(modelId, "Model ID is required");
            modelInfo = modelInfo != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(modelInfo))
                    : Map.of();
            shards = shards != null ? List.copyOf(shards) : List.of();
            placement = placement != null ? Map.copyOf(placement) : Map.of();
        }

        public boolean hasShardPlan() {
            return !shards.isEmpty();
        }
    }

    record ModelRequest(String modelId) implements MessagePayload {
    }

    /**
     * Asks the receiver to run a model, or one shard of it, on the given input.
     */
    record InferenceRequest(
            String requestId,
            String taskId,
            String modelId,
            String shardId,
            Object inputData
    ) implements MessagePayload {
        public InferenceRequest {
            Objects.requireNonNull(requestId, "Request ID is required");
        }
    }

    record InferenceResponse(
            String requestId,
            String taskId,
            boolean success,
            Object result,
            String error
    ) implements MessagePayload {
        public InferenceResponse {
            Objects.requireNonNull(requestId, "Request ID is required");
        }
    }

    record Heartbeat(long timestamp, double load, int activeInferences) implements MessagePayload {
    }

    /**
     * Membership change. The only update type currently acted on is {@link #LEAVE}.
     */
    record NetworkUpdate(String updateType, String nodeId) implements MessagePayload {
        public static final String LEAVE = "leave";

        public static NetworkUpdate leave(String nodeId) {
            return new NetworkUpdate(LEAVE, nodeId);
        }

        public boolean announcesLeave() {
            return LEAVE.equals(updateType);
        }
    }
}
