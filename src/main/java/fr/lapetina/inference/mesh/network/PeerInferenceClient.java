package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.coordinator.InferenceDispatcher;
import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.domain.model.InferenceTask;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.sharding.ShardRegistry;
import fr.lapetina.inference.mesh.infrastructure.executor.InferenceExecutionException;
import fr.lapetina.inference.mesh.infrastructure.executor.InferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs inference work on behalf of the coordinator.
 *
 * Work for this node goes straight to the local {@link InferenceExecutor}. Work for a peer
 * is sent as an INFERENCE_REQUEST and the returned future is completed by the matching
 * INFERENCE_RESPONSE. Pending requests are removed when answered, when the task timeout
 * elapses or when the client shuts down, so nothing outlives its task.
 */
public final class PeerInferenceClient implements InferenceDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PeerInferenceClient.class);

    private final NodeCapability self;
    private final InferenceExecutor executor;
    private final ShardRegistry shardRegistry;
    private final MessageRouter router;
    private final Clock clock;
    private final int maxConcurrentInferences;

    private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger activeExecutions = new AtomicInteger(0);

    public PeerInferenceClient(
            NodeCapability self,
            InferenceExecutor executor,
            ShardRegistry shardRegistry,
            MessageRouter router,
            Clock clock,
            int maxConcurrentInferences
    ) {
        this.self = self;
        this.executor = executor;
        this.shardRegistry = shardRegistry;
        this.router = router;
        this.clock = clock;
        this.maxConcurrentInferences = Math.max(1, maxConcurrentInferences);
    }

    @Override
    public CompletableFuture<Object> dispatch(NodeCapability node, InferenceTask task, String shardId, Object input) {
        if (self.getNodeId().equals(node.getNodeId())) {
            return executeLocally(task.modelId(), shardId, input);
        }
        return sendRemote(node, task, shardId, input);
    }

    private CompletableFuture<Object> sendRemote(NodeCapability node, InferenceTask task, String shardId, Object input) {
        String requestId = UUID.randomUUID().toString();
        CompletableFuture<Object> response = new CompletableFuture<>();
        pending.put(requestId, response);
        response.orTimeout(task.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> pending.remove(requestId));

        MessagePayload.InferenceRequest request = new MessagePayload.InferenceRequest(
                requestId, task.taskId(), task.modelId(), shardId, input);
        P2PMessage message = P2PMessage.create(
                MessageType.INFERENCE_REQUEST, self.getNodeId(), request, clock.millis());

        log.debug("Sending inference request: requestId={}, taskId={}, peer={}, shard={}",
                requestId, task.taskId(), node.getNodeId(), shardId);

        router.send(node.getNodeId(), message).whenComplete((sent, ex) -> {
            if (ex != null) {
                response.completeExceptionally(
                        new TransportException(node.getNodeId(), "Inference request not delivered", ex));
            }
        });
        return response;
    }

    /**
     * Completes the pending request an INFERENCE_RESPONSE answers.
     *
     * @return false if no request with that id is pending (late or unknown response)
     */
    public boolean complete(MessagePayload.InferenceResponse response) {
        CompletableFuture<Object> future = pending.remove(response.requestId());
        if (future == null) {
            log.debug("Ignoring late or unknown inference response: requestId={}, taskId={}",
                    response.requestId(), response.taskId());
            return false;
        }
        if (response.success()) {
            future.complete(response.result());
        } else {
            future.completeExceptionally(new InferenceExecutionException(
                    response.error() != null ? response.error() : "Remote inference failed"));
        }
        return true;
    }

    /**
     * Runs work on this node's executor. Whole-model work requires the model to be hosted
     * here, shard work requires this node to be a registered holder of the shard.
     */
    public CompletableFuture<Object> executeLocally(String modelId, String shardId, Object input) {
        if (shardId == null && !self.hostsModel(modelId)) {
            return CompletableFuture.failedFuture(
                    new InferenceExecutionException("Model not hosted on " + self.getNodeId() + ": " + modelId));
        }
        if (shardId != null && !shardRegistry.holdersOf(shardId).contains(self.getNodeId())) {
            return CompletableFuture.failedFuture(
                    new InferenceExecutionException("Shard not held by " + self.getNodeId() + ": " + shardId));
        }

        activeExecutions.incrementAndGet();
        updateLoad();
        CompletableFuture<Object> execution;
        try {
            execution = executor.execute(modelId, shardId, input);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        return execution.whenComplete((output, ex) -> {
            activeExecutions.decrementAndGet();
            updateLoad();
        });
    }

    private void updateLoad() {
        self.setCurrentLoad(activeExecutions.get() / (double) maxConcurrentInferences);
    }

    /**
     * Fails every pending remote request.
     */
    public void shutdown() {
        List<String> ids = new ArrayList<>(pending.keySet());
        for (String requestId : ids) {
            CompletableFuture<Object> future = pending.remove(requestId);
            if (future != null) {
                future.completeExceptionally(new TransportException(self.getNodeId(), "Node shutting down"));
            }
        }
        if (!ids.isEmpty()) {
            log.info("Pending inference requests failed on shutdown: count={}", ids.size());
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    public int activeExecutions() {
        return activeExecutions.get();
    }
}
