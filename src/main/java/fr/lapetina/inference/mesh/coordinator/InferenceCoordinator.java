package fr.lapetina.inference.mesh.coordinator;

import fr.lapetina.inference.mesh.coordinator.exception.InferenceFailureException;
import fr.lapetina.inference.mesh.domain.consensus.ConsensusEngine;
import fr.lapetina.inference.mesh.domain.consensus.ConsensusOutcome;
import fr.lapetina.inference.mesh.domain.consensus.NodeResult;
import fr.lapetina.inference.mesh.domain.dht.DistributedHashTable;
import fr.lapetina.inference.mesh.domain.model.ErrorType;
import fr.lapetina.inference.mesh.domain.model.ExecutionPlan;
import fr.lapetina.inference.mesh.domain.model.InferenceResult;
import fr.lapetina.inference.mesh.domain.model.InferenceTask;
import fr.lapetina.inference.mesh.domain.model.ModelShard;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.model.TaskState;
import fr.lapetina.inference.mesh.domain.sharding.ShardPlanner;
import fr.lapetina.inference.mesh.domain.sharding.ShardRegistry;
import fr.lapetina.inference.mesh.domain.strategy.NodeSelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs one inference task end to end.
 *
 * State transitions per task:
 * PLANNING -> DISPATCHED -> COLLECTING -> CONSENSUS_REACHED | NO_CONSENSUS | FAILED
 *
 * A model with registered shards runs as a pipeline: stages execute strictly in layer
 * order, each consuming the previous output, and the first failing stage aborts the task.
 * Any other model is replicated on up to {@code redundancy} peers; replicas that fail or
 * miss the deadline are left out and the rest go through consensus.
 *
 * The returned future never completes exceptionally.
 */
public final class InferenceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(InferenceCoordinator.class);

    private final String selfId;
    private final Supplier<NodeCapability> localNode;
    private final DistributedHashTable dht;
    private final ShardRegistry shardRegistry;
    private final ConsensusEngine consensusEngine;
    private final InferenceDispatcher dispatcher;
    private final NodeSelectionStrategy strategy;

    private final Map<String, TaskState> activeTasks = new ConcurrentHashMap<>();

    public InferenceCoordinator(
            Supplier<NodeCapability> localNode,
            DistributedHashTable dht,
            ShardRegistry shardRegistry,
            ConsensusEngine consensusEngine,
            InferenceDispatcher dispatcher,
            NodeSelectionStrategy strategy
    ) {
        this.localNode = localNode;
        this.selfId = localNode.get().getNodeId();
        this.dht = dht;
        this.shardRegistry = shardRegistry;
        this.consensusEngine = consensusEngine;
        this.dispatcher = dispatcher;
        this.strategy = strategy;
    }

    public CompletableFuture<InferenceResult> coordinate(InferenceTask task) {
        long startNanos = System.nanoTime();
        String taskId = task.taskId();
        MDC.put("taskId", taskId);
        try {
            transition(taskId, TaskState.PLANNING);
            log.info("Coordinating task: taskId={}, model={}, redundancy={}, timeoutMs={}",
                    taskId, task.modelId(), task.redundancy(), task.timeout().toMillis());

            ExecutionPlan plan = plan(task);
            transition(taskId, TaskState.DISPATCHED);

            CompletableFuture<InferenceResult> execution;
            if (plan instanceof ExecutionPlan.PipelinePlan) {
                execution = executePipeline(task, (ExecutionPlan.PipelinePlan) plan, startNanos);
            } else {
                execution = executeReplicated(task, (ExecutionPlan.ReplicationPlan) plan, startNanos);
            }

            return execution
                    .exceptionally(ex -> failureResult(task, unwrap(ex), startNanos, List.of()))
                    .whenComplete((result, ex) -> finish(task, result));

        } catch (InferenceFailureException e) {
            InferenceResult result = InferenceResult.failure(
                    task, e.getErrorType(), e.getMessage(), elapsed(startNanos), List.of());
            finish(task, result);
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            log.error("Unexpected coordination failure: taskId={}", taskId, e);
            InferenceResult result = InferenceResult.failure(
                    task, ErrorType.INTERNAL_ERROR, e.getMessage(), elapsed(startNanos), List.of());
            finish(task, result);
            return CompletableFuture.completedFuture(result);
        } finally {
            MDC.remove("taskId");
        }
    }

    /**
     * Builds the execution plan for a task.
     *
     * @throws InferenceFailureException with NO_NODES_AVAILABLE or SHARD_UNAVAILABLE
     */
    ExecutionPlan plan(InferenceTask task) {
        List<NodeCapability> candidates = candidatesFor(task.modelId());
        if (candidates.isEmpty()) {
            throw new InferenceFailureException(ErrorType.NO_NODES_AVAILABLE,
                    "No nodes available for model " + task.modelId());
        }

        List<ModelShard> shards = shardRegistry.shardsFor(task.modelId());
        if (!shards.isEmpty()) {
            ExecutionPlan.PipelinePlan pipeline = pipelinePlan(shards, candidates);
            log.debug("Pipeline plan: taskId={}, stages={}, nodes={}",
                    task.taskId(), pipeline.stages().size(), nodeIds(pipeline.nodes()));
            return pipeline;
        }

        List<NodeCapability> selected = strategy.selectNodes(candidates, task.redundancy());
        log.debug("Replication plan: taskId={}, strategy={}, nodes={}",
                task.taskId(), strategy.getName(), nodeIds(selected));
        return new ExecutionPlan.ReplicationPlan(selected);
    }

    private ExecutionPlan.PipelinePlan pipelinePlan(List<ModelShard> shards, List<NodeCapability> candidates) {
        Map<String, NodeCapability> byId = new LinkedHashMap<>();
        candidates.forEach(n -> byId.put(n.getNodeId(), n));

        List<ExecutionPlan.Stage> stages = new ArrayList<>();
        for (ModelShard shard : shards) {
            NodeCapability owner = shardRegistry.holdersOf(shard.shardId()).stream()
                    .map(byId::get)
                    .filter(n -> n != null)
                    .min(ShardPlanner.BEST_FIRST)
                    .orElseThrow(() -> new InferenceFailureException(ErrorType.SHARD_UNAVAILABLE,
                            "No available node holds shard " + shard.shardId()));
            stages.add(new ExecutionPlan.Stage(shard, owner));
        }
        return new ExecutionPlan.PipelinePlan(stages);
    }

    private List<NodeCapability> candidatesFor(String modelId) {
        Map<String, NodeCapability> candidates = new LinkedHashMap<>();
        NodeCapability self = localNode.get();
        if (self.hostsModel(modelId)) {
            candidates.put(self.getNodeId(), self);
        }
        for (NodeCapability node : dht.findNodesWithModel(modelId)) {
            candidates.putIfAbsent(node.getNodeId(), node);
        }
        return new ArrayList<>(candidates.values());
    }

    private CompletableFuture<InferenceResult> executePipeline(
            InferenceTask task,
            ExecutionPlan.PipelinePlan plan,
            long startNanos
    ) {
        List<ExecutionPlan.Stage> stages = plan.stages();
        AtomicBoolean abandoned = new AtomicBoolean(false);
        List<String> contacted = new CopyOnWriteArrayList<>();

        CompletableFuture<Object> chain = CompletableFuture.completedFuture(task.inputData());
        for (int i = 0; i < stages.size(); i++) {
            ExecutionPlan.Stage stage = stages.get(i);
            int stageIndex = i;
            chain = chain.thenCompose(input -> runStage(task, stage, stageIndex, input, abandoned, contacted));
        }

        return chain
                .orTimeout(task.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((output, ex) -> {
                    if (ex == null) {
                        return InferenceResult.success(task, output, elapsed(startNanos), contacted, false);
                    }
                    abandoned.set(true);
                    return failureResult(task, unwrap(ex), startNanos, contacted);
                });
    }

    private CompletableFuture<Object> runStage(
            InferenceTask task,
            ExecutionPlan.Stage stage,
            int stageIndex,
            Object input,
            AtomicBoolean abandoned,
            List<String> contacted
    ) {
        if (abandoned.get()) {
            return CompletableFuture.failedFuture(new InferenceFailureException(ErrorType.TIMEOUT,
                    "Task abandoned before stage " + stageIndex));
        }
        transition(task.taskId(), TaskState.COLLECTING);
        NodeCapability node = stage.node();
        String shardId = stage.shard().shardId();
        long stageStart = System.nanoTime();
        contacted.add(node.getNodeId());

        log.debug("Dispatching stage: taskId={}, stage={}, shard={}, node={}",
                task.taskId(), stageIndex, shardId, node.getNodeId());

        return dispatchSafely(node, task, shardId, input)
                .handle((output, ex) -> {
                    if (ex != null) {
                        strategy.recordFailure(node);
                        Throwable cause = unwrap(ex);
                        log.warn("Stage failed: taskId={}, stage={}, shard={}, node={}, error={}",
                                task.taskId(), stageIndex, shardId, node.getNodeId(), cause.getMessage());
                        throw new InferenceFailureException(ErrorType.STAGE_FAILURE,
                                "Stage " + stageIndex + " (" + shardId + ") failed on node "
                                        + node.getNodeId() + ": " + cause.getMessage(), cause);
                    }
                    strategy.recordSuccess(node, elapsed(stageStart).toMillis());
                    return output;
                });
    }

    private CompletableFuture<InferenceResult> executeReplicated(
            InferenceTask task,
            ExecutionPlan.ReplicationPlan plan,
            long startNanos
    ) {
        transition(task.taskId(), TaskState.COLLECTING);
        long deadlineMs = task.timeout().toMillis();

        List<CompletableFuture<ReplicaOutcome>> replicas = new ArrayList<>();
        for (NodeCapability node : plan.nodes()) {
            long dispatchStart = System.nanoTime();
            log.debug("Dispatching replica: taskId={}, node={}", task.taskId(), node.getNodeId());

            CompletableFuture<ReplicaOutcome> replica = dispatchSafely(node, task, null, task.inputData())
                    .orTimeout(deadlineMs, TimeUnit.MILLISECONDS)
                    .handle((output, ex) -> {
                        if (ex == null) {
                            strategy.recordSuccess(node, elapsed(dispatchStart).toMillis());
                            return ReplicaOutcome.answered(node, output);
                        }
                        strategy.recordFailure(node);
                        Throwable cause = unwrap(ex);
                        boolean timedOut = cause instanceof TimeoutException;
                        log.warn("Replica excluded: taskId={}, node={}, reason={}",
                                task.taskId(), node.getNodeId(),
                                timedOut ? "timeout" : cause.getMessage());
                        return timedOut ? ReplicaOutcome.timedOut(node) : ReplicaOutcome.failed(node);
                    });
            replicas.add(replica);
        }

        return CompletableFuture.allOf(replicas.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<ReplicaOutcome> outcomes = replicas.stream().map(CompletableFuture::join).toList();
                    return collectReplicas(task, outcomes, startNanos);
                });
    }

    private InferenceResult collectReplicas(InferenceTask task, List<ReplicaOutcome> outcomes, long startNanos) {
        List<NodeResult> responses = outcomes.stream()
                .filter(o -> o.status == ReplicaStatus.ANSWERED)
                .map(o -> new NodeResult(o.node.getNodeId(), o.output))
                .toList();
        List<String> responders = responses.stream().map(NodeResult::nodeId).toList();

        if (responses.isEmpty()) {
            boolean anyStraggler = outcomes.stream().anyMatch(o -> o.status == ReplicaStatus.TIMED_OUT);
            ErrorType errorType = anyStraggler ? ErrorType.TIMEOUT : ErrorType.TRANSPORT_ERROR;
            return InferenceResult.failure(task, errorType,
                    "No replica answered out of " + outcomes.size(), elapsed(startNanos), List.of());
        }

        if (responses.size() == 1) {
            return InferenceResult.success(task, responses.get(0).value(), elapsed(startNanos), responders, false);
        }

        ConsensusOutcome outcome = consensusEngine.decide(task.taskId(), responses);
        if (outcome instanceof ConsensusOutcome.Agreed) {
            ConsensusOutcome.Agreed agreed = (ConsensusOutcome.Agreed) outcome;
            return InferenceResult.success(task, agreed.value(), elapsed(startNanos), responders, true);
        }
        ConsensusOutcome.NoConsensus rejected = (ConsensusOutcome.NoConsensus) outcome;
        return InferenceResult.failure(task, ErrorType.CONSENSUS_NOT_REACHED,
                "Largest agreeing group " + rejected.largestCluster() + " of " + rejected.responses()
                        + " below required " + rejected.required(),
                elapsed(startNanos), responders);
    }

    private CompletableFuture<Object> dispatchSafely(
            NodeCapability node,
            InferenceTask task,
            String shardId,
            Object input
    ) {
        try {
            CompletableFuture<Object> future = dispatcher.dispatch(node, task, shardId, input);
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("Dispatcher returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private InferenceResult failureResult(InferenceTask task, Throwable cause, long startNanos, List<String> nodesUsed) {
        if (cause instanceof InferenceFailureException) {
            InferenceFailureException failure = (InferenceFailureException) cause;
            return InferenceResult.failure(task, failure.getErrorType(), failure.getMessage(),
                    elapsed(startNanos), nodesUsed);
        }
        if (cause instanceof TimeoutException) {
            return InferenceResult.failure(task, ErrorType.TIMEOUT,
                    "Task exceeded timeout of " + task.timeout().toMillis() + "ms",
                    elapsed(startNanos), nodesUsed);
        }
        log.error("Unexpected execution failure: taskId={}", task.taskId(), cause);
        return InferenceResult.failure(task, ErrorType.INTERNAL_ERROR, String.valueOf(cause.getMessage()),
                elapsed(startNanos), nodesUsed);
    }

    private void finish(InferenceTask task, InferenceResult result) {
        activeTasks.remove(task.taskId());
        if (result == null) {
            return;
        }
        if (result.success()) {
            log.info("Task completed: taskId={}, model={}, nodes={}, consensus={}, latencyMs={}",
                    task.taskId(), task.modelId(), result.nodesUsed(), result.consensusInvoked(),
                    result.executionTime().toMillis());
        } else {
            log.warn("Task failed: taskId={}, model={}, state={}, errorType={}, errorMessage={}",
                    task.taskId(), task.modelId(), result.finalState(), result.errorType(),
                    result.errorMessage());
        }
    }

    private void transition(String taskId, TaskState state) {
        activeTasks.put(taskId, state);
    }

    public Optional<TaskState> getTaskState(String taskId) {
        return Optional.ofNullable(activeTasks.get(taskId));
    }

    public int activeTaskCount() {
        return activeTasks.size();
    }

    public Map<String, TaskState> getActiveTasks() {
        return Collections.unmodifiableMap(activeTasks);
    }

    public String getSelfId() {
        return selfId;
    }

    public NodeSelectionStrategy getStrategy() {
        return strategy;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static List<String> nodeIds(List<NodeCapability> nodes) {
        return nodes.stream().map(NodeCapability::getNodeId).toList();
    }

    private enum ReplicaStatus {
        ANSWERED,
        FAILED,
        TIMED_OUT
    }

    private static final class ReplicaOutcome {
        private final NodeCapability node;
        private final ReplicaStatus status;
        private final Object output;

        private ReplicaOutcome(NodeCapability node, ReplicaStatus status, Object output) {
            this.node = node;
            this.status = status;
            this.output = output;
        }

        static ReplicaOutcome answered(NodeCapability node, Object output) {
            return new ReplicaOutcome(node, ReplicaStatus.ANSWERED, output);
        }

        static ReplicaOutcome failed(NodeCapability node) {
            return new ReplicaOutcome(node, ReplicaStatus.FAILED, null);
        }

        static ReplicaOutcome timedOut(NodeCapability node) {
            return new ReplicaOutcome(node, ReplicaStatus.TIMED_OUT, null);
        }
    }
}
