package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.coordinator.InferenceCoordinator;
import fr.lapetina.inference.mesh.coordinator.exception.InferenceFailureException;
import fr.lapetina.inference.mesh.disruptor.GossipPipeline;
import fr.lapetina.inference.mesh.disruptor.exception.BackpressureException;
import fr.lapetina.inference.mesh.domain.consensus.ConsensusEngine;
import fr.lapetina.inference.mesh.domain.dht.DistributedHashTable;
import fr.lapetina.inference.mesh.domain.message.MessageCache;
import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.NodeDescriptor;
import fr.lapetina.inference.mesh.domain.model.ErrorType;
import fr.lapetina.inference.mesh.domain.model.InferenceResult;
import fr.lapetina.inference.mesh.domain.model.InferenceTask;
import fr.lapetina.inference.mesh.domain.model.ModelShard;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.model.NodeType;
import fr.lapetina.inference.mesh.domain.sharding.ShardPlanner;
import fr.lapetina.inference.mesh.domain.sharding.ShardRegistry;
import fr.lapetina.inference.mesh.domain.strategy.NodeSelectionStrategy;
import fr.lapetina.inference.mesh.domain.strategy.StrategyFactory;
import fr.lapetina.inference.mesh.infrastructure.config.MeshConfig;
import fr.lapetina.inference.mesh.infrastructure.executor.InferenceExecutor;
import fr.lapetina.inference.mesh.infrastructure.health.NetworkHealth;
import fr.lapetina.inference.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.mesh.infrastructure.transport.MessageCodec;
import fr.lapetina.inference.mesh.infrastructure.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * One node of the mesh: membership, model announcements, shard distribution and the
 * public inference API.
 *
 * Lifecycle: constructed stopped; {@link #startNetwork(List)} starts the inbound event
 * loop and background loops and joins through the first reachable bootstrap address;
 * {@link #stopNetwork()} tells peers this node is leaving and releases everything.
 * A stopped node cannot be restarted.
 */
public final class NetworkManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkManager.class);

    private final MeshConfig config;
    private final Clock clock;
    private final Transport transport;
    private final InferenceExecutor executor;
    private final MetricsRegistry metricsRegistry;

    private final NodeCapability self;
    private final DistributedHashTable dht;
    private final ShardRegistry shardRegistry;
    private final ShardPlanner shardPlanner;
    private final MessageCache messageCache;
    private final PeerTable peerTable;
    private final MessageRouter router;
    private final PeerInferenceClient inferenceClient;
    private final InferenceCoordinator coordinator;
    private final NodeContext context;
    private final GossipPipeline pipeline;
    private final PeerLivenessMonitor livenessMonitor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public NetworkManager(
            MeshConfig config,
            Transport transport,
            InferenceExecutor executor,
            MetricsRegistry metricsRegistry,
            Clock clock,
            DoubleSupplier random
    ) {
        this.config = config;
        this.clock = clock;
        this.transport = transport;
        this.executor = executor;
        this.metricsRegistry = metricsRegistry;

        MeshConfig.NodeConfig nodeConfig = config.getNode();
        MeshConfig.NetworkConfig networkConfig = config.getNetwork();
        String nodeId = resolveNodeId(nodeConfig);
        String address = nodeConfig.getAddress() == null || nodeConfig.getAddress().isBlank()
                ? transport.localAddress()
                : nodeConfig.getAddress();

        this.self = NodeCapability.builder()
                .nodeId(nodeId)
                .address(address)
                .nodeType(NodeType.fromConfig(nodeConfig.getType()))
                .models(nodeConfig.getModels())
                .computePower(nodeConfig.getComputePower())
                .memoryGb(nodeConfig.getMemoryGb())
                .bandwidthMbps(nodeConfig.getBandwidthMbps())
                .gpuAvailable(nodeConfig.isGpuAvailable())
                .lastSeen(clock.millis())
                .build();

        this.dht = new DistributedHashTable(
                nodeId,
                config.getDht().getBucketSize(),
                Duration.ofMillis(networkConfig.getStaleThresholdMs()),
                clock);
        this.shardRegistry = new ShardRegistry();
        this.shardPlanner = new ShardPlanner(clock);
        this.messageCache = new MessageCache(clock);
        this.peerTable = new PeerTable(networkConfig.getMaxPeers(), clock);

        MessageCodec codec = new MessageCodec();
        this.router = new MessageRouter(nodeId, transport, codec, peerTable, messageCache, metricsRegistry);
        this.inferenceClient = new PeerInferenceClient(
                self, executor, shardRegistry, router, clock, nodeConfig.getMaxConcurrentInferences());

        NodeSelectionStrategy strategy = StrategyFactory.createOrDefault(
                config.getInference().getSelectionStrategy());
        ConsensusEngine consensusEngine = new ConsensusEngine(
                config.getConsensus().getByzantineTolerance(),
                config.getConsensus().getNumericTolerance());
        this.coordinator = new InferenceCoordinator(
                () -> self, dht, shardRegistry, consensusEngine, inferenceClient, strategy);

        this.context = new NodeContext(
                self, dht, shardRegistry, router, inferenceClient, clock, networkConfig.getMessageTtl());

        this.pipeline = GossipPipeline.builder()
                .fromConfig(config.getDisruptor())
                .threadNamePrefix("mesh-inbound-" + nodeId)
                .codec(codec)
                .messageCache(messageCache)
                .inboundHandler(new MessageDispatcher(context, peerTable))
                .forwarder(router)
                .metricsRegistry(metricsRegistry)
                .build();

        this.livenessMonitor = new PeerLivenessMonitor(
                context, peerTable, messageCache, this::activeInferences, this::announceNode,
                random, networkConfig);

        log.info("Node created: nodeId={}, type={}, address={}, models={}, strategy={}",
                nodeId, self.getNodeType(), address, self.getModels(), strategy.getName());
    }

    public NetworkManager(MeshConfig config, Transport transport, InferenceExecutor executor,
                          MetricsRegistry metricsRegistry) {
        this(config, transport, executor, metricsRegistry, Clock.systemUTC(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Returns the configured node id, or a generated one when none is configured.
     */
    public static String resolveNodeId(MeshConfig.NodeConfig nodeConfig) {
        String id = nodeConfig.getId();
        if (id == null || id.isBlank()) {
            return "node-" + UUID.randomUUID().toString().substring(0, 8);
        }
        return id;
    }

    /**
     * Starts the node and joins the mesh.
     *
     * Bootstrap addresses are tried in order until one connects; that peer is asked for
     * more peers. The node then announces itself and every model it hosts. An empty list,
     * or no reachable address, starts a new mesh.
     *
     * @return future completing once the join attempt and announcements are done
     */
    public CompletableFuture<Void> startNetwork(List<String> bootstrapAddresses) {
        if (stopped.get()) {
            throw new IllegalStateException("Node " + self.getNodeId() + " was stopped and cannot restart");
        }
        if (!running.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }

        transport.onMessage(this::onTransportMessage);
        pipeline.start();
        livenessMonitor.start();
        log.info("Network started: nodeId={}, type={}", self.getNodeId(), self.getNodeType());

        List<String> addresses = bootstrapAddresses != null ? bootstrapAddresses : List.of();
        return joinNetwork(addresses).thenRun(() -> {
            announceNode();
            for (String modelId : self.getModels()) {
                announceModel(modelId, Map.of());
            }
        });
    }

    public CompletableFuture<Void> startNetwork() {
        return startNetwork(config.getNetwork().getBootstrap());
    }

    private CompletableFuture<Void> joinNetwork(List<String> addresses) {
        CompletableFuture<Optional<String>> attempt = CompletableFuture.completedFuture(Optional.empty());
        for (String address : addresses) {
            attempt = attempt.thenCompose(joined -> {
                if (joined.isPresent()) {
                    return CompletableFuture.completedFuture(joined);
                }
                return router.connect(address)
                        .thenApply(Optional::of)
                        .exceptionally(ex -> {
                            log.warn("Bootstrap address unreachable: address={}, reason={}",
                                    address, ex.getMessage());
                            return Optional.empty();
                        });
            });
        }
        return attempt.thenAccept(joined -> {
            if (joined.isPresent()) {
                String peerId = joined.get();
                log.info("Joined network via bootstrap: peer={}", peerId);
                router.send(peerId, context.newMessage(MessageType.NODE_QUERY,
                        MessagePayload.NodeQuery.discoverPeers(config.getNetwork().getDiscoveryCount())));
            } else if (!addresses.isEmpty()) {
                log.warn("No bootstrap address reachable, starting a new network: tried={}", addresses.size());
            }
        });
    }

    /**
     * Stops the node: tells peers it is leaving, cancels background loops, fails pending
     * remote dispatches and drains the inbound event loop.
     */
    public void stopNetwork() {
        if (!running.compareAndSet(true, false)) {
            stopped.set(true);
            return;
        }
        stopped.set(true);
        log.info("Stopping network: nodeId={}", self.getNodeId());

        router.broadcast(context.newMessage(MessageType.NETWORK_UPDATE,
                MessagePayload.NetworkUpdate.leave(self.getNodeId())));

        livenessMonitor.close();
        inferenceClient.shutdown();
        transport.onMessage((from, data) -> { });
        pipeline.close();
        for (String peerId : peerTable.connectedPeerIds()) {
            router.disconnect(peerId);
        }
        log.info("Network stopped: nodeId={}", self.getNodeId());
    }

    /**
     * Announces that this node hosts a model.
     */
    public void announceModel(String modelId, Map<String, Object> modelInfo) {
        self.addModel(modelId);
        MessagePayload.ModelAnnounce announce = new MessagePayload.ModelAnnounce(
                modelId, self.getNodeId(), modelInfo, clock.millis(), null, null);
        dht.storeData("model:" + modelId, announce);
        int peers = router.broadcast(context.newMessage(MessageType.MODEL_ANNOUNCE, announce));
        log.info("Model announced: modelId={}, peers={}", modelId, peers);
    }

    /**
     * Splits a model across the known nodes hosting it, registers the plan locally and
     * gossips it so every node runs the model as a pipeline.
     *
     * @return the shards in layer order
     * @throws InferenceFailureException with NO_NODES_AVAILABLE if no known node hosts the model
     */
    public List<ModelShard> distributeModel(String modelId, int totalLayers) {
        List<NodeCapability> hosts = new ArrayList<>();
        if (self.hostsModel(modelId)) {
            hosts.add(self);
        }
        hosts.addAll(dht.findNodesWithModel(modelId));
        if (hosts.isEmpty()) {
            throw new InferenceFailureException(ErrorType.NO_NODES_AVAILABLE,
                    "No nodes host model " + modelId);
        }

        List<ModelShard> shards = shardPlanner.createShardingPlan(modelId, totalLayers, hosts);
        Map<String, List<String>> placement = shardPlanner.optimizeShardPlacement(shards, hosts);
        shardRegistry.register(shards, placement);
        dht.storeData("shards:" + modelId, shards);

        Map<String, Object> modelInfo = new LinkedHashMap<>();
        modelInfo.put("totalLayers", totalLayers);
        MessagePayload.ModelAnnounce announce = new MessagePayload.ModelAnnounce(
                modelId, self.getNodeId(), modelInfo, clock.millis(), shards, placement);
        int peers = router.broadcast(context.newMessage(MessageType.MODEL_ANNOUNCE, announce));

        log.info("Model distributed: modelId={}, layers={}, shards={}, hosts={}, peers={}",
                modelId, totalLayers, shards.size(), hosts.size(), peers);
        return shards;
    }

    /**
     * Asks the mesh who hosts a model. Hosts answer with a direct MODEL_ANNOUNCE.
     */
    public void requestModel(String modelId) {
        int peers = router.broadcast(context.newMessage(MessageType.MODEL_REQUEST,
                new MessagePayload.ModelRequest(modelId)));
        log.debug("Model requested: modelId={}, peers={}", modelId, peers);
    }

    public CompletableFuture<InferenceResult> requestInference(String modelId, Object input) {
        return requestInference(modelId, input, config.getInference().getDefaultPriority(),
                Duration.ofMillis(config.getInference().getDefaultTimeoutMs()));
    }

    public CompletableFuture<InferenceResult> requestInference(
            String modelId, Object input, int priority, Duration timeout) {
        return requestInference(modelId, input, priority, timeout, config.getInference().getRedundancy());
    }

    /**
     * Runs one inference task. The future always completes normally; failures are
     * reported through {@link InferenceResult#errorType()}.
     */
    public CompletableFuture<InferenceResult> requestInference(
            String modelId, Object input, int priority, Duration timeout, int redundancy) {
        InferenceTask task = InferenceTask.builder()
                .modelId(modelId)
                .inputData(input)
                .priority(priority)
                .timeout(timeout)
                .redundancy(redundancy)
                .createdAt(clock.instant())
                .clientId(self.getNodeId())
                .build();
        return submit(task);
    }

    public CompletableFuture<InferenceResult> submit(InferenceTask task) {
        metricsRegistry.setActiveInferences(activeInferences() + 1);
        return coordinator.coordinate(task).whenComplete((result, ex) -> {
            if (result != null) {
                metricsRegistry.recordInference(task.modelId(), result.errorType(), result.executionTime());
                if (result.consensusInvoked()) {
                    metricsRegistry.recordConsensus(result.consensusReached());
                }
            }
            metricsRegistry.setActiveInferences(activeInferences());
        });
    }

    public NetworkStatus getNetworkStatus() {
        int connected = peerTable.size();
        int known = dht.knownNodeCount();
        metricsRegistry.setConnectedPeers(connected);
        metricsRegistry.setKnownNodes(known);

        int distinctTypes = (int) dht.getAllNodes().stream()
                .map(NodeCapability::getNodeType)
                .distinct()
                .count();
        long succeeded = metricsRegistry.getInferencesSucceeded();
        long completed = succeeded + metricsRegistry.getInferencesFailed();
        double health = NetworkHealth.score(connected, distinctTypes, succeeded, completed,
                config.getNetwork().getHealthTargetPeers());

        return new NetworkStatus(
                self.getNodeId(),
                self.getNodeType(),
                running.get(),
                connected,
                known,
                shardRegistry.shardsHeldBy(self.getNodeId()),
                activeInferences(),
                metricsRegistry.snapshot(),
                health
        );
    }

    void announceNode() {
        self.touch(clock.millis());
        int peers = router.broadcast(context.newMessage(MessageType.NODE_ANNOUNCE,
                new MessagePayload.NodeAnnounce(NodeDescriptor.from(self))));
        log.debug("Node announced: nodeId={}, peers={}", self.getNodeId(), peers);
    }

    private void onTransportMessage(String fromPeerId, byte[] data) {
        try {
            pipeline.publish(fromPeerId, data);
        } catch (BackpressureException e) {
            metricsRegistry.incrementMessageDropped(e.getReason().name().toLowerCase());
            log.warn("Inbound message dropped: from={}, reason={}", fromPeerId, e.getReason());
        }
    }

    private int activeInferences() {
        return coordinator.activeTaskCount() + inferenceClient.activeExecutions();
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getNodeId() {
        return self.getNodeId();
    }

    public NodeCapability getSelf() {
        return self;
    }

    public DistributedHashTable getDht() {
        return dht;
    }

    public ShardRegistry getShardRegistry() {
        return shardRegistry;
    }

    public PeerTable getPeerTable() {
        return peerTable;
    }

    public InferenceCoordinator getCoordinator() {
        return coordinator;
    }

    public PeerLivenessMonitor getLivenessMonitor() {
        return livenessMonitor;
    }

    public InferenceExecutor getExecutor() {
        return executor;
    }

    @Override
    public void close() {
        stopNetwork();
    }
}
