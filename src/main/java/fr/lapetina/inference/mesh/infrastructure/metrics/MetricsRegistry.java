package fr.lapetina.inference.mesh.infrastructure.metrics;

import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Message counters per type and direction, drops per reason
 * - Inference outcome counters and latency timer
 * - Peer, known node and active inference gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> messageCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> dropCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> inferenceCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> consensusCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Timer inferenceLatency;

    private final AtomicInteger connectedPeers = new AtomicInteger(0);
    private final AtomicInteger knownNodes = new AtomicInteger(0);
    private final AtomicInteger activeInferences = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix, boolean jvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (jvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_connected_peers", connectedPeers, AtomicInteger::get)
                .description("Number of directly connected peers")
                .register(registry);

        Gauge.builder(prefix + "_known_nodes", knownNodes, AtomicInteger::get)
                .description("Number of nodes in the routing table")
                .register(registry);

        Gauge.builder(prefix + "_active_inferences", activeInferences, AtomicInteger::get)
                .description("Inference tasks currently coordinated or executed by this node")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the inbound ring buffer")
                .register(registry);

        this.inferenceLatency = Timer.builder(prefix + "_inference_latency")
                .description("End-to-end coordinated inference latency")
                .publishPercentileHistogram()
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("inference_mesh");
    }

    public void incrementMessageReceived(MessageType type) {
        countMessage(type, "in");
    }

    public void incrementMessageSent(MessageType type) {
        countMessage(type, "out");
    }

    private void countMessage(MessageType type, String direction) {
        String key = type.name() + ":" + direction;
        messageCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_messages_total")
                        .description("Total number of mesh messages")
                        .tag("type", type.name())
                        .tag("direction", direction)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts an inbound message that was not processed (duplicate, expired, undecodable, backpressure).
     */
    public void incrementMessageDropped(String reason) {
        dropCounters.computeIfAbsent(reason, k ->
                Counter.builder(prefix + "_messages_dropped_total")
                        .description("Inbound messages dropped before processing")
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    /**
     * Records a finished coordinated inference.
     *
     * @param errorType null for a success
     */
    public void recordInference(String model, ErrorType errorType, Duration latency) {
        String outcome = errorType == null ? "SUCCESS" : errorType.name();
        inferenceCounters.computeIfAbsent(model + ":" + outcome, k ->
                Counter.builder(prefix + "_inferences_total")
                        .description("Total number of coordinated inferences")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        inferenceLatency.record(latency);
    }

    public void recordConsensus(boolean reached) {
        String outcome = reached ? "reached" : "not_reached";
        consensusCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_consensus_total")
                        .description("Consensus rounds by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (decode, dispatch, etc.).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Inbound pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void setConnectedPeers(int value) {
        connectedPeers.set(value);
    }

    public void setKnownNodes(int value) {
        knownNodes.set(value);
    }

    public void setActiveInferences(int value) {
        activeInferences.set(value);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public long getInferencesSucceeded() {
        return sum(inferenceCounters, key -> key.endsWith(":SUCCESS"));
    }

    public long getInferencesFailed() {
        return sum(inferenceCounters, key -> !key.endsWith(":SUCCESS"));
    }

    /**
     * Totals of the registered counters for status reporting.
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("messagesReceived", sum(messageCounters, key -> key.endsWith(":in")));
        values.put("messagesSent", sum(messageCounters, key -> key.endsWith(":out")));
        values.put("messagesDropped", sum(dropCounters, key -> true));
        values.put("inferencesSucceeded", getInferencesSucceeded());
        values.put("inferencesFailed", getInferencesFailed());
        return values;
    }

    private static long sum(Map<String, Counter> counters, Predicate<String> keyFilter) {
        double total = 0;
        for (Map.Entry<String, Counter> entry : counters.entrySet()) {
            if (keyFilter.test(entry.getKey())) {
                total += entry.getValue().count();
            }
        }
        return (long) total;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    @Override
    public void close() {
        registry.close();
    }
}
