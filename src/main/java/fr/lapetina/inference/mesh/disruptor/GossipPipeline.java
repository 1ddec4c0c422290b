package fr.lapetina.inference.mesh.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.inference.mesh.disruptor.exception.BackpressureException;
import fr.lapetina.inference.mesh.disruptor.handlers.CompletionHandler;
import fr.lapetina.inference.mesh.disruptor.handlers.DecodeHandler;
import fr.lapetina.inference.mesh.disruptor.handlers.DeduplicationHandler;
import fr.lapetina.inference.mesh.disruptor.handlers.GossipForwardHandler;
import fr.lapetina.inference.mesh.disruptor.handlers.GossipForwarder;
import fr.lapetina.inference.mesh.disruptor.handlers.InboundMessageHandler;
import fr.lapetina.inference.mesh.disruptor.handlers.MessageDispatchHandler;
import fr.lapetina.inference.mesh.disruptor.handlers.MetricsHandler;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.domain.event.MessageEventFactory;
import fr.lapetina.inference.mesh.domain.message.MessageCache;
import fr.lapetina.inference.mesh.infrastructure.config.MeshConfig;
import fr.lapetina.inference.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.mesh.infrastructure.transport.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Inbound event loop of a node.
 *
 * Every message received from the transport is published into a ring buffer and flows
 * through one consumer chain:
 * <pre>
 * Decode -> Deduplicate -> Dispatch -> Forward -> Metrics -> Completion
 * </pre>
 * Handlers run on dedicated consumer threads, one per stage, and each stage sees events in
 * publish order, so all state changes caused by inbound messages are applied sequentially.
 *
 * MULTI producer: transport threads and the in-memory hub publish concurrently.
 * A full ring buffer rejects the message with {@link BackpressureException}.
 */
public final class GossipPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GossipPipeline.class);

    private final Disruptor<MessageEvent> disruptor;
    private final RingBuffer<MessageEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final MetricsRegistry metricsRegistry;

    private GossipPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        ThreadFactory threadFactory = new PipelineThreadFactory(builder.threadNamePrefix);
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new MessageEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new DecodeHandler(builder.codec))
                .then(new DeduplicationHandler(builder.messageCache))
                .then(new MessageDispatchHandler(builder.inboundHandler))
                .then(new GossipForwardHandler(builder.forwarder))
                .then(new MetricsHandler(builder.metricsRegistry))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("GossipPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Pipeline cannot be restarted after close");
        }
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("GossipPipeline started");
        }
    }

    /**
     * Publishes raw bytes received from a peer.
     *
     * @throws BackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public void publish(String fromPeerId, byte[] data) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED, fromPeerId);
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    fromPeerId,
                    ringBuffer.remainingCapacity());
        }

        try {
            ringBuffer.get(sequence).initialize(fromPeerId, data);
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains in-flight events and stops the consumer threads.
     */
    @Override
    public void close() {
        stopped.set(true);
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down GossipPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("GossipPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("GossipPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class PipelineExceptionHandler implements com.lmax.disruptor.ExceptionHandler<MessageEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, MessageEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private String threadNamePrefix = "mesh-inbound";
        private MessageCodec codec;
        private MessageCache messageCache;
        private InboundMessageHandler inboundHandler;
        private GossipForwarder forwarder;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        public Builder codec(MessageCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder messageCache(MessageCache cache) {
            this.messageCache = cache;
            return this;
        }

        public Builder inboundHandler(InboundMessageHandler handler) {
            this.inboundHandler = handler;
            return this;
        }

        public Builder forwarder(GossipForwarder forwarder) {
            this.forwarder = forwarder;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(MeshConfig.DisruptorConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public GossipPipeline build() {
            if (codec == null) {
                throw new IllegalStateException("MessageCodec is required");
            }
            if (messageCache == null) {
                throw new IllegalStateException("MessageCache is required");
            }
            if (inboundHandler == null) {
                throw new IllegalStateException("InboundMessageHandler is required");
            }
            if (forwarder == null) {
                throw new IllegalStateException("GossipForwarder is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new GossipPipeline(this);
        }
    }
}
