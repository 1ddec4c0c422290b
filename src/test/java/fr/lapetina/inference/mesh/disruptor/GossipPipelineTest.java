package fr.lapetina.inference.mesh.disruptor;

import fr.lapetina.inference.mesh.disruptor.exception.BackpressureException;
import fr.lapetina.inference.mesh.domain.message.MessageCache;
import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.mesh.infrastructure.transport.MessageCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class GossipPipelineTest {

    private final MessageCodec codec = new MessageCodec();
    private final List<P2PMessage> handled = new CopyOnWriteArrayList<>();
    private final List<P2PMessage> forwarded = new CopyOnWriteArrayList<>();

    private MetricsRegistry metrics;
    private GossipPipeline pipeline;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test", false);
        pipeline = GossipPipeline.builder()
                .ringBufferSize(64)
                .waitStrategy("sleeping")
                .threadNamePrefix("test-inbound")
                .codec(codec)
                .messageCache(new MessageCache())
                .inboundHandler((message, from) -> {
                    if ("boom".equals(message.senderId())) {
                        throw new IllegalStateException("handler failure");
                    }
                    handled.add(message);
                })
                .forwarder(message -> {
                    forwarded.add(message);
                    return 1;
                })
                .metricsRegistry(metrics)
                .build();
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        metrics.close();
    }

    private byte[] encode(P2PMessage message) {
        return codec.encode(message);
    }

    private static P2PMessage gossip(String sender) {
        return P2PMessage.create(MessageType.MODEL_REQUEST, sender, new MessagePayload.ModelRequest("m"), 5, 1L);
    }

    @Nested
    @DisplayName("processing")
    class Processing {

        @BeforeEach
        void start() {
            pipeline.start();
        }

        @Test
        @DisplayName("should dispatch and forward a gossip message")
        void shouldDispatchAndForward() {
            P2PMessage message = gossip("a");

            pipeline.publish("a", encode(message));

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                assertThat(handled).extracting(P2PMessage::messageId).containsExactly(message.messageId());
                assertThat(forwarded).extracting(P2PMessage::messageId).containsExactly(message.messageId());
            });
        }

        @Test
        @DisplayName("should handle a duplicate only once")
        void shouldDropDuplicates() {
            P2PMessage message = gossip("a");

            pipeline.publish("a", encode(message));
            pipeline.publish("b", encode(message.forwardedBy("b")));

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(metrics.snapshot().get("messagesDropped")).isEqualTo(1L));
            assertThat(handled).hasSize(1);
            assertThat(forwarded).hasSize(1);
        }

        @Test
        @DisplayName("should not forward direct messages")
        void shouldNotForwardDirectMessages() {
            P2PMessage query = P2PMessage.create(MessageType.NODE_QUERY, "a",
                    MessagePayload.NodeQuery.discoverPeers(5), 1, 1L);

            pipeline.publish("a", encode(query));

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(handled).hasSize(1));
            assertThat(forwarded).isEmpty();
        }

        @Test
        @DisplayName("should drop undecodable bytes and keep going")
        void shouldDropGarbage() {
            pipeline.publish("a", "garbage".getBytes(StandardCharsets.UTF_8));
            pipeline.publish("a", encode(gossip("a")));

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                assertThat(handled).hasSize(1);
                assertThat(metrics.snapshot().get("messagesDropped")).isEqualTo(1L);
            });
        }

        @Test
        @DisplayName("should still forward when the handler fails")
        void shouldForwardAfterHandlerFailure() {
            pipeline.publish("boom", encode(gossip("boom")));
            pipeline.publish("a", encode(gossip("a")));

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                assertThat(handled).hasSize(1);
                assertThat(forwarded).hasSize(2);
            });
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should reject messages before start")
        void shouldRejectBeforeStart() {
            assertThatThrownBy(() -> pipeline.publish("a", encode(gossip("a"))))
                    .isInstanceOf(BackpressureException.class)
                    .extracting(e -> ((BackpressureException) e).getReason())
                    .isEqualTo(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        @Test
        @DisplayName("should refuse to restart after close")
        void shouldRefuseRestart() {
            pipeline.start();
            pipeline.close();

            assertThat(pipeline.isRunning()).isFalse();
            assertThatThrownBy(() -> pipeline.start()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should require every component")
        void shouldRequireComponents() {
            assertThatThrownBy(() -> GossipPipeline.builder().codec(codec).build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should require a power of two ring size")
        void shouldRequirePowerOfTwo() {
            assertThatThrownBy(() -> GossipPipeline.builder().ringBufferSize(100))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
