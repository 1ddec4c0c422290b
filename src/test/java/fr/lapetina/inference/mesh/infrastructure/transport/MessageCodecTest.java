package fr.lapetina.inference.mesh.infrastructure.transport;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.NodeDescriptor;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.domain.model.ModelShard;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.model.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("should restore a node announcement with its capability profile")
        void shouldDecodeNodeAnnounce() {
            NodeCapability capability = NodeCapability.builder()
                    .nodeId("gpu-1")
                    .address("mem://gpu-1")
                    .nodeType(NodeType.COMPUTE_NODE)
                    .addModel("llama2")
                    .computePower(8)
                    .gpuAvailable(true)
                    .build();
            P2PMessage message = P2PMessage.create(MessageType.NODE_ANNOUNCE, "gpu-1",
                    new MessagePayload.NodeAnnounce(NodeDescriptor.from(capability)), 4, 1234L)
                    .forwardedBy("relay");

            P2PMessage decoded = codec.decode(codec.encode(message));

            assertThat(decoded.messageId()).isEqualTo(message.messageId());
            assertThat(decoded.ttl()).isEqualTo(3);
            assertThat(decoded.path()).containsExactly("gpu-1", "relay");
            NodeDescriptor node = decoded.payloadAs(MessagePayload.NodeAnnounce.class).node();
            assertThat(node.nodeType()).isEqualTo(NodeType.COMPUTE_NODE);
            assertThat(node.models()).containsExactly("llama2");
            assertThat(node.gpuAvailable()).isTrue();
        }

        @Test
        @DisplayName("should restore a shard plan carried by a model announcement")
        void shouldDecodeShardPlan() {
            ModelShard shard = new ModelShard("m", "m_shard_0", 0, 9, 100.0, "0123456789abcdef");
            MessagePayload.ModelAnnounce announce = new MessagePayload.ModelAnnounce(
                    "m", "a", Map.of("totalLayers", 10), 5L, List.of(shard), Map.of("m_shard_0", List.of("a", "b")));

            P2PMessage decoded = codec.decode(codec.encode(
                    P2PMessage.create(MessageType.MODEL_ANNOUNCE, "a", announce, 5L)));

            MessagePayload.ModelAnnounce restored = decoded.payloadAs(MessagePayload.ModelAnnounce.class);
            assertThat(restored.hasShardPlan()).isTrue();
            assertThat(restored.shards()).containsExactly(shard);
            assertThat(restored.placement().get("m_shard_0")).containsExactly("a", "b");
            assertThat(restored.modelInfo()).containsEntry("totalLayers", 10);
        }

        @Test
        @DisplayName("should keep opaque inference inputs as plain JSON values")
        void shouldKeepOpaqueInput() {
            MessagePayload.InferenceRequest request = new MessagePayload.InferenceRequest(
                    "r-1", "t-1", "m", null, Map.of("prompt", "hi", "temperature", 0.5));

            P2PMessage decoded = codec.decode(codec.encode(
                    P2PMessage.create(MessageType.INFERENCE_REQUEST, "a", request, 1, 5L)));

            MessagePayload.InferenceRequest restored = decoded.payloadAs(MessagePayload.InferenceRequest.class);
            assertThat(restored.shardId()).isNull();
            assertThat(restored.inputData()).isEqualTo(Map.of("prompt", "hi", "temperature", 0.5));
        }
    }

    @Nested
    @DisplayName("malformed input")
    class Malformed {

        @Test
        @DisplayName("should reject bytes that are not JSON")
        void shouldRejectGarbage() {
            assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(MessageCodec.CodecException.class);
        }

        @Test
        @DisplayName("should reject an unknown message type")
        void shouldRejectUnknownType() {
            byte[] data = "{\"messageId\":\"x\",\"type\":\"GOSSIP\",\"senderId\":\"a\",\"payload\":{}}"
                    .getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> codec.decode(data)).isInstanceOf(MessageCodec.CodecException.class);
        }

        @Test
        @DisplayName("should reject a message without payload")
        void shouldRejectMissingPayload() {
            byte[] data = "{\"messageId\":\"x\",\"type\":\"HEARTBEAT\",\"senderId\":\"a\"}"
                    .getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> codec.decode(data))
                    .isInstanceOf(MessageCodec.CodecException.class)
                    .hasMessageContaining("payload");
        }
    }
}
