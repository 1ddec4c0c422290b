package fr.lapetina.inference.mesh.domain.message;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class P2PMessageTest {

    private final P2PMessage message = P2PMessage.create(
            MessageType.MODEL_REQUEST, "origin", new MessagePayload.ModelRequest("llama2"), 3, 1000L);

    @Test
    @DisplayName("should start the path at the sender")
    void shouldStartPathAtSender() {
        assertThat(message.path()).containsExactly("origin");
        assertThat(message.lastHop()).isEqualTo("origin");
    }

    @Test
    @DisplayName("should decrement TTL and extend the path when relayed")
    void shouldRelay() {
        P2PMessage relayed = message.forwardedBy("relay");

        assertThat(relayed.messageId()).isEqualTo(message.messageId());
        assertThat(relayed.ttl()).isEqualTo(2);
        assertThat(relayed.path()).containsExactly("origin", "relay");
        assertThat(relayed.lastHop()).isEqualTo("relay");
        assertThat(relayed.hasTraversed("origin")).isTrue();
        assertThat(message.path()).containsExactly("origin");
    }

    @Test
    @DisplayName("should not repeat a node already on the path")
    void shouldNotRepeatPathEntries() {
        assertThat(message.forwardedBy("origin").path()).containsExactly("origin");
    }

    @Test
    @DisplayName("should reject a payload that does not match the type")
    void shouldRejectMismatchedPayload() {
        assertThatThrownBy(() -> P2PMessage.create(
                MessageType.HEARTBEAT, "a", new MessagePayload.ModelRequest("m"), 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
