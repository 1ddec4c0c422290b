package fr.lapetina.inference.mesh.infrastructure.metrics;

import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry metrics = new MetricsRegistry("test", false);

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should tally messages and inferences in the snapshot")
    void shouldTallySnapshot() {
        metrics.incrementMessageReceived(MessageType.HEARTBEAT);
        metrics.incrementMessageReceived(MessageType.NODE_ANNOUNCE);
        metrics.incrementMessageSent(MessageType.HEARTBEAT);
        metrics.incrementMessageDropped("duplicate");
        metrics.recordInference("llama2", null, Duration.ofMillis(20));
        metrics.recordInference("llama2", ErrorType.TIMEOUT, Duration.ofMillis(30));

        assertThat(metrics.snapshot())
                .containsEntry("messagesReceived", 2L)
                .containsEntry("messagesSent", 1L)
                .containsEntry("messagesDropped", 1L)
                .containsEntry("inferencesSucceeded", 1L)
                .containsEntry("inferencesFailed", 1L);
    }

    @Test
    @DisplayName("should total the tagged counters across types, reasons and outcomes")
    void shouldTotalTaggedCounters() {
        for (int i = 0; i < 3; i++) {
            metrics.incrementMessageReceived(MessageType.HEARTBEAT);
        }
        metrics.incrementMessageReceived(MessageType.INFERENCE_RESPONSE);
        metrics.incrementMessageSent(MessageType.INFERENCE_REQUEST);
        metrics.incrementMessageSent(MessageType.INFERENCE_REQUEST);
        metrics.incrementMessageDropped("duplicate");
        metrics.incrementMessageDropped("expired");
        metrics.recordInference("llama2", null, Duration.ofMillis(10));
        metrics.recordInference("mistral", null, Duration.ofMillis(10));
        metrics.recordInference("llama2", ErrorType.TIMEOUT, Duration.ofMillis(10));
        metrics.recordInference("llama2", ErrorType.NO_NODES_AVAILABLE, Duration.ofMillis(10));
        metrics.recordInference("mistral", ErrorType.TIMEOUT, Duration.ofMillis(10));

        assertThat(metrics.snapshot())
                .containsEntry("messagesReceived", 4L)
                .containsEntry("messagesSent", 2L)
                .containsEntry("messagesDropped", 2L)
                .containsEntry("inferencesSucceeded", 2L)
                .containsEntry("inferencesFailed", 3L);
        assertThat(metrics.getInferencesSucceeded()).isEqualTo(2L);
        assertThat(metrics.getInferencesFailed()).isEqualTo(3L);
        assertThat(metrics.scrape())
                .contains("reason=\"expired\"")
                .contains("outcome=\"NO_NODES_AVAILABLE\"");
    }

    @Test
    @DisplayName("should expose meters in the Prometheus scrape")
    void shouldExposeMeters() {
        metrics.setConnectedPeers(3);
        metrics.recordConsensus(true);
        metrics.incrementMessageSent(MessageType.MODEL_ANNOUNCE);

        String scrape = metrics.scrape();

        assertThat(scrape).contains("test_connected_peers 3.0");
        assertThat(scrape).contains("test_consensus_total");
        assertThat(scrape).contains("MODEL_ANNOUNCE");
    }
}
