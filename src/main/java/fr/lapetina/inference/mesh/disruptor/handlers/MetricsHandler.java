package fr.lapetina.inference.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.mesh.domain.event.MessageEvent;
import fr.lapetina.inference.mesh.infrastructure.metrics.MetricsRegistry;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Fifth stage handler: records message counters, drops and stage timings.
 */
public final class MetricsHandler implements EventHandler<MessageEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(MessageEvent event, long sequence, boolean endOfBatch) {
        if (event.getMessage() != null) {
            MDC.put("messageId", event.getMessage().messageId());
        }
        try {
            recordMetrics(event);
        } finally {
            MDC.remove("messageId");
        }
    }

    private void recordMetrics(MessageEvent event) {
        if (event.getMessage() != null) {
            metricsRegistry.incrementMessageReceived(event.getMessage().type());
        }
        if (event.getState() != null && event.getState().isDropped()) {
            metricsRegistry.incrementMessageDropped(event.getDropReason());
        }

        if (event.getReceivedAt() != null && event.getDecodedAt() != null) {
            metricsRegistry.recordStageLatency("decode",
                    Duration.between(event.getReceivedAt(), event.getDecodedAt()));
        }
        if (event.getDecodedAt() != null && event.getHandledAt() != null) {
            metricsRegistry.recordStageLatency("handle",
                    Duration.between(event.getDecodedAt(), event.getHandledAt()));
        }
        if (event.getReceivedAt() != null) {
            metricsRegistry.recordStageLatency("total", Duration.between(event.getReceivedAt(), Instant.now()));
        }
    }
}
