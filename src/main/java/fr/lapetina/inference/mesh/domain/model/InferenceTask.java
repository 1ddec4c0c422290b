package fr.lapetina.inference.mesh.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of distributed inference work.
 * Immutable and thread-safe; the input payload is treated as opaque.
 */
public record InferenceTask(
        String taskId,
        String modelId,
        Object inputData,
        int priority,
        Duration timeout,
        int redundancy,
        Instant createdAt,
        String clientId
) {
    public static final int DEFAULT_PRIORITY = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public InferenceTask {
        Objects.requireNonNull(modelId, "Model ID is required");
        if (redundancy < 1) {
            throw new IllegalArgumentException("Redundancy must be at least 1, got " + redundancy);
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
        }
        if (taskId == null) {
            taskId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (clientId == null) {
            clientId = "";
        }
    }

    /**
     * Creates a single-replica task with default priority and timeout.
     */
    public static InferenceTask of(String modelId, Object inputData) {
        return new InferenceTask(null, modelId, inputData, DEFAULT_PRIORITY, null, 1, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String modelId;
        private Object inputData;
        private int priority = DEFAULT_PRIORITY;
        private Duration timeout;
        private int redundancy = 1;
        private Instant createdAt;
        private String clientId;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder inputData(Object inputData) {
            this.inputData = inputData;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder redundancy(int redundancy) {
            this.redundancy = redundancy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public InferenceTask build() {
            return new InferenceTask(
                    taskId, modelId, inputData, priority, timeout, redundancy, createdAt, clientId
            );
        }
    }
}
