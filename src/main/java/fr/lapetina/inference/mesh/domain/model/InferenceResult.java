package fr.lapetina.inference.mesh.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one coordinated inference task.
 * Immutable and thread-safe.
 *
 * A result with {@code success == false} always carries an {@link ErrorType};
 * the coordinator never throws to its caller.
 */
public record InferenceResult(
        String taskId,
        String modelId,
        boolean success,
        Object result,
        ErrorType errorType,
        String errorMessage,
        Duration executionTime,
        List<String> nodesUsed,
        boolean consensusInvoked,
        boolean consensusReached,
        TaskState finalState
) {
    public InferenceResult {
        Objects.requireNonNull(taskId, "Task ID is required");
        nodesUsed = nodesUsed != null ? List.copyOf(nodesUsed) : List.of();
        if (executionTime == null) {
            executionTime = Duration.ZERO;
        }
        if (!success && errorType == null) {
            throw new IllegalArgumentException("Failed result requires an error type");
        }
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Creates a successful result.
     */
    public static InferenceResult success(
            InferenceTask task,
            Object result,
            Duration executionTime,
            List<String> nodesUsed,
            boolean consensusInvoked
    ) {
        return new InferenceResult(
                task.taskId(), task.modelId(), true, result, null, null,
                executionTime, nodesUsed, consensusInvoked, consensusInvoked,
                TaskState.CONSENSUS_REACHED
        );
    }

    /**
     * Creates a failed result.
     */
    public static InferenceResult failure(
            InferenceTask task,
            ErrorType errorType,
            String errorMessage,
            Duration executionTime,
            List<String> nodesUsed
    ) {
        TaskState state = errorType == ErrorType.CONSENSUS_NOT_REACHED
                ? TaskState.NO_CONSENSUS
                : TaskState.FAILED;
        return new InferenceResult(
                task.taskId(), task.modelId(), false, null, errorType, errorMessage,
                executionTime, nodesUsed, errorType == ErrorType.CONSENSUS_NOT_REACHED, false,
                state
        );
    }
}
