package fr.lapetina.inference.mesh.coordinator.exception;

import fr.lapetina.inference.mesh.domain.model.ErrorType;

/**
 * Typed failure raised while planning or executing a task.
 *
 * Never escapes the coordinator: it is converted into a failed
 * {@link fr.lapetina.inference.mesh.domain.model.InferenceResult}.
 */
public final class InferenceFailureException extends RuntimeException {

    private final ErrorType errorType;

    public InferenceFailureException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public InferenceFailureException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
