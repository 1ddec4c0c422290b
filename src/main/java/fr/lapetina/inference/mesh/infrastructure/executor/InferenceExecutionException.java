package fr.lapetina.inference.mesh.infrastructure.executor;

/**
 * Local model execution failed or was refused.
 */
public class InferenceExecutionException extends RuntimeException {

    public InferenceExecutionException(String message) {
        super(message);
    }

    public InferenceExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
