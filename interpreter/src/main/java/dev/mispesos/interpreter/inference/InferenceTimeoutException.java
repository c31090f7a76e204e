package dev.mispesos.interpreter.inference;

/**
 * Raised when the inference service does not answer within the configured timeout.
 */
public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String message) {
        super(message);
    }

    public InferenceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
