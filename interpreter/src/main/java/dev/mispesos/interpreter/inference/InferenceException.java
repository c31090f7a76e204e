package dev.mispesos.interpreter.inference;

/**
 * Raised when the inference service cannot produce a usable response.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
