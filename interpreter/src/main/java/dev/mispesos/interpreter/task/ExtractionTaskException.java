package dev.mispesos.interpreter.task;

/**
 * Raised when an extraction task cannot be accepted or run.
 */
public class ExtractionTaskException extends RuntimeException {

    public ExtractionTaskException(String message) {
        super(message);
    }

    public ExtractionTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
