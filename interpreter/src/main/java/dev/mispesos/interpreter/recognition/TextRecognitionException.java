package dev.mispesos.interpreter.recognition;

public class TextRecognitionException extends RuntimeException {

    public TextRecognitionException(String message) {
        super(message);
    }

    public TextRecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
