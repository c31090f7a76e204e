package dev.mispesos.interpreter.recognition;

import java.nio.file.Path;

/**
 * Fallback engine used when no recognition integration is configured. Every call fails, so
 * image extraction tasks end in a failed state.
 */
public class UnavailableTextRecognitionEngine implements TextRecognitionEngine {

    @Override
    public RecognizedText recognize(Path image) {
        throw new TextRecognitionException("Text recognition integration is not configured");
    }

    @Override
    public String describe() {
        return "unavailable";
    }
}
