package dev.mispesos.interpreter.recognition;

import java.nio.file.Path;

/**
 * Turns a receipt image into text.
 */
public interface TextRecognitionEngine {

    /**
     * @throws TextRecognitionException when the image cannot be read or recognised
     */
    RecognizedText recognize(Path image);

    /**
     * @return a short description used in startup diagnostics
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
