package dev.mispesos.interpreter.recognition;

/**
 * Text recognised in an image.
 *
 * @param text       recognised text, never {@code null}
 * @param confidence engine confidence in {@code [0, 1]}
 */
public record RecognizedText(String text, double confidence) {

    public RecognizedText {
        text = text != null ? text : "";
        confidence = Double.isNaN(confidence) ? 0.0 : Math.min(Math.max(confidence, 0.0), 1.0);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
