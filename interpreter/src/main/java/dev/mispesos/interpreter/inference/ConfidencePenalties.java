package dev.mispesos.interpreter.inference;

/**
 * Confidence deductions applied when an inference response carries invalid fields.
 */
public record ConfidencePenalties(double invalidAmount, double invalidCategory, double invalidPaymentMethod) {

    public static ConfidencePenalties defaults() {
        return new ConfidencePenalties(0.3, 0.2, 0.1);
    }
}
