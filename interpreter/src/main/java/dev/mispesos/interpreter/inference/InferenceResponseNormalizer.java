package dev.mispesos.interpreter.inference;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mispesos.records.Category;
import dev.mispesos.records.PaymentMethod;
import dev.mispesos.records.RecordOrigin;
import dev.mispesos.records.StructuredRecord;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Validates the JSON object produced by the model and turns it into a {@link StructuredRecord}.
 *
 * <p>Invalid fields are replaced by safe defaults and lower the reported confidence; the
 * confidence never drops below zero.
 */
public class InferenceResponseNormalizer {

    static final int FALLBACK_DESCRIPTION_LENGTH = 100;

    private final ConfidencePenalties penalties;

    public InferenceResponseNormalizer(ConfidencePenalties penalties) {
        this.penalties = penalties != null ? penalties : ConfidencePenalties.defaults();
    }

    public StructuredRecord normalize(JsonNode data, String originalMessage, String rawResponse) {
        String message = originalMessage != null ? originalMessage : "";
        double confidence = clamp(data.path("confidence").asDouble(0.0));

        BigDecimal amount = null;
        JsonNode amountNode = data.path("amount");
        if (amountNode.isNumber() && amountNode.decimalValue().signum() > 0) {
            amount = amountNode.decimalValue();
        } else {
            confidence = penalise(confidence, penalties.invalidAmount());
        }

        String description = text(data, "description")
            .orElseGet(() -> message.length() > FALLBACK_DESCRIPTION_LENGTH
                ? message.substring(0, FALLBACK_DESCRIPTION_LENGTH)
                : message);

        Optional<Category> category = text(data, "category").flatMap(Category::find);
        if (category.isEmpty()) {
            confidence = penalise(confidence, penalties.invalidCategory());
        }

        Optional<PaymentMethod> paymentMethod = text(data, "payment_method").flatMap(PaymentMethod::find);
        if (paymentMethod.isEmpty()) {
            confidence = penalise(confidence, penalties.invalidPaymentMethod());
        }

        JsonNode offsetNode = data.path("date_offset");
        int dateOffset = offsetNode.isIntegralNumber() && offsetNode.canConvertToInt() ? offsetNode.asInt() : 0;

        return StructuredRecord.builder()
            .amount(amount)
            .description(description)
            .category(category.orElse(Category.OTHER))
            .paymentMethod(paymentMethod.orElse(PaymentMethod.CARD))
            .location(text(data, "location").orElse(null))
            .dateOffset(dateOffset)
            .confidence(confidence)
            .origin(RecordOrigin.INFERENCE)
            .rawResponse(rawResponse)
            .build();
    }

    private static Optional<String> text(JsonNode data, String field) {
        JsonNode node = data.path(field);
        if (!node.isTextual()) {
            return Optional.empty();
        }
        String value = node.asText().strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static double penalise(double confidence, double penalty) {
        return Math.max(confidence - penalty, 0.0);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
