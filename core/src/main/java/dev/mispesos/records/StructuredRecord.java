package dev.mispesos.records;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Canonical output of statement interpretation.
 *
 * <p>A record is <em>successful</em> only when it carries a positive amount; downstream
 * consumers must reject unsuccessful records. Non-positive amounts are normalised to
 * {@code null}, descriptions are capped at {@value #MAX_DESCRIPTION_LENGTH} characters and
 * confidence is clamped to {@code [0, 1]}.
 *
 * @param amount        positive amount, or {@code null} when none could be extracted
 * @param description   what was bought
 * @param category      spending category, never {@code null}
 * @param paymentMethod payment method, never {@code null}
 * @param location      where the purchase happened, if mentioned
 * @param dateOffset    days relative to today (0 = today, -1 = yesterday)
 * @param confidence    estimated correctness in {@code [0, 1]}
 * @param origin        extractor that produced the record
 * @param rawResponse   unmodified extractor output, kept for diagnostics
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuredRecord(
    BigDecimal amount,
    String description,
    Category category,
    PaymentMethod paymentMethod,
    String location,
    int dateOffset,
    double confidence,
    RecordOrigin origin,
    String rawResponse
) {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    public StructuredRecord {
        if (amount != null && amount.signum() <= 0) {
            amount = null;
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            description = description.substring(0, MAX_DESCRIPTION_LENGTH);
        }
        category = category != null ? category : Category.OTHER;
        paymentMethod = paymentMethod != null ? paymentMethod : PaymentMethod.CARD;
        confidence = Double.isNaN(confidence) ? 0.0 : Math.min(Math.max(confidence, 0.0), 1.0);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return amount != null;
    }

    public StructuredRecord withOrigin(RecordOrigin newOrigin) {
        return toBuilder().origin(newOrigin).build();
    }

    /**
     * @return the calendar date this record refers to, relative to {@code today}
     */
    public LocalDate resolveDate(LocalDate today) {
        return today.plusDays(dateOffset);
    }

    public Builder toBuilder() {
        return builder()
            .amount(amount)
            .description(description)
            .category(category)
            .paymentMethod(paymentMethod)
            .location(location)
            .dateOffset(dateOffset)
            .confidence(confidence)
            .origin(origin)
            .rawResponse(rawResponse);
    }

    public static final class Builder {

        private BigDecimal amount;
        private String description;
        private Category category;
        private PaymentMethod paymentMethod;
        private String location;
        private int dateOffset;
        private double confidence;
        private RecordOrigin origin;
        private String rawResponse;

        private Builder() {
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder paymentMethod(PaymentMethod paymentMethod) {
            this.paymentMethod = paymentMethod;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder dateOffset(int dateOffset) {
            this.dateOffset = dateOffset;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder origin(RecordOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder rawResponse(String rawResponse) {
            this.rawResponse = rawResponse;
            return this;
        }

        public StructuredRecord build() {
            return new StructuredRecord(amount, description, category, paymentMethod, location, dateOffset,
                confidence, origin, rawResponse);
        }
    }
}
