package dev.mispesos.records;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which extractor produced a structured record.
 */
public enum RecordOrigin {

    /**
     * Accepted output of the inference service.
     */
    INFERENCE("inference"),

    /**
     * Replayed from the response cache without contacting the inference service.
     */
    CACHE("cache"),

    /**
     * Deterministic keyword and pattern extraction.
     */
    PATTERN_FALLBACK("pattern-fallback");

    private final String value;

    RecordOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
