package dev.mispesos.messaging;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mispesos.records.StructuredRecord;
import java.util.Map;

/**
 * Outcome of a successful extraction task.
 *
 * @param record                interpreted record, always successful
 * @param recognizedText        text returned by the recognition engine
 * @param recognitionConfidence confidence reported by the recognition engine
 * @param receiptMetadata       receipt number, tax amount and contact details found in the text
 * @param recordId              storage id when a record was created, otherwise {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionTaskResult(
    StructuredRecord record,
    String recognizedText,
    double recognitionConfidence,
    Map<String, String> receiptMetadata,
    String recordId
) {

    public ExtractionTaskResult {
        receiptMetadata = receiptMetadata != null ? Map.copyOf(receiptMetadata) : Map.of();
    }

    @JsonIgnore
    public boolean recordCreated() {
        return recordId != null;
    }
}
