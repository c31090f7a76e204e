package dev.mispesos.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.Objects;

/**
 * Payload submitted to an {@link ExtractionQueue} when a receipt image needs to be turned into
 * a structured record.
 *
 * @param imagePath    path of the temporary image file; once accepted, the queue deletes it
 * @param createRecord whether a successful extraction should be handed to record storage
 * @param taskId       optional caller-assigned task id; a random one is used when absent
 * @param requestedBy  optional identifier of the user who sent the image
 * @param metadata     optional attributes forwarded to record storage
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionJobMessage(
    @JsonProperty("imagePath") String imagePath,
    @JsonProperty("createRecord") boolean createRecord,
    @JsonProperty("taskId") String taskId,
    @JsonProperty("requestedBy") String requestedBy,
    @JsonProperty("metadata") Map<String, String> metadata
) {

    public ExtractionJobMessage {
        if (metadata != null && metadata.isEmpty()) {
            metadata = null;
        }
    }

    public static ExtractionJobMessage forImage(String imagePath, boolean createRecord) {
        Objects.requireNonNull(imagePath, "imagePath must not be null");
        return new ExtractionJobMessage(imagePath, createRecord, null, null, null);
    }

    public ExtractionJobMessage withTaskId(String newTaskId) {
        return new ExtractionJobMessage(imagePath, createRecord, newTaskId, requestedBy, metadata);
    }

    public ExtractionJobMessage withRequestedBy(String newRequestedBy) {
        return new ExtractionJobMessage(imagePath, createRecord, taskId, newRequestedBy, metadata);
    }
}
