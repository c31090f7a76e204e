package dev.mispesos.messaging;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Immutable snapshot of an extraction task as seen by a poller.
 *
 * @param id              task id
 * @param state           lifecycle state
 * @param progressStep    last step reached
 * @param progressPercent progress of the last step reached
 * @param result          extraction result, present only for {@link TaskState#SUCCESS}
 * @param error           failure description, present only for {@link TaskState#FAILURE}
 * @param createdAt       when the task was accepted
 * @param updatedAt       when the task last changed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionTask(
    String id,
    TaskState state,
    ProgressStep progressStep,
    int progressPercent,
    ExtractionTaskResult result,
    String error,
    Instant createdAt,
    Instant updatedAt
) {

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
