package dev.mispesos.interpreter.interpretation;

import dev.mispesos.records.StructuredRecord;

/**
 * Result of running inference with retries.
 *
 * @param record              record to hand back to the caller
 * @param accepted            whether {@code record} is a confident inference result
 * @param attempts            inference attempts made
 * @param timeouts            attempts that timed out
 * @param timedOut            whether the last attempt timed out
 * @param weak                whether inference answered but its result was discarded
 * @param discardedConfidence confidence of the discarded result when {@code weak}
 */
public record InterpretationOutcome(
    StructuredRecord record,
    boolean accepted,
    int attempts,
    int timeouts,
    boolean timedOut,
    boolean weak,
    Double discardedConfidence
) {

    public boolean usedFallback() {
        return !accepted;
    }
}
