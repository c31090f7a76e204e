package dev.mispesos.interpreter.inference;

import dev.mispesos.records.StructuredRecord;
import java.util.Objects;

/**
 * Result of a single inference round trip.
 *
 * @param outcome how the attempt ended
 * @param record  normalised record, present only for {@link Outcome#SUCCESS}
 * @param detail  failure description, present for every other outcome
 */
public record InferenceAttempt(Outcome outcome, StructuredRecord record, String detail) {

    public enum Outcome {
        SUCCESS,
        TIMEOUT,
        FAILURE,
        MALFORMED
    }

    public InferenceAttempt {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (outcome == Outcome.SUCCESS && record == null) {
            throw new IllegalArgumentException("A successful attempt must carry a record");
        }
    }

    public static InferenceAttempt success(StructuredRecord record) {
        return new InferenceAttempt(Outcome.SUCCESS, record, null);
    }

    public static InferenceAttempt timeout(String detail) {
        return new InferenceAttempt(Outcome.TIMEOUT, null, detail);
    }

    public static InferenceAttempt failure(String detail) {
        return new InferenceAttempt(Outcome.FAILURE, null, detail);
    }

    public static InferenceAttempt malformed(String detail) {
        return new InferenceAttempt(Outcome.MALFORMED, null, detail);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isTimeout() {
        return outcome == Outcome.TIMEOUT;
    }
}
