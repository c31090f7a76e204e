package dev.mispesos.interpreter.interpretation;

import dev.mispesos.interpreter.inference.InferenceAttempt;
import dev.mispesos.interpreter.inference.InferenceExtractor;
import dev.mispesos.interpreter.pattern.PatternExtractor;
import dev.mispesos.records.StructuredRecord;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs inference with exponential backoff and gates the result on confidence. Whatever
 * inference cannot deliver is answered by the pattern extractor.
 */
public class RetryingInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingInterpreter.class);

    private final InferenceExtractor inferenceExtractor;
    private final PatternExtractor patternExtractor;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final double acceptanceThreshold;

    public RetryingInterpreter(InferenceExtractor inferenceExtractor, PatternExtractor patternExtractor,
        RetryPolicy retryPolicy, Sleeper sleeper, double acceptanceThreshold) {
        this.inferenceExtractor = inferenceExtractor;
        this.patternExtractor = patternExtractor;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public InterpretationOutcome interpret(String message) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        int attempts = 0;
        int timeouts = 0;
        boolean lastTimedOut = false;

        while (attempts < maxAttempts) {
            LOGGER.debug("Inference attempt {}/{}", attempts + 1, maxAttempts);
            InferenceAttempt attempt = inferenceExtractor.extract(message);
            attempts++;

            if (attempt.isSuccess()) {
                StructuredRecord record = attempt.record();
                if (record.isSuccessful() && record.confidence() > acceptanceThreshold) {
                    LOGGER.info("Inference accepted with confidence {} after {} attempt(s)", record.confidence(),
                        attempts);
                    return new InterpretationOutcome(record, true, attempts, timeouts, false, false, null);
                }
                LOGGER.warn("Inference result discarded (confidence {}, amount present: {}); using pattern fallback",
                    record.confidence(), record.isSuccessful());
                return new InterpretationOutcome(patternExtractor.extractFallback(message), false, attempts, timeouts,
                    false, true, record.confidence());
            }

            lastTimedOut = attempt.isTimeout();
            if (lastTimedOut) {
                timeouts++;
            }
            if (attempts < maxAttempts) {
                Duration delay = retryPolicy.delay(attempts - 1);
                LOGGER.warn("Inference attempt {} ended with {}; retrying in {} ms", attempts, attempt.outcome(),
                    delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Interrupted while waiting to retry inference; using pattern fallback");
                    break;
                }
            }
        }

        LOGGER.error("All {} inference attempt(s) failed ({} timed out); using pattern fallback", attempts, timeouts);
        return new InterpretationOutcome(patternExtractor.extractFallback(message), false, attempts, timeouts,
            lastTimedOut, false, null);
    }
}
