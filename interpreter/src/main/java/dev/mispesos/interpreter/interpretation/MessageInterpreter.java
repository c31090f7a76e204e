package dev.mispesos.interpreter.interpretation;

import dev.mispesos.interpreter.cache.ResponseCache;
import dev.mispesos.interpreter.inference.InferenceClient;
import dev.mispesos.interpreter.metrics.InterpretationMetrics;
import dev.mispesos.interpreter.metrics.RequestOutcome;
import dev.mispesos.interpreter.pattern.PatternExtractor;
import dev.mispesos.records.RecordOrigin;
import dev.mispesos.records.StructuredRecord;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for interpreting a free-form financial statement.
 *
 * <p>Answers from the response cache when possible, otherwise runs inference with retries and
 * falls back to pattern extraction. Never throws: callers always receive a record, which is
 * unsuccessful when no amount could be found.
 */
public class MessageInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageInterpreter.class);

    private final MessageNormalizer messageNormalizer;
    private final ResponseCache responseCache;
    private final RetryingInterpreter retryingInterpreter;
    private final PatternExtractor patternExtractor;
    private final InferenceClient inferenceClient;
    private final InterpretationMetrics metrics;

    public MessageInterpreter(MessageNormalizer messageNormalizer, ResponseCache responseCache,
        RetryingInterpreter retryingInterpreter, PatternExtractor patternExtractor, InferenceClient inferenceClient,
        InterpretationMetrics metrics) {
        this.messageNormalizer = messageNormalizer;
        this.responseCache = responseCache;
        this.retryingInterpreter = retryingInterpreter;
        this.patternExtractor = patternExtractor;
        this.inferenceClient = inferenceClient;
        this.metrics = metrics;
    }

    public StructuredRecord interpret(String rawText) {
        long started = System.nanoTime();
        String message = rawText != null ? rawText : "";
        NormalizedMessage normalized = messageNormalizer.normalize(message);

        Optional<StructuredRecord> cached = responseCache.get(normalized.fingerprint());
        if (cached.isPresent()) {
            StructuredRecord record = cached.get().withOrigin(RecordOrigin.CACHE);
            LOGGER.info("Using cached interpretation for fingerprint {}", normalized.fingerprint());
            metrics.record(RequestOutcome.cacheHit(elapsedSince(started), record.confidence()));
            return record;
        }

        InterpretationOutcome outcome;
        try {
            outcome = retryingInterpreter.interpret(message);
        } catch (RuntimeException ex) {
            LOGGER.error("Interpretation failed unexpectedly; using pattern fallback", ex);
            metrics.record(RequestOutcome.error(elapsedSince(started)));
            return patternExtractor.extractFallback(message);
        }

        Duration latency = elapsedSince(started);
        StructuredRecord record = outcome.record();
        if (outcome.accepted()) {
            responseCache.put(normalized.fingerprint(), record);
            metrics.record(RequestOutcome.inference(latency, record.confidence()));
            return record.withOrigin(RecordOrigin.INFERENCE);
        }
        if (outcome.weak()) {
            metrics.record(RequestOutcome.weakInference(latency, outcome.discardedConfidence()));
        } else {
            metrics.record(RequestOutcome.fallback(latency, outcome.timedOut()));
        }
        if (!record.isSuccessful()) {
            LOGGER.warn("No amount could be extracted from statement of length {}", message.length());
        }
        return record;
    }

    /**
     * Interprets a statement for display purposes. Interpretation itself never stores anything,
     * so this is the same as {@link #interpret(String)}.
     */
    public StructuredRecord preview(String rawText) {
        return interpret(rawText);
    }

    public boolean isInferenceAvailable() {
        try {
            return inferenceClient.isAvailable();
        } catch (RuntimeException ex) {
            LOGGER.warn("Inference availability probe failed", ex);
            return false;
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
