package dev.mispesos.interpreter;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Tunables of the interpretation pipeline and the extraction queue, bound from
 * {@code interpreter.*}.
 */
@ConfigurationProperties(prefix = "interpreter")
public record InterpreterProperties(
    @DefaultValue Inference inference,
    @DefaultValue Retry retry,
    @DefaultValue Cache cache,
    @DefaultValue Confidence confidence,
    @DefaultValue Tasks tasks,
    @DefaultValue Metrics metrics
) {

    /**
     * Connection to the Ollama-compatible inference server.
     */
    public record Inference(
        @DefaultValue("http://localhost:11434") String baseUrl,
        @DefaultValue("llama3.2") String model,
        @DefaultValue("90s") Duration timeout,
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("0.1") double temperature,
        @DefaultValue("0.9") double topP,
        @DefaultValue("150") int maxTokens,
        @DefaultValue("1024") int contextWindow
    ) {
    }

    public record Retry(
        @DefaultValue("2") int maxAttempts,
        @DefaultValue("2s") Duration baseDelay,
        @DefaultValue("0") double jitter
    ) {
    }

    /**
     * Response cache sizing. When {@code maximumSize} is exceeded the cache shrinks to
     * {@code maximumSize * retainRatio} entries.
     */
    public record Cache(
        @DefaultValue("1h") Duration ttl,
        @DefaultValue("1000") int maximumSize,
        @DefaultValue("0.8") double retainRatio
    ) {
    }

    /**
     * Acceptance threshold, penalties for invalid inference fields and the confidences
     * reported by the pattern extractor.
     */
    public record Confidence(
        @DefaultValue("0.6") double acceptance,
        @DefaultValue("0.3") double invalidAmountPenalty,
        @DefaultValue("0.2") double invalidCategoryPenalty,
        @DefaultValue("0.1") double invalidPaymentMethodPenalty,
        @DefaultValue("0.8") double patternBaseline,
        @DefaultValue("0.6") double patternFallback,
        @DefaultValue("0.2") double patternFailure
    ) {
    }

    public record Tasks(
        @DefaultValue("2") int workers,
        @DefaultValue("4") int maxWorkers,
        @DefaultValue("100") int queueCapacity,
        @DefaultValue("10MB") DataSize maxImageSize,
        @DefaultValue("1h") Duration resultRetention,
        @DefaultValue("5m") Duration purgeInterval
    ) {
    }

    public record Metrics(
        @DefaultValue("1h") Duration window,
        @DefaultValue("10") int minimumSamples,
        @DefaultValue("30") double maxTimeoutRate,
        @DefaultValue("70") double minSuccessRate,
        @DefaultValue("30s") Duration maxAverageLatency
    ) {
    }
}
