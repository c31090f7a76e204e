package dev.mispesos.interpreter.metrics;

import java.time.Duration;

/**
 * What happened to a single interpretation request, as seen by the metrics.
 *
 * @param success      whether an accepted record was produced (cache hit or confident inference)
 * @param latency      wall-clock time spent on the request
 * @param confidence   confidence of the returned record, if any
 * @param fromCache    whether the answer came from the response cache
 * @param timedOut     whether the last inference attempt timed out
 * @param usedFallback whether the pattern extractor produced the answer
 */
public record RequestOutcome(
    boolean success,
    Duration latency,
    Double confidence,
    boolean fromCache,
    boolean timedOut,
    boolean usedFallback
) {

    public RequestOutcome {
        latency = latency != null && !latency.isNegative() ? latency : Duration.ZERO;
    }

    public static RequestOutcome cacheHit(Duration latency, double confidence) {
        return new RequestOutcome(true, latency, confidence, true, false, false);
    }

    public static RequestOutcome inference(Duration latency, double confidence) {
        return new RequestOutcome(true, latency, confidence, false, false, false);
    }

    /**
     * Inference answered but the answer was discarded for lack of confidence or amount.
     */
    public static RequestOutcome weakInference(Duration latency, double confidence) {
        return new RequestOutcome(false, latency, confidence, false, false, true);
    }

    /**
     * Every inference attempt failed and the pattern extractor answered.
     */
    public static RequestOutcome fallback(Duration latency, boolean timedOut) {
        return new RequestOutcome(false, latency, null, false, timedOut, true);
    }

    /**
     * An unexpected error interrupted the inference path.
     */
    public static RequestOutcome error(Duration latency) {
        return new RequestOutcome(false, latency, null, false, false, true);
    }
}
