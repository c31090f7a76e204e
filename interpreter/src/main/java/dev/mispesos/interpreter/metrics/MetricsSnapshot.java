package dev.mispesos.interpreter.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the counters of the current metrics window.
 */
public record MetricsSnapshot(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long timeoutRequests,
    long cacheHits,
    long cacheMisses,
    Duration totalLatency,
    Duration minLatency,
    Duration maxLatency,
    double totalConfidence,
    long lowConfidenceCount,
    long fallbackCount,
    long recordsCreated,
    Map<String, Long> recordsByCategory,
    Map<String, Long> recordsByPaymentMethod,
    Instant windowStart
) {

    public MetricsSnapshot {
        recordsByCategory = Map.copyOf(recordsByCategory);
        recordsByPaymentMethod = Map.copyOf(recordsByPaymentMethod);
    }

    public double successRate() {
        return percentage(successfulRequests, totalRequests);
    }

    public double cacheHitRate() {
        return percentage(cacheHits, totalRequests);
    }

    public double timeoutRate() {
        return percentage(timeoutRequests, totalRequests);
    }

    /**
     * Average latency of successful requests.
     */
    public Duration averageLatency() {
        if (successfulRequests == 0) {
            return Duration.ZERO;
        }
        return totalLatency.dividedBy(successfulRequests);
    }

    public double averageConfidence() {
        if (successfulRequests == 0) {
            return 0.0;
        }
        return totalConfidence / successfulRequests;
    }

    private static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return part * 100.0 / total;
    }
}
