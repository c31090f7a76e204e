package dev.mispesos.interpreter.metrics;

import java.time.Duration;

/**
 * Limits used to classify the interpretation pipeline's health.
 *
 * @param minimumSamples    requests required in the window before any rule applies
 * @param maxTimeoutRate    timeout percentage above which the pipeline is degraded
 * @param minSuccessRate    success percentage below which the pipeline is unhealthy
 * @param maxAverageLatency average latency above which the pipeline is degraded
 */
public record HealthThresholds(int minimumSamples, double maxTimeoutRate, double minSuccessRate,
    Duration maxAverageLatency) {

    public static HealthThresholds defaults() {
        return new HealthThresholds(10, 30.0, 70.0, Duration.ofSeconds(30));
    }
}
