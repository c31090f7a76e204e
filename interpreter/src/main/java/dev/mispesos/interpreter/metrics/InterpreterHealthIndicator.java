package dev.mispesos.interpreter.metrics;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

/**
 * Exposes the interpretation pipeline's health through the actuator health endpoint.
 */
public class InterpreterHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Interpretation is slow or timing out");

    private final InterpretationMetrics metrics;

    public InterpreterHealthIndicator(InterpretationMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public Health health() {
        HealthReport report = metrics.healthReport();
        MetricsSnapshot snapshot = report.metrics();
        Health.Builder builder = switch (report.status()) {
            case UNHEALTHY -> Health.down();
            case DEGRADED -> Health.status(DEGRADED);
            case HEALTHY -> Health.up();
        };
        return builder
            .withDetail("issues", report.issues())
            .withDetail("totalRequests", snapshot.totalRequests())
            .withDetail("successRate", Math.round(snapshot.successRate() * 100.0) / 100.0)
            .withDetail("cacheHitRate", Math.round(snapshot.cacheHitRate() * 100.0) / 100.0)
            .withDetail("timeoutRate", Math.round(snapshot.timeoutRate() * 100.0) / 100.0)
            .withDetail("averageLatencyMillis", snapshot.averageLatency().toMillis())
            .withDetail("fallbackCount", snapshot.fallbackCount())
            .withDetail("windowStart", snapshot.windowStart().toString())
            .build();
    }
}
