package dev.mispesos.interpreter.metrics;

import java.util.List;

/**
 * Health classification together with the reasons behind it and the metrics it was based on.
 */
public record HealthReport(HealthStatus status, List<String> issues, MetricsSnapshot metrics) {

    public HealthReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
