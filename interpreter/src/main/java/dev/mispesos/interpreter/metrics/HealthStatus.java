package dev.mispesos.interpreter.metrics;

public enum HealthStatus {

    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
