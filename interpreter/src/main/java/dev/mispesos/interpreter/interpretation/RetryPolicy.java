package dev.mispesos.interpreter.interpretation;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for inference retries: {@code baseDelay * 2^attempt}, optionally with
 * symmetric jitter.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double jitterFactor;

    public RetryPolicy(int maxAttempts, Duration baseDelay, double jitterFactor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("Jitter factor must be in [0, 1)");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Delay to wait after the given zero-based attempt failed.
     */
    public Duration delay(int attempt) {
        long exponential = baseDelay.toMillis() * (1L << Math.min(Math.max(attempt, 0), 20));
        return Duration.ofMillis(jitter(exponential));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    /**
     * Two attempts, 2 s base delay, no jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2, Duration.ofSeconds(2), 0.0);
    }
}
