package dev.mispesos.interpreter.metrics;

import dev.mispesos.records.Category;
import dev.mispesos.records.PaymentMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates interpretation outcomes over a rolling window and publishes them to Micrometer.
 *
 * <p>The window counters back {@link #snapshot()} and {@link #healthReport()}; they are reset
 * once the window elapses, after logging a summary. Micrometer meters are cumulative and never
 * reset.
 */
public class InterpretationMetrics {

    private static final Logger LOGGER = LoggerFactory.getLogger(InterpretationMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Duration window;
    private final HealthThresholds thresholds;
    private final double lowConfidenceThreshold;
    private final Clock clock;

    private final Timer latencyTimer;
    private final Counter cacheHitCounter;
    private final Counter fallbackCounter;
    private final Counter timeoutCounter;

    private Window current;

    public InterpretationMetrics(MeterRegistry meterRegistry, Duration window, HealthThresholds thresholds,
        double lowConfidenceThreshold, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.window = window;
        this.thresholds = thresholds != null ? thresholds : HealthThresholds.defaults();
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.latencyTimer = Timer.builder("interpreter.latency")
            .description("Time spent interpreting a statement")
            .register(meterRegistry);
        this.cacheHitCounter = Counter.builder("interpreter.cache.hits").register(meterRegistry);
        this.fallbackCounter = Counter.builder("interpreter.fallbacks").register(meterRegistry);
        this.timeoutCounter = Counter.builder("interpreter.timeouts").register(meterRegistry);
        this.current = new Window(this.clock.instant());
    }

    public void record(RequestOutcome outcome) {
        publish(outcome);
        synchronized (this) {
            rollIfElapsed();
            current.record(outcome, lowConfidenceThreshold);
        }
    }

    /**
     * Counts a record handed to storage.
     */
    public void recordCreated(Category category, PaymentMethod paymentMethod) {
        meterRegistry.counter("interpreter.records.created",
            "category", category.value(), "payment_method", paymentMethod.value()).increment();
        synchronized (this) {
            rollIfElapsed();
            current.recordsCreated++;
            current.byCategory.merge(category.value(), 1L, Long::sum);
            current.byPaymentMethod.merge(paymentMethod.value(), 1L, Long::sum);
        }
    }

    public synchronized MetricsSnapshot snapshot() {
        rollIfElapsed();
        return current.snapshot();
    }

    public HealthReport healthReport() {
        MetricsSnapshot snapshot = snapshot();
        HealthStatus status = HealthStatus.HEALTHY;
        List<String> issues = new ArrayList<>();
        if (snapshot.totalRequests() > thresholds.minimumSamples()) {
            if (snapshot.timeoutRate() > thresholds.maxTimeoutRate()) {
                status = worst(status, HealthStatus.DEGRADED);
                issues.add(String.format(Locale.ROOT, "High timeout rate: %.1f%%", snapshot.timeoutRate()));
            }
            if (snapshot.successRate() < thresholds.minSuccessRate()) {
                status = worst(status, HealthStatus.UNHEALTHY);
                issues.add(String.format(Locale.ROOT, "Low success rate: %.1f%%", snapshot.successRate()));
            }
            if (snapshot.averageLatency().compareTo(thresholds.maxAverageLatency()) > 0) {
                status = worst(status, HealthStatus.DEGRADED);
                issues.add(String.format(Locale.ROOT, "High latency: %.1fs",
                    snapshot.averageLatency().toMillis() / 1000.0));
            }
        }
        return new HealthReport(status, issues, snapshot);
    }

    public HealthStatus healthStatus() {
        return healthReport().status();
    }

    /**
     * Logs the current window and starts a new one.
     */
    public synchronized void reset() {
        logSummary(current.snapshot());
        current = new Window(clock.instant());
    }

    private void rollIfElapsed() {
        Instant now = clock.instant();
        if (Duration.between(current.start, now).compareTo(window) > 0) {
            LOGGER.info("Metrics window of {} elapsed; resetting", window);
            logSummary(current.snapshot());
            current = new Window(now);
        }
    }

    private void publish(RequestOutcome outcome) {
        String result = outcome.timedOut() ? "timeout" : outcome.success() ? "success" : "failure";
        String source = outcome.fromCache() ? "cache" : outcome.usedFallback() ? "pattern" : "inference";
        meterRegistry.counter("interpreter.requests", "result", result, "source", source).increment();
        latencyTimer.record(outcome.latency());
        if (outcome.fromCache()) {
            cacheHitCounter.increment();
        }
        if (outcome.usedFallback()) {
            fallbackCounter.increment();
        }
        if (outcome.timedOut()) {
            timeoutCounter.increment();
        }
    }

    private static HealthStatus worst(HealthStatus left, HealthStatus right) {
        return left.compareTo(right) >= 0 ? left : right;
    }

    private static void logSummary(MetricsSnapshot snapshot) {
        LOGGER.info("Interpretation metrics since {}: requests={}, successRate={}%, cacheHitRate={}%, "
                + "timeoutRate={}%, avgLatency={}ms, avgConfidence={}, fallbacks={}, recordsCreated={}, "
                + "byCategory={}, byPaymentMethod={}",
            snapshot.windowStart(), snapshot.totalRequests(), round(snapshot.successRate()),
            round(snapshot.cacheHitRate()), round(snapshot.timeoutRate()), snapshot.averageLatency().toMillis(),
            round(snapshot.averageConfidence()), snapshot.fallbackCount(), snapshot.recordsCreated(),
            snapshot.recordsByCategory(), snapshot.recordsByPaymentMethod());
    }

    private static String round(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static final class Window {

        private final Instant start;
        private long total;
        private long successful;
        private long failed;
        private long timeouts;
        private long cacheHits;
        private long cacheMisses;
        private Duration totalLatency = Duration.ZERO;
        private Duration minLatency;
        private Duration maxLatency = Duration.ZERO;
        private double totalConfidence;
        private long lowConfidence;
        private long fallbacks;
        private long recordsCreated;
        private final Map<String, Long> byCategory = new HashMap<>();
        private final Map<String, Long> byPaymentMethod = new HashMap<>();

        private Window(Instant start) {
            this.start = start;
        }

        private void record(RequestOutcome outcome, double lowConfidenceThreshold) {
            total++;
            if (outcome.fromCache()) {
                cacheHits++;
            } else {
                cacheMisses++;
            }
            if (outcome.usedFallback()) {
                fallbacks++;
            }
            if (outcome.timedOut()) {
                timeouts++;
                failed++;
                return;
            }
            if (!outcome.success()) {
                failed++;
                return;
            }
            successful++;
            Duration latency = outcome.latency();
            totalLatency = totalLatency.plus(latency);
            minLatency = minLatency == null || latency.compareTo(minLatency) < 0 ? latency : minLatency;
            maxLatency = latency.compareTo(maxLatency) > 0 ? latency : maxLatency;
            if (outcome.confidence() != null) {
                totalConfidence += outcome.confidence();
                if (outcome.confidence() < lowConfidenceThreshold) {
                    lowConfidence++;
                }
            }
        }

        private MetricsSnapshot snapshot() {
            return new MetricsSnapshot(total, successful, failed, timeouts, cacheHits, cacheMisses, totalLatency,
                minLatency != null ? minLatency : Duration.ZERO, maxLatency, totalConfidence, lowConfidence,
                fallbacks, recordsCreated, byCategory, byPaymentMethod, start);
        }
    }
}
