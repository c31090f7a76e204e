package dev.mispesos.interpreter.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.mispesos.records.Category;
import dev.mispesos.records.PaymentMethod;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InterpretationMetricsTest {

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private InterpretationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        metrics = new InterpretationMetrics(registry, Duration.ofHours(1), HealthThresholds.defaults(), 0.6, clock);
    }

    @Test
    void aggregatesCountersAndRates() {
        metrics.record(RequestOutcome.inference(Duration.ofSeconds(2), 0.9));
        metrics.record(RequestOutcome.inference(Duration.ofSeconds(4), 0.5));
        metrics.record(RequestOutcome.cacheHit(Duration.ZERO, 0.7));
        metrics.record(RequestOutcome.fallback(Duration.ofSeconds(10), true));

        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.totalRequests()).isEqualTo(4);
        assertThat(snapshot.successfulRequests()).isEqualTo(3);
        assertThat(snapshot.failedRequests()).isEqualTo(1);
        assertThat(snapshot.timeoutRequests()).isEqualTo(1);
        assertThat(snapshot.cacheHits()).isEqualTo(1);
        assertThat(snapshot.cacheMisses()).isEqualTo(3);
        assertThat(snapshot.fallbackCount()).isEqualTo(1);
        assertThat(snapshot.lowConfidenceCount()).isEqualTo(1);
        assertThat(snapshot.successRate()).isEqualTo(75.0);
        assertThat(snapshot.cacheHitRate()).isEqualTo(25.0);
        assertThat(snapshot.timeoutRate()).isEqualTo(25.0);
        assertThat(snapshot.averageLatency()).isEqualTo(Duration.ofSeconds(2));
        assertThat(snapshot.minLatency()).isEqualTo(Duration.ZERO);
        assertThat(snapshot.maxLatency()).isEqualTo(Duration.ofSeconds(4));
        assertThat(snapshot.averageConfidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void publishesMicrometerMeters() {
        metrics.record(RequestOutcome.cacheHit(Duration.ofMillis(1), 0.9));
        metrics.record(RequestOutcome.fallback(Duration.ofSeconds(3), true));
        metrics.record(RequestOutcome.weakInference(Duration.ofSeconds(1), 0.3));

        assertThat(registry.get("interpreter.cache.hits").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("interpreter.fallbacks").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("interpreter.timeouts").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("interpreter.latency").timer().count()).isEqualTo(3);
        assertThat(registry.get("interpreter.requests").tags("result", "timeout").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("interpreter.requests").tags("result", "success", "source", "cache").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void countsCreatedRecordsByCategoryAndPaymentMethod() {
        metrics.recordCreated(Category.FOOD, PaymentMethod.CARD);
        metrics.recordCreated(Category.FOOD, PaymentMethod.CASH);
        metrics.recordCreated(Category.TRANSPORT, PaymentMethod.CASH);

        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.recordsCreated()).isEqualTo(3);
        assertThat(snapshot.recordsByCategory()).containsEntry("food", 2L).containsEntry("transport", 1L);
        assertThat(snapshot.recordsByPaymentMethod()).containsEntry("cash", 2L).containsEntry("card", 1L);
        assertThat(registry.get("interpreter.records.created").tags("category", "food").counters()).hasSize(2);
    }

    @Test
    void healthyUntilEnoughSamples() {
        for (int i = 0; i < 10; i++) {
            metrics.record(RequestOutcome.fallback(Duration.ofSeconds(90), true));
        }

        HealthReport report = metrics.healthReport();

        assertThat(report.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.issues()).isEmpty();
    }

    @Test
    void lowSuccessRateIsUnhealthy() {
        for (int i = 0; i < 11; i++) {
            metrics.record(RequestOutcome.fallback(Duration.ofSeconds(90), i % 2 == 0));
        }

        HealthReport report = metrics.healthReport();

        assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(report.issues()).anySatisfy(issue -> assertThat(issue).startsWith("High timeout rate"))
            .anySatisfy(issue -> assertThat(issue).startsWith("Low success rate"));
    }

    @Test
    void slowResponsesAreDegraded() {
        for (int i = 0; i < 11; i++) {
            metrics.record(RequestOutcome.inference(Duration.ofSeconds(31), 0.9));
        }

        HealthReport report = metrics.healthReport();

        assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(report.issues()).containsExactly("High latency: 31.0s");
    }

    @Test
    void latencyNeverMasksUnhealthyStatus() {
        for (int i = 0; i < 3; i++) {
            metrics.record(RequestOutcome.inference(Duration.ofSeconds(60), 0.9));
        }
        for (int i = 0; i < 9; i++) {
            metrics.record(RequestOutcome.weakInference(Duration.ofSeconds(1), 0.2));
        }

        HealthReport report = metrics.healthReport();

        assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(report.issues()).hasSize(2);
    }

    @Test
    void windowResetsAfterInterval() {
        metrics.record(RequestOutcome.inference(Duration.ofSeconds(1), 0.9));
        clock.advance(Duration.ofMinutes(59));
        assertThat(metrics.snapshot().totalRequests()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(2));
        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.totalRequests()).isZero();
        assertThat(snapshot.windowStart()).isEqualTo(Instant.parse("2026-03-01T11:01:00Z"));
        assertThat(registry.get("interpreter.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void explicitResetStartsNewWindow() {
        metrics.record(RequestOutcome.inference(Duration.ofSeconds(1), 0.9));

        metrics.reset();

        assertThat(metrics.snapshot().totalRequests()).isZero();
    }
}
