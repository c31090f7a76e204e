package dev.mispesos.interpreter.interpretation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.mispesos.interpreter.inference.InferenceAttempt;
import dev.mispesos.interpreter.inference.InferenceExtractor;
import dev.mispesos.interpreter.pattern.PatternExtractor;
import dev.mispesos.records.Category;
import dev.mispesos.records.RecordOrigin;
import dev.mispesos.records.StructuredRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryingInterpreterTest {

    private InferenceExtractor inferenceExtractor;
    private List<Duration> sleeps;
    private RetryingInterpreter interpreter;

    @BeforeEach
    void setUp() {
        inferenceExtractor = mock(InferenceExtractor.class);
        sleeps = new ArrayList<>();
        interpreter = new RetryingInterpreter(inferenceExtractor, new PatternExtractor(0.8, 0.6, 0.2),
            RetryPolicy.defaultPolicy(), sleeps::add, 0.6);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void acceptsConfidentResultOnFirstAttempt() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.success(inferred(0.95)));

        InterpretationOutcome outcome = interpreter.interpret("50k almuerzo tarjeta");

        assertThat(outcome.accepted()).isTrue();
        assertThat(outcome.usedFallback()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.record().origin()).isEqualTo(RecordOrigin.INFERENCE);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void retriesAfterFailureWithBackoff() {
        when(inferenceExtractor.extract(anyString()))
            .thenReturn(InferenceAttempt.failure("connection refused"))
            .thenReturn(InferenceAttempt.success(inferred(0.9)));

        InterpretationOutcome outcome = interpreter.interpret("50k almuerzo tarjeta");

        assertThat(outcome.accepted()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void fallsBackAfterExhaustingAttemptsWithoutSleepingAfterTheLast() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.malformed("no json"));

        InterpretationOutcome outcome = interpreter.interpret("50k almuerzo tarjeta");

        verify(inferenceExtractor, times(2)).extract("50k almuerzo tarjeta");
        assertThat(outcome.accepted()).isFalse();
        assertThat(outcome.weak()).isFalse();
        assertThat(outcome.timedOut()).isFalse();
        assertThat(outcome.record().origin()).isEqualTo(RecordOrigin.PATTERN_FALLBACK);
        assertThat(outcome.record().amount()).isEqualByComparingTo("50000");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void tracksTimeouts() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.timeout("timed out"));

        InterpretationOutcome outcome = interpreter.interpret("pagué 25000 de uber efectivo ayer");

        assertThat(outcome.timeouts()).isEqualTo(2);
        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.record().category()).isEqualTo(Category.TRANSPORT);
    }

    @Test
    void lowConfidenceResultIsDiscarded() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.success(inferred(0.5)));

        InterpretationOutcome outcome = interpreter.interpret("50k almuerzo tarjeta");

        assertThat(outcome.accepted()).isFalse();
        assertThat(outcome.weak()).isTrue();
        assertThat(outcome.discardedConfidence()).isEqualTo(0.5);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.record().origin()).isEqualTo(RecordOrigin.PATTERN_FALLBACK);
        assertThat(outcome.record().confidence()).isEqualTo(0.6);
    }

    @Test
    void resultAtThresholdIsDiscarded() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.success(inferred(0.6)));

        assertThat(interpreter.interpret("50k almuerzo tarjeta").weak()).isTrue();
    }

    @Test
    void resultWithoutAmountIsDiscarded() {
        StructuredRecord noAmount = StructuredRecord.builder().confidence(0.95).origin(RecordOrigin.INFERENCE).build();
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.success(noAmount));

        InterpretationOutcome outcome = interpreter.interpret("almuerzo");

        assertThat(outcome.weak()).isTrue();
        assertThat(outcome.record().isSuccessful()).isFalse();
        assertThat(outcome.record().confidence()).isEqualTo(0.2);
    }

    @Test
    void interruptionStopsRetrying() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.failure("down"));
        RetryingInterpreter interruptible = new RetryingInterpreter(inferenceExtractor,
            new PatternExtractor(0.8, 0.6, 0.2), new RetryPolicy(3, Duration.ofSeconds(1), 0.0),
            duration -> {
                throw new InterruptedException();
            }, 0.6);

        InterpretationOutcome outcome = interruptible.interpret("50k almuerzo");

        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.usedFallback()).isTrue();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void waitsBetweenAttemptsInRealTime() {
        when(inferenceExtractor.extract(anyString())).thenReturn(InferenceAttempt.failure("down"));
        RetryingInterpreter timed = new RetryingInterpreter(inferenceExtractor, new PatternExtractor(0.8, 0.6, 0.2),
            new RetryPolicy(3, Duration.ofMillis(20), 0.0), Sleeper.THREAD, 0.6);

        long started = System.nanoTime();
        InterpretationOutcome outcome = timed.interpret("50k almuerzo");
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(60));
    }

    private static StructuredRecord inferred(double confidence) {
        return StructuredRecord.builder()
            .amount(new BigDecimal("50000"))
            .description("almuerzo")
            .category(Category.FOOD)
            .confidence(confidence)
            .origin(RecordOrigin.INFERENCE)
            .build();
    }
}
