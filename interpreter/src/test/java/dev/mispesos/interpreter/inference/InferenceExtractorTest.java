package dev.mispesos.interpreter.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mispesos.records.Category;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InferenceExtractorTest {

    private InferenceClient inferenceClient;
    private InferenceExtractor extractor;

    @BeforeEach
    void setUp() {
        inferenceClient = mock(InferenceClient.class);
        extractor = new InferenceExtractor(inferenceClient, new ObjectMapper(),
            new InferenceResponseNormalizer(ConfidencePenalties.defaults()));
    }

    @Test
    void parsesJsonSurroundedByProse() {
        when(inferenceClient.generate(anyString())).thenReturn("""
            Claro, aquí está el resultado:
            {"amount": 50000, "description": "almuerzo", "category": "alimentacion",
             "payment_method": "tarjeta", "date_offset": 0, "confidence": 0.95}
            Espero que sirva.
            """);

        InferenceAttempt attempt = extractor.extract("50k almuerzo tarjeta");

        assertThat(attempt.outcome()).isEqualTo(InferenceAttempt.Outcome.SUCCESS);
        assertThat(attempt.record().amount()).isEqualByComparingTo("50000");
        assertThat(attempt.record().category()).isEqualTo(Category.FOOD);
        assertThat(attempt.record().rawResponse()).contains("Espero que sirva");
    }

    @Test
    void embedsMessageInPrompt() {
        when(inferenceClient.generate(anyString())).thenReturn("{\"amount\": 1000, \"confidence\": 0.9}");

        extractor.extract("30k en Uber transferencia");

        verify(inferenceClient).generate(contains("Mensaje: \"30k en Uber transferencia\""));
    }

    @Test
    void responseWithoutJsonIsMalformed() {
        when(inferenceClient.generate(anyString())).thenReturn("No puedo ayudar con eso, lo siento.");

        InferenceAttempt attempt = extractor.extract("hola");

        assertThat(attempt.outcome()).isEqualTo(InferenceAttempt.Outcome.MALFORMED);
        assertThat(attempt.record()).isNull();
    }

    @Test
    void invalidJsonIsMalformed() {
        when(inferenceClient.generate(anyString())).thenReturn("{\"amount\": 50000, \"category\": }");

        assertThat(extractor.extract("50k").outcome()).isEqualTo(InferenceAttempt.Outcome.MALFORMED);
    }

    @Test
    void timeoutIsReportedSeparately() {
        when(inferenceClient.generate(anyString())).thenThrow(new InferenceTimeoutException("timed out"));

        InferenceAttempt attempt = extractor.extract("50k");

        assertThat(attempt.isTimeout()).isTrue();
        assertThat(attempt.detail()).isEqualTo("timed out");
    }

    @Test
    void transportErrorIsFailure() {
        when(inferenceClient.generate(anyString())).thenThrow(new InferenceException("connection refused"));

        assertThat(extractor.extract("50k").outcome()).isEqualTo(InferenceAttempt.Outcome.FAILURE);
    }

    @Test
    void extractsOutermostBraces() {
        assertThat(InferenceExtractor.extractJsonBlock("x {\"a\": {\"b\": 1}} y")).isEqualTo("{\"a\": {\"b\": 1}}");
        assertThat(InferenceExtractor.extractJsonBlock("} nothing {")).isNull();
        assertThat(InferenceExtractor.extractJsonBlock(null)).isNull();
    }
}
