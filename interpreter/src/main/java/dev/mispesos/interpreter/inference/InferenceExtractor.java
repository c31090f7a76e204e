package dev.mispesos.interpreter.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the model to interpret a financial statement and parses its answer.
 */
public class InferenceExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceExtractor.class);

    private static final String PROMPT_TEMPLATE = """
        Eres un asistente especializado en extraer información financiera de mensajes en español.

        Analiza el siguiente mensaje y extrae la información financiera en formato JSON:

        Mensaje: "%s"

        Debes extraer:
        - amount: monto numérico (solo números, sin símbolos)
        - description: QUÉ se compró o el servicio/producto (NO el método de pago). Ejemplos: "almuerzo", "Uber", "gasolina", "pizza"
        - category: categoría más probable (alimentacion, transporte, servicios, entretenimiento, salud, ropa, educacion, casa, otros)
        - payment_method: CÓMO se pagó (tarjeta, efectivo, transferencia, debito) - busca al FINAL del mensaje
        - location: lugar si se menciona
        - date_offset: días desde hoy (0=hoy, -1=ayer, 1=mañana)
        - confidence: nivel de confianza (0.0 a 1.0)

        IMPORTANTE:
        - La descripción debe ser el producto/servicio, NO el método de pago
        - El método de pago usualmente aparece al final: "tarjeta", "efectivo", "transferencia", "débito"

        Ejemplos:
        - "30k en Uber transferencia" → description: "Uber", payment_method: "transferencia"
        - "50k almuerzo tarjeta" → description: "almuerzo", payment_method: "tarjeta"
        - "pague 25000 gasolina efectivo" → description: "gasolina", payment_method: "efectivo"

        Formatos de dinero válidos:
        - "50k" = 50000
        - "50mil" = 50000
        - "50000" = 50000
        - "50.5k" = 50500

        Responde ÚNICAMENTE con un JSON válido, sin explicaciones adicionales:

        {
          "amount": 50000,
          "description": "almuerzo",
          "category": "alimentacion",
          "payment_method": "tarjeta",
          "location": null,
          "date_offset": 0,
          "confidence": 0.95
        }
        """;

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;
    private final InferenceResponseNormalizer responseNormalizer;

    public InferenceExtractor(InferenceClient inferenceClient, ObjectMapper objectMapper,
        InferenceResponseNormalizer responseNormalizer) {
        this.inferenceClient = inferenceClient;
        this.objectMapper = objectMapper;
        this.responseNormalizer = responseNormalizer;
    }

    /**
     * Performs one inference round trip. Transport failures are reported through the returned
     * attempt instead of being thrown.
     */
    public InferenceAttempt extract(String message) {
        String response;
        try {
            response = inferenceClient.generate(buildPrompt(message));
        } catch (InferenceTimeoutException ex) {
            LOGGER.warn("Inference request timed out: {}", ex.getMessage());
            return InferenceAttempt.timeout(ex.getMessage());
        } catch (InferenceException ex) {
            LOGGER.warn("Inference request failed: {}", ex.getMessage());
            return InferenceAttempt.failure(ex.getMessage());
        }

        String json = extractJsonBlock(response);
        if (json == null) {
            LOGGER.warn("No JSON object found in inference response. Payload begins with: {}", preview(response));
            return InferenceAttempt.malformed("No JSON object found in inference response");
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Failed to parse inference response. Payload begins with: {}", preview(response));
            return InferenceAttempt.malformed("Inference response is not valid JSON: " + ex.getOriginalMessage());
        }
        if (data == null || !data.isObject()) {
            return InferenceAttempt.malformed("Inference response JSON is not an object");
        }
        return InferenceAttempt.success(responseNormalizer.normalize(data, message, response));
    }

    String buildPrompt(String message) {
        return PROMPT_TEMPLATE.formatted(message != null ? message : "");
    }

    static String extractJsonBlock(String response) {
        if (response == null) {
            return null;
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return response.substring(start, end + 1);
    }

    private static String preview(String response) {
        if (response == null) {
            return "<null>";
        }
        return response.substring(0, Math.min(response.length(), 256));
    }
}
