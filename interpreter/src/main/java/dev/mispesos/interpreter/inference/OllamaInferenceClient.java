package dev.mispesos.interpreter.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link InferenceClient} for an Ollama server's {@code /api/generate} endpoint.
 */
public class OllamaInferenceClient implements InferenceClient {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    static final int MINIMUM_RESPONSE_LENGTH = 10;

    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaInferenceClient.class);

    private final RestClient restClient;
    private final String model;
    private final GenerationOptions options;
    private final ObservationRegistry observationRegistry;

    public OllamaInferenceClient(RestClient restClient, String model, GenerationOptions options,
        ObservationRegistry observationRegistry) {
        if (!StringUtils.hasText(model)) {
            throw new IllegalArgumentException("Inference model name must be configured");
        }
        this.restClient = restClient;
        this.model = model;
        this.options = options != null ? options : GenerationOptions.defaults();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    public String getModel() {
        return model;
    }

    @Override
    public String generate(String prompt) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        Observation observation = Observation.start("interpreter.inference.call", observationRegistry)
            .lowCardinalityKeyValue("model", model);
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.debug("Calling inference model '{}' with prompt length {}", model, prompt.length());
            GenerateResponse response = executeRequest(buildRequest(prompt));
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            restClient.get()
                .uri("/api/tags")
                .retrieve()
                .toBodilessEntity();
            return true;
        } catch (RestClientException ex) {
            LOGGER.warn("Inference service probe failed: {}", ex.getMessage());
            return false;
        }
    }

    private GenerateRequest buildRequest(String prompt) {
        GenerateRequest.Options requestOptions = new GenerateRequest.Options(options.temperature(), options.topP(),
            options.maxTokens(), options.contextWindow());
        return new GenerateRequest(model, prompt, false, -1, requestOptions);
    }

    private GenerateResponse executeRequest(GenerateRequest request) {
        try {
            return restClient.post()
                .uri("/api/generate")
                .body(request)
                .retrieve()
                .body(GenerateResponse.class);
        } catch (RestClientResponseException ex) {
            throw new InferenceException("Inference service returned status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            if (isTimeout(ex)) {
                throw new InferenceTimeoutException("Inference request to model '" + model + "' timed out", ex);
            }
            throw new InferenceException("Inference request failed", ex);
        }
    }

    private String extractContent(GenerateResponse response) {
        String text = response != null ? response.response() : null;
        if (text == null || text.strip().length() < MINIMUM_RESPONSE_LENGTH) {
            throw new InferenceException("Inference response was empty or too short to be complete");
        }
        return text;
    }

    private static boolean isTimeout(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    private record GenerateRequest(
        String model,
        String prompt,
        boolean stream,
        @JsonProperty("keep_alive") int keepAlive,
        Options options
    ) {

        private record Options(
            double temperature,
            @JsonProperty("top_p") double topP,
            @JsonProperty("num_predict") int numPredict,
            @JsonProperty("num_ctx") int numCtx
        ) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GenerateResponse(String response) {
    }
}
