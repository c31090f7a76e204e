package dev.mispesos.interpreter;

import dev.mispesos.interpreter.inference.InferenceClient;
import dev.mispesos.interpreter.recognition.TextRecognitionEngine;
import dev.mispesos.storage.RecordStorageService;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the effective configuration and collaborator wiring when the service boots.
 */
@Component
public class InterpreterDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(InterpreterDiagnostics.class);

    private final Environment environment;
    private final InterpreterProperties properties;
    private final InferenceClient inferenceClient;
    private final TextRecognitionEngine textRecognitionEngine;
    private final RecordStorageService recordStorageService;

    public InterpreterDiagnostics(Environment environment, InterpreterProperties properties,
        InferenceClient inferenceClient, TextRecognitionEngine textRecognitionEngine,
        RecordStorageService recordStorageService) {
        this.environment = environment;
        this.properties = properties;
        this.inferenceClient = inferenceClient;
        this.textRecognitionEngine = textRecognitionEngine;
        this.recordStorageService = recordStorageService;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Statement interpreter diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Inference endpoint {} with model '{}' (timeout {}, {} attempt(s))",
            properties.inference().baseUrl(), properties.inference().model(), properties.inference().timeout(),
            properties.retry().maxAttempts());
        LOGGER.info("Inference client implementation: {}", inferenceClient.getClass().getName());
        LOGGER.info("Response cache ttl {} with capacity {}", properties.cache().ttl(),
            properties.cache().maximumSize());
        LOGGER.info("Extraction workers {}-{}, max image size {}", properties.tasks().workers(),
            properties.tasks().maxWorkers(), properties.tasks().maxImageSize());
        LOGGER.info("Text recognition engine: {}", textRecognitionEngine.describe());
        LOGGER.info("Record storage enabled: {}", recordStorageService.isEnabled());
    }
}
