package dev.mispesos.interpreter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.mispesos.interpreter.cache.ResponseCache;
import dev.mispesos.interpreter.inference.ConfidencePenalties;
import dev.mispesos.interpreter.inference.GenerationOptions;
import dev.mispesos.interpreter.inference.InferenceClient;
import dev.mispesos.interpreter.inference.InferenceExtractor;
import dev.mispesos.interpreter.inference.InferenceResponseNormalizer;
import dev.mispesos.interpreter.inference.OllamaInferenceClient;
import dev.mispesos.interpreter.interpretation.MessageInterpreter;
import dev.mispesos.interpreter.interpretation.MessageNormalizer;
import dev.mispesos.interpreter.interpretation.RetryPolicy;
import dev.mispesos.interpreter.interpretation.RetryingInterpreter;
import dev.mispesos.interpreter.interpretation.Sleeper;
import dev.mispesos.interpreter.metrics.HealthThresholds;
import dev.mispesos.interpreter.metrics.InterpretationMetrics;
import dev.mispesos.interpreter.metrics.InterpreterHealthIndicator;
import dev.mispesos.interpreter.pattern.PatternExtractor;
import dev.mispesos.interpreter.recognition.ReceiptMetadataExtractor;
import dev.mispesos.interpreter.recognition.TextRecognitionEngine;
import dev.mispesos.interpreter.recognition.UnavailableTextRecognitionEngine;
import dev.mispesos.interpreter.task.ExtractionTaskQueue;
import dev.mispesos.interpreter.task.ReceiptExtractionWorker;
import dev.mispesos.storage.DisabledRecordStorageService;
import dev.mispesos.storage.RecordStorageService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Wires the interpretation pipeline and the extraction queue.
 */
@Configuration
@EnableConfigurationProperties(InterpreterProperties.class)
public class InterpreterConfiguration {

    public static final String EXTRACTION_EXECUTOR = "extractionTaskExecutor";

    private static final Logger LOGGER = LoggerFactory.getLogger(InterpreterConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(InferenceClient.class)
    public OllamaInferenceClient ollamaInferenceClient(InterpreterProperties properties,
        ObjectProvider<ObservationRegistry> observationRegistry) {
        InterpreterProperties.Inference inference = properties.inference();
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(inference.connectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(inference.timeout());
        RestClient restClient = RestClient.builder()
            .baseUrl(inference.baseUrl())
            .requestFactory(requestFactory)
            .build();
        GenerationOptions options = new GenerationOptions(inference.temperature(), inference.topP(),
            inference.maxTokens(), inference.contextWindow());
        LOGGER.info("Configured inference client - baseUrl: {}, model: {}, timeout: {}, options: {}",
            inference.baseUrl(), inference.model(), inference.timeout(), options);
        return new OllamaInferenceClient(restClient, inference.model(), options,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    public InferenceExtractor inferenceExtractor(InferenceClient inferenceClient, ObjectMapper objectMapper,
        InterpreterProperties properties) {
        InterpreterProperties.Confidence confidence = properties.confidence();
        ConfidencePenalties penalties = new ConfidencePenalties(confidence.invalidAmountPenalty(),
            confidence.invalidCategoryPenalty(), confidence.invalidPaymentMethodPenalty());
        return new InferenceExtractor(inferenceClient, objectMapper, new InferenceResponseNormalizer(penalties));
    }

    @Bean
    public PatternExtractor patternExtractor(InterpreterProperties properties) {
        InterpreterProperties.Confidence confidence = properties.confidence();
        return new PatternExtractor(confidence.patternBaseline(), confidence.patternFallback(),
            confidence.patternFailure());
    }

    @Bean
    public ResponseCache responseCache(InterpreterProperties properties) {
        InterpreterProperties.Cache cache = properties.cache();
        return new ResponseCache(cache.ttl(), cache.maximumSize(), cache.retainRatio(),
            properties.confidence().acceptance(), Ticker.systemTicker());
    }

    @Bean
    public RetryingInterpreter retryingInterpreter(InferenceExtractor inferenceExtractor,
        PatternExtractor patternExtractor, InterpreterProperties properties) {
        InterpreterProperties.Retry retry = properties.retry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.jitter());
        return new RetryingInterpreter(inferenceExtractor, patternExtractor, retryPolicy, Sleeper.THREAD,
            properties.confidence().acceptance());
    }

    @Bean
    public InterpretationMetrics interpretationMetrics(ObjectProvider<MeterRegistry> meterRegistry,
        InterpreterProperties properties, Clock clock) {
        InterpreterProperties.Metrics metrics = properties.metrics();
        HealthThresholds thresholds = new HealthThresholds(metrics.minimumSamples(), metrics.maxTimeoutRate(),
            metrics.minSuccessRate(), metrics.maxAverageLatency());
        return new InterpretationMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new), metrics.window(),
            thresholds, properties.confidence().acceptance(), clock);
    }

    @Bean
    public InterpreterHealthIndicator interpreterHealthIndicator(InterpretationMetrics interpretationMetrics) {
        return new InterpreterHealthIndicator(interpretationMetrics);
    }

    @Bean
    public MessageInterpreter messageInterpreter(ResponseCache responseCache, RetryingInterpreter retryingInterpreter,
        PatternExtractor patternExtractor, InferenceClient inferenceClient,
        InterpretationMetrics interpretationMetrics) {
        return new MessageInterpreter(new MessageNormalizer(), responseCache, retryingInterpreter, patternExtractor,
            inferenceClient, interpretationMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public TextRecognitionEngine textRecognitionEngine() {
        LOGGER.warn("No text recognition engine configured; image extraction tasks will fail");
        return new UnavailableTextRecognitionEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordStorageService recordStorageService() {
        LOGGER.info("Record storage integration disabled; tasks requesting record creation will fail");
        return new DisabledRecordStorageService();
    }

    @Bean(name = EXTRACTION_EXECUTOR)
    public ThreadPoolTaskExecutor extractionTaskExecutor(InterpreterProperties properties) {
        InterpreterProperties.Tasks tasks = properties.tasks();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(tasks.workers());
        executor.setMaxPoolSize(Math.max(tasks.workers(), tasks.maxWorkers()));
        executor.setQueueCapacity(tasks.queueCapacity());
        executor.setThreadNamePrefix("extraction-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public ReceiptExtractionWorker receiptExtractionWorker(TextRecognitionEngine textRecognitionEngine,
        MessageInterpreter messageInterpreter, RecordStorageService recordStorageService,
        InterpretationMetrics interpretationMetrics) {
        return new ReceiptExtractionWorker(textRecognitionEngine, messageInterpreter, new ReceiptMetadataExtractor(),
            recordStorageService, interpretationMetrics);
    }

    @Bean
    public ExtractionTaskQueue extractionTaskQueue(ThreadPoolTaskExecutor extractionTaskExecutor,
        ReceiptExtractionWorker receiptExtractionWorker, InterpreterProperties properties, Clock clock) {
        InterpreterProperties.Tasks tasks = properties.tasks();
        return new ExtractionTaskQueue(extractionTaskExecutor, receiptExtractionWorker,
            tasks.maxImageSize().toBytes(), tasks.resultRetention(), clock);
    }
}
