package dev.mispesos.interpreter.task;

import dev.mispesos.interpreter.interpretation.MessageInterpreter;
import dev.mispesos.interpreter.metrics.InterpretationMetrics;
import dev.mispesos.interpreter.recognition.ReceiptMetadataExtractor;
import dev.mispesos.interpreter.recognition.RecognizedText;
import dev.mispesos.interpreter.recognition.TextRecognitionEngine;
import dev.mispesos.messaging.ExtractionJobMessage;
import dev.mispesos.messaging.ExtractionTaskResult;
import dev.mispesos.messaging.ProgressStep;
import dev.mispesos.records.StructuredRecord;
import dev.mispesos.storage.RecordStorageService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Runs the steps of an image extraction task: recognition, interpretation and optional
 * persistence. The image is deleted when the task ends, whatever the outcome.
 */
public class ReceiptExtractionWorker {

    static final String NO_TEXT_MESSAGE = "No text could be recognized in the image";
    static final String NO_AMOUNT_MESSAGE = "No amount found in the recognized text";

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptExtractionWorker.class);

    private final TextRecognitionEngine recognitionEngine;
    private final MessageInterpreter messageInterpreter;
    private final ReceiptMetadataExtractor metadataExtractor;
    private final RecordStorageService recordStorageService;
    private final InterpretationMetrics metrics;

    public ReceiptExtractionWorker(TextRecognitionEngine recognitionEngine, MessageInterpreter messageInterpreter,
        ReceiptMetadataExtractor metadataExtractor, RecordStorageService recordStorageService,
        InterpretationMetrics metrics) {
        this.recognitionEngine = recognitionEngine;
        this.messageInterpreter = messageInterpreter;
        this.metadataExtractor = metadataExtractor;
        this.recordStorageService = recordStorageService;
        this.metrics = metrics;
    }

    void run(TaskHandle task) {
        try (ExtractionTaskMdc.Context context = ExtractionTaskMdc.open(task.id())) {
            try {
                execute(task);
            } catch (RuntimeException ex) {
                LOGGER.error("Extraction task {} failed", task.id(), ex);
                task.fail(describe(ex));
            } finally {
                ExtractionTaskMdc.setStage(null);
                deleteImage(task.image());
            }
        }
    }

    private void execute(TaskHandle task) {
        if (!advance(task, ProgressStep.PREPROCESSING)) {
            return;
        }
        LOGGER.info("Processing receipt image {}", task.image().getFileName());

        if (!advance(task, ProgressStep.RECOGNITION)) {
            return;
        }
        RecognizedText recognized = recognitionEngine.recognize(task.image());
        if (!recognized.hasText()) {
            LOGGER.warn("Recognition returned no text");
            task.fail(NO_TEXT_MESSAGE);
            return;
        }
        LOGGER.info("Recognized {} characters with confidence {}", recognized.text().length(),
            recognized.confidence());

        if (!advance(task, ProgressStep.INTERPRETATION)) {
            return;
        }
        StructuredRecord record = messageInterpreter.interpret(recognized.text());
        if (!record.isSuccessful()) {
            LOGGER.warn("Interpretation found no amount in the recognized text");
            task.fail(NO_AMOUNT_MESSAGE);
            return;
        }
        Map<String, String> receiptMetadata = metadataExtractor.extract(recognized.text());

        String recordId = null;
        ExtractionJobMessage message = task.message();
        if (message.createRecord()) {
            if (!advance(task, ProgressStep.PERSISTENCE)) {
                return;
            }
            recordId = recordStorageService.store(record, storageMetadata(task, receiptMetadata));
            metrics.recordCreated(record.category(), record.paymentMethod());
            LOGGER.info("Stored record {} ({} {})", recordId, record.amount(), record.category().value());
        }

        ExtractionTaskResult result = new ExtractionTaskResult(record, recognized.text(), recognized.confidence(),
            receiptMetadata, recordId);
        if (task.succeed(result)) {
            LOGGER.info("Extraction task completed with amount {} and confidence {}", record.amount(),
                record.confidence());
        } else {
            LOGGER.info("Extraction task finished after being revoked; result discarded");
        }
    }

    private boolean advance(TaskHandle task, ProgressStep step) {
        if (Thread.currentThread().isInterrupted() || !task.advance(step)) {
            LOGGER.info("Extraction task revoked before step '{}'", step.value());
            return false;
        }
        ExtractionTaskMdc.setStage(step.value());
        return true;
    }

    private Map<String, String> storageMetadata(TaskHandle task, Map<String, String> receiptMetadata) {
        ExtractionJobMessage message = task.message();
        Map<String, String> metadata = new LinkedHashMap<>();
        if (message.metadata() != null) {
            metadata.putAll(message.metadata());
        }
        metadata.putAll(receiptMetadata);
        metadata.put("taskId", task.id());
        metadata.put("source", "receipt");
        if (StringUtils.hasText(message.requestedBy())) {
            metadata.put("requestedBy", message.requestedBy());
        }
        return metadata;
    }

    static void deleteImage(Path image) {
        try {
            if (Files.deleteIfExists(image)) {
                LOGGER.debug("Deleted receipt image {}", image);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to delete receipt image {}", image, ex);
        }
    }

    private static String describe(RuntimeException ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
