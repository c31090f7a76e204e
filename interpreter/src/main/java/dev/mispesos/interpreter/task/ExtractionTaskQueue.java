package dev.mispesos.interpreter.task;

import dev.mispesos.messaging.ExtractionJobMessage;
import dev.mispesos.messaging.ExtractionQueue;
import dev.mispesos.messaging.ExtractionTask;
import dev.mispesos.messaging.TaskState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.util.StringUtils;

/**
 * In-process {@link ExtractionQueue} backed by a worker pool.
 *
 * <p>Once a job is accepted, the queue owns its image file and deletes it when the task ends or
 * is revoked before starting. Finished tasks stay pollable for the configured retention.
 */
public class ExtractionTaskQueue implements ExtractionQueue {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionTaskQueue.class);

    private final ConcurrentMap<String, TaskHandle> tasks = new ConcurrentHashMap<>();
    private final AsyncTaskExecutor executor;
    private final ReceiptExtractionWorker worker;
    private final long maxImageBytes;
    private final Duration resultRetention;
    private final Clock clock;

    public ExtractionTaskQueue(AsyncTaskExecutor executor, ReceiptExtractionWorker worker, long maxImageBytes,
        Duration resultRetention, Clock clock) {
        this.executor = executor;
        this.worker = worker;
        this.maxImageBytes = maxImageBytes;
        this.resultRetention = resultRetention;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public String submit(ExtractionJobMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        Path image = validateImage(message.imagePath());
        String taskId = StringUtils.hasText(message.taskId()) ? message.taskId() : UUID.randomUUID().toString();

        TaskHandle handle = new TaskHandle(taskId, message, image, clock);
        if (tasks.putIfAbsent(taskId, handle) != null) {
            throw new IllegalArgumentException("Task id already in use: " + taskId);
        }
        try {
            Future<?> future = executor.submit(() -> worker.run(handle));
            handle.attach(future);
        } catch (TaskRejectedException ex) {
            tasks.remove(taskId);
            throw new ExtractionTaskException("Extraction queue rejected task " + taskId, ex);
        }
        LOGGER.info("Queued extraction task {} for image {} (createRecord={})", taskId, image.getFileName(),
            message.createRecord());
        return taskId;
    }

    @Override
    public Optional<ExtractionTask> poll(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId)).map(TaskHandle::snapshot);
    }

    @Override
    public boolean cancel(String taskId) {
        TaskHandle handle = taskId != null ? tasks.get(taskId) : null;
        if (handle == null) {
            return false;
        }
        Optional<TaskState> previous = handle.revoke();
        if (previous.isEmpty()) {
            LOGGER.info("Extraction task {} already finished; nothing to cancel", taskId);
            return false;
        }
        if (previous.get() == TaskState.PENDING) {
            ReceiptExtractionWorker.deleteImage(handle.image());
        }
        LOGGER.info("Revoked extraction task {} (was {})", taskId, previous.get());
        return true;
    }

    /**
     * Forgets finished tasks whose results have outlived the retention period.
     */
    @Scheduled(fixedDelayString = "${interpreter.tasks.purge-interval:PT5M}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = tasks.size();
        tasks.values().removeIf(handle -> handle.isExpired(now, resultRetention));
        int purged = before - tasks.size();
        if (purged > 0) {
            LOGGER.info("Purged {} expired extraction task(s)", purged);
        }
    }

    int size() {
        return tasks.size();
    }

    private Path validateImage(String imagePath) {
        if (!StringUtils.hasText(imagePath)) {
            throw new IllegalArgumentException("Image path must not be empty");
        }
        Path image;
        try {
            image = Path.of(imagePath);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException("Invalid image path: " + imagePath, ex);
        }
        if (!Files.isRegularFile(image) || !Files.isReadable(image)) {
            throw new IllegalArgumentException("Image file does not exist or is not readable: " + imagePath);
        }
        long size;
        try {
            size = Files.size(image);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read size of image file: " + imagePath, ex);
        }
        if (size > maxImageBytes) {
            throw new IllegalArgumentException(
                "Image file is " + size + " bytes; the maximum allowed is " + maxImageBytes + " bytes");
        }
        return image;
    }
}
