package dev.mispesos.interpreter.task;

import dev.mispesos.messaging.ExtractionJobMessage;
import dev.mispesos.messaging.ExtractionTask;
import dev.mispesos.messaging.ExtractionTaskResult;
import dev.mispesos.messaging.ProgressStep;
import dev.mispesos.messaging.TaskState;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Mutable state of one extraction task. All transitions are synchronized and none of them
 * leaves a terminal state.
 */
final class TaskHandle {

    private final String id;
    private final ExtractionJobMessage message;
    private final Path image;
    private final Clock clock;
    private final Instant createdAt;

    private TaskState state = TaskState.PENDING;
    private ProgressStep step = ProgressStep.QUEUED;
    private ExtractionTaskResult result;
    private String error;
    private Instant updatedAt;
    private Future<?> future;

    TaskHandle(String id, ExtractionJobMessage message, Path image, Clock clock) {
        this.id = id;
        this.message = message;
        this.image = image;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    String id() {
        return id;
    }

    ExtractionJobMessage message() {
        return message;
    }

    Path image() {
        return image;
    }

    synchronized boolean advance(ProgressStep nextStep) {
        if (state.isTerminal()) {
            return false;
        }
        state = TaskState.PROGRESS;
        step = nextStep;
        touch();
        return true;
    }

    synchronized boolean succeed(ExtractionTaskResult taskResult) {
        if (state.isTerminal()) {
            return false;
        }
        state = TaskState.SUCCESS;
        step = ProgressStep.DONE;
        result = taskResult;
        touch();
        return true;
    }

    synchronized boolean fail(String reason) {
        if (state.isTerminal()) {
            return false;
        }
        state = TaskState.FAILURE;
        error = reason;
        touch();
        return true;
    }

    /**
     * Revokes a pending or running task.
     *
     * @return the state the task was in, or empty when it had already finished
     */
    synchronized Optional<TaskState> revoke() {
        if (state.isTerminal()) {
            return Optional.empty();
        }
        TaskState previous = state;
        state = TaskState.REVOKED;
        touch();
        if (future != null) {
            future.cancel(true);
        }
        return Optional.of(previous);
    }

    synchronized void attach(Future<?> taskFuture) {
        this.future = taskFuture;
        if (state == TaskState.REVOKED) {
            taskFuture.cancel(true);
        }
    }

    synchronized boolean isExpired(Instant now, Duration retention) {
        return state.isTerminal() && updatedAt.plus(retention).isBefore(now);
    }

    synchronized ExtractionTask snapshot() {
        return new ExtractionTask(id, state, step, step.percent(), result, error, createdAt, updatedAt);
    }

    private void touch() {
        updatedAt = clock.instant();
    }
}
