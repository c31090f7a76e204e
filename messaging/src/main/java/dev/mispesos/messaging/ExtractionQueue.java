package dev.mispesos.messaging;

import java.util.Optional;

/**
 * Capability interface for running image extraction jobs out of band. Any queue or broker
 * can implement it; callers only ever hold task ids.
 */
public interface ExtractionQueue {

    /**
     * Enqueue a job. Returns as soon as the job is accepted; it does not wait for the
     * extraction to run.
     *
     * @return the id used to poll or cancel the task
     */
    String submit(ExtractionJobMessage message);

    /**
     * @return the current snapshot of the task, or empty when the id is unknown or expired
     */
    Optional<ExtractionTask> poll(String taskId);

    /**
     * Best-effort cancellation. Queued jobs never start; running jobs stop at the next step
     * boundary.
     *
     * @return {@code true} when the task was pending or running and is now revoked,
     *     {@code false} for finished or unknown tasks
     */
    boolean cancel(String taskId);
}
