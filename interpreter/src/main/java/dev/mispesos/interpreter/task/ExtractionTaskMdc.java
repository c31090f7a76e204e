package dev.mispesos.interpreter.task;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context (MDC) entries so log lines emitted by a worker share the
 * task id and the current stage.
 */
final class ExtractionTaskMdc {

    static final String KEY_TASK_ID = "extraction.taskId";
    static final String KEY_STAGE = "extraction.stage";

    private ExtractionTaskMdc() {
        // Utility class
    }

    static Context open(String taskId) {
        return new Context(taskId);
    }

    static void setStage(String stage) {
        if (!StringUtils.hasText(stage)) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String taskId) {
            this.previous = MDC.getCopyOfContextMap();
            if (StringUtils.hasText(taskId)) {
                MDC.put(KEY_TASK_ID, taskId);
            } else {
                MDC.remove(KEY_TASK_ID);
            }
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
