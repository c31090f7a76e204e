package dev.mispesos.messaging;

/**
 * Lifecycle states of an extraction task.
 */
public enum TaskState {

    PENDING,
    PROGRESS,
    SUCCESS,
    FAILURE,
    REVOKED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }
}
