package fr.lapetina.mesh.coordinator.scheduler.exception;

import fr.lapetina.mesh.coordinator.domain.model.ErrorType;

/**
 * A task ended in FAILED and will not be retried: the worker reported an
 * unrecoverable error, or the deadline passed.
 */
public final class PermanentTaskFailureException extends RuntimeException {

    private final String taskId;
    private final ErrorType errorType;

    public PermanentTaskFailureException(String taskId, ErrorType errorType, String message) {
        super("Task " + taskId + " failed (" + errorType + "): " + message);
        this.taskId = taskId;
        this.errorType = errorType;
    }

    public String getTaskId() {
        return taskId;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
