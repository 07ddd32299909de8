package fr.lapetina.mesh.coordinator.domain.event;

import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.Task;

import java.time.Instant;

/**
 * Event object for the dispatch ring buffer.
 *
 * Mutable and reused across the ring; cleared by the last stage. Anything
 * that outlives {@code onEvent} (the asynchronous reply callback) must copy
 * the fields it needs instead of keeping a reference to the event.
 */
public final class TaskDispatchEvent {

    private Task task;
    private Node node;
    private int attempt;
    private DispatchState state;
    private ErrorType errorType;
    private String errorMessage;
    private Instant publishedAt;
    private Instant dispatchedAt;

    public void clear() {
        this.task = null;
        this.node = null;
        this.attempt = 0;
        this.state = null;
        this.errorType = null;
        this.errorMessage = null;
        this.publishedAt = null;
        this.dispatchedAt = null;
    }

    public void initialize(Task task, Node node, int attempt, Instant now) {
        clear();
        this.task = task;
        this.node = node;
        this.attempt = attempt;
        this.state = DispatchState.CREATED;
        this.publishedAt = now;
    }

    public Task getTask() {
        return task;
    }

    public Node getNode() {
        return node;
    }

    public int getAttempt() {
        return attempt;
    }

    public DispatchState getState() {
        return state;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public void markDispatched(Instant now) {
        this.state = DispatchState.DISPATCHED;
        this.dispatchedAt = now;
    }

    public void markSkipped(String reason) {
        this.state = DispatchState.SKIPPED;
        this.errorMessage = reason;
    }

    public void markFailed(ErrorType type, String message) {
        this.state = DispatchState.FAILED;
        this.errorType = type;
        this.errorMessage = message;
    }

    @Override
    public String toString() {
        return "TaskDispatchEvent{" +
                "taskId=" + (task != null ? task.getId() : "null") +
                ", node=" + (node != null ? node.getId() : "null") +
                ", attempt=" + attempt +
                ", state=" + state +
                '}';
    }
}
