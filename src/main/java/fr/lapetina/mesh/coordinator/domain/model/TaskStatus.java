package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Lifecycle state of a submitted task.
 */
public enum TaskStatus {
    /** Waiting for an eligible node (or for its backoff to elapse) */
    QUEUED,

    /** Slot reserved on a node, waiting in the dispatch ring */
    ASSIGNED,

    /** Dispatched to the node, awaiting the outcome */
    RUNNING,

    /** Worker reported success */
    SUCCEEDED,

    /** Permanent failure or deadline exceeded */
    FAILED,

    /** Retries exhausted */
    DEAD_LETTERED,

    /** Cancelled by the caller */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == DEAD_LETTERED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == ASSIGNED || this == RUNNING;
    }
}
