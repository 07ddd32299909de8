package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Error taxonomy for coordination failures.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Heartbeat miss, dispatch timeout, refused connection. Retried locally. */
    TRANSIENT_NETWORK,

    /** No eligible node or a full queue. Backpressure, not a failure. */
    CAPACITY_EXHAUSTED,

    /** Worker reported an unrecoverable error. Terminal, never retried. */
    PERMANENT_TASK_FAILURE,

    /** Concurrent edits with no safe automatic merge. Escalated to review. */
    CONFLICT_UNRESOLVED,

    /** Task deadline passed before it succeeded */
    DEADLINE_EXCEEDED,

    /** Node stayed offline past its TTL. Lifecycle event, leads to deregistration. */
    NODE_TTL_EXPIRED,

    /** Durable log or canonical store is unreadable. Needs an operator. */
    STORE_CORRUPTION,

    /** Invalid request */
    VALIDATION_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
