package fr.lapetina.mesh.coordinator.scheduler.exception;

/**
 * Exception thrown when the coordinator is under backpressure.
 *
 * This occurs when:
 * - The task queue is at capacity
 * - The dispatch ring buffer is full
 * - The offline log holds the maximum number of pending operations
 *
 * Callers are expected to retry later. It is never a task failure.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        QUEUE_FULL("Task queue is full"),
        DISPATCH_BUFFER_FULL("Dispatch ring buffer is full"),
        OFFLINE_LOG_FULL("Offline log reached its pending operation limit");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
