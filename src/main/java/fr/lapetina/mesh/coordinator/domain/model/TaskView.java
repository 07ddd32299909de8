package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a task returned by status reads.
 */
public record TaskView(
        String taskId,
        String idempotencyKey,
        String type,
        TaskStatus status,
        int priority,
        String assignedNode,
        int retryCount,
        Instant createdAt,
        Instant updatedAt,
        Instant deadline,
        Map<String, Object> result,
        ErrorType errorType,
        String errorMessage,
        String waitingReason
) {
}
