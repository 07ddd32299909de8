package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Work submitted by a caller. Immutable and thread-safe.
 *
 * @param payload opaque JSON object; null values are kept
 */
public record TaskSubmission(
        String idempotencyKey,
        String type,
        Map<String, Object> payload,
        Set<String> requiredCapabilities,
        int priority,
        Instant deadline
) {
    public TaskSubmission {
        Objects.requireNonNull(type, "Task type is required");
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            idempotencyKey = UUID.randomUUID().toString();
        }
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        requiredCapabilities = requiredCapabilities != null ? capabilities(requiredCapabilities) : Set.of();
    }

    private static Set<String> capabilities(Set<String> requested) {
        Set<String> copy = new LinkedHashSet<>();
        for (String capability : requested) {
            if (capability == null || capability.isBlank()) {
                throw new IllegalArgumentException("Required capabilities must not contain null or blank names");
            }
            copy.add(capability);
        }
        return Collections.unmodifiableSet(copy);
    }

    /**
     * Creates a submission with default priority and no deadline.
     */
    public static TaskSubmission of(String idempotencyKey, String type, Set<String> capabilities) {
        return new TaskSubmission(idempotencyKey, type, null, capabilities, 0, null);
    }

    public TaskSubmission withPriority(int newPriority) {
        return new TaskSubmission(idempotencyKey, type, payload, requiredCapabilities, newPriority, deadline);
    }

    public TaskSubmission withPayload(Map<String, Object> newPayload) {
        return new TaskSubmission(idempotencyKey, type, newPayload, requiredCapabilities, priority, deadline);
    }

    public TaskSubmission withDeadline(Instant newDeadline) {
        return new TaskSubmission(idempotencyKey, type, payload, requiredCapabilities, priority, newDeadline);
    }
}
