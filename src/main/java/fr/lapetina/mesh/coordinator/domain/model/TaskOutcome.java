package fr.lapetina.mesh.coordinator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result reported by a worker for a dispatched task.
 */
public record TaskOutcome(Kind kind, Map<String, Object> result, String errorMessage) {

    public enum Kind {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public TaskOutcome {
        result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : Map.of();
    }

    public static TaskOutcome success(Map<String, Object> result) {
        return new TaskOutcome(Kind.SUCCESS, result, null);
    }

    public static TaskOutcome transientFailure(String message) {
        return new TaskOutcome(Kind.TRANSIENT_FAILURE, null, message);
    }

    public static TaskOutcome permanentFailure(String message) {
        return new TaskOutcome(Kind.PERMANENT_FAILURE, null, message);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
