package fr.lapetina.mesh.coordinator.scheduler;

import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.Task;
import fr.lapetina.mesh.coordinator.domain.model.TaskOutcome;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransientNetworkException;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportReply;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Reply (or failure) for one dispatch attempt.
 *
 * @param task      the dispatched task
 * @param node      node the slot was reserved on
 * @param attempt   attempt number the dispatch belongs to
 * @param reply     worker reply, null when {@code error} is set
 * @param error     unwrapped transport failure, null when a reply arrived
 * @param latencyMs round-trip time
 */
public record DispatchResult(Task task, Node node, int attempt, TransportReply reply, Throwable error, long latencyMs) {

    /**
     * True if the node answered without a server-side error. A worker that
     * reports a task failure in a 200 reply is still a healthy node.
     */
    public boolean nodeResponded() {
        return error == null && reply != null && reply.status() < 500;
    }

    /**
     * Classifies the reply.
     *
     * <ul>
     *   <li>no reply (network error, timeout): transient</li>
     *   <li>2xx: the {@code outcome} field of the body, SUCCESS when absent</li>
     *   <li>4xx other than 408/429: permanent</li>
     *   <li>anything else: transient</li>
     * </ul>
     */
    public TaskOutcome outcome() {
        if (error != null) {
            return TaskOutcome.transientFailure(describe(error));
        }
        if (reply == null) {
            return TaskOutcome.transientFailure("No reply");
        }
        if (reply.isSuccess()) {
            Object outcome = reply.body().get("outcome");
            String kind = outcome != null ? outcome.toString().toUpperCase() : TaskOutcome.Kind.SUCCESS.name();
            return switch (kind) {
                case "PERMANENT_FAILURE" -> TaskOutcome.permanentFailure(reply.errorMessage());
                case "TRANSIENT_FAILURE" -> TaskOutcome.transientFailure(reply.errorMessage());
                default -> TaskOutcome.success(resultOf(reply.body()));
            };
        }
        if (reply.isPermanentFailure()) {
            return TaskOutcome.permanentFailure(reply.errorMessage());
        }
        return TaskOutcome.transientFailure(reply.errorMessage());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> resultOf(Map<String, Object> body) {
        Object result = body.get("result");
        if (result instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) result).forEach((key, value) -> {
                if (value != null) {
                    copy.put(key, value);
                }
            });
            return copy;
        }
        return Map.of();
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Dispatch timed out";
        }
        if (error instanceof TransientNetworkException) {
            return error.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
