package fr.lapetina.mesh.coordinator.infrastructure.transport;

import java.util.Map;

/**
 * Reply received from a node.
 */
public record TransportReply(int status, Map<String, Object> body, long latencyMs) {

    public TransportReply {
        body = body != null ? body : Map.of();
    }

    public static TransportReply ok(Map<String, Object> body) {
        return new TransportReply(200, body, 0);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * 4xx other than 408 and 429: the request itself is wrong and retrying it elsewhere will not help.
     */
    public boolean isPermanentFailure() {
        return status >= 400 && status < 500 && status != 408 && status != 429;
    }

    public String errorMessage() {
        Object error = body.get("error");
        return error != null ? error.toString() : "HTTP " + status;
    }
}
