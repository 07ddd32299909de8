package fr.lapetina.mesh.coordinator.infrastructure.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message sent to a node.
 *
 * @param type          message kind, decides the HTTP method and path
 * @param target        task id for DISPATCH and ABORT, service name for CALL,
 *                      registering node id for HEARTBEAT
 * @param correlationId propagated for tracing
 * @param body          JSON body, empty for PROBE and ABORT
 */
public record TransportMessage(Type type, String target, String correlationId, Map<String, Object> body) {

    public enum Type {
        PROBE,
        DISPATCH,
        ABORT,
        CALL,
        REGISTER,
        HEARTBEAT
    }

    public TransportMessage {
        Objects.requireNonNull(type, "Message type is required");
        body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Map.of();
    }

    public static TransportMessage probe() {
        return new TransportMessage(Type.PROBE, null, null, Map.of());
    }

    public static TransportMessage dispatch(String taskId, Map<String, Object> body) {
        return new TransportMessage(Type.DISPATCH, taskId, taskId, body);
    }

    public static TransportMessage abort(String taskId) {
        return new TransportMessage(Type.ABORT, taskId, taskId, Map.of());
    }

    public static TransportMessage call(String service, String correlationId, Map<String, Object> body) {
        return new TransportMessage(Type.CALL, service, correlationId, body);
    }

    public static TransportMessage register(Map<String, Object> body) {
        return new TransportMessage(Type.REGISTER, null, null, body);
    }

    public static TransportMessage heartbeat(String nodeId, Map<String, Object> body) {
        return new TransportMessage(Type.HEARTBEAT, nodeId, null, body);
    }
}
