package fr.lapetina.mesh.coordinator.infrastructure.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP transport for node-to-node messages.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every request carries
 * the local node id and, when configured, a bearer credential.
 *
 * <pre>
 * PROBE     -> GET  {address}/health
 * DISPATCH  -> POST {address}/tasks/execute
 * ABORT     -> POST {address}/tasks/{taskId}/abort
 * CALL      -> POST {address}/services/{service}
 * REGISTER  -> POST {address}/nodes
 * HEARTBEAT -> POST {address}/nodes/{nodeId}/heartbeat
 * </pre>
 */
public class HttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String localNodeId;
    private final String authToken;

    public HttpTransport(String localNodeId, String authToken, Duration connectTimeout) {
        this.localNodeId = localNodeId;
        this.authToken = authToken;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public CompletableFuture<TransportReply> send(Node node, TransportMessage message, Duration timeout) {
        HttpRequest request;
        try {
            request = buildRequest(node, message, timeout);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: nodeId={}, type={}", node.getId(), message.type(), e);
            return CompletableFuture.failedFuture(e);
        }

        long start = System.nanoTime();
        log.debug("Sending message: nodeId={}, type={}, uri={}", node.getId(), message.type(), request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, ex) -> {
                    long latencyMs = (System.nanoTime() - start) / 1_000_000;
                    if (ex != null) {
                        throw classify(node, message, ex);
                    }
                    TransportReply reply = new TransportReply(response.statusCode(), parseBody(response.body()), latencyMs);
                    if (!reply.isSuccess()) {
                        log.warn("Node replied with error: nodeId={}, type={}, status={}, latencyMs={}",
                                node.getId(), message.type(), reply.status(), latencyMs);
                    }
                    return reply;
                });
    }

    private HttpRequest buildRequest(Node node, TransportMessage message, Duration timeout)
            throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uriFor(node, message))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Node-ID", localNodeId);
        if (authToken != null && !authToken.isBlank()) {
            builder.header("Authorization", "Bearer " + authToken);
        }
        if (message.correlationId() != null) {
            builder.header("X-Correlation-ID", message.correlationId());
        }
        if (message.type() == TransportMessage.Type.PROBE) {
            return builder.GET().build();
        }
        String body = objectMapper.writeValueAsString(message.body());
        return builder.POST(HttpRequest.BodyPublishers.ofString(body)).build();
    }

    static URI uriFor(Node node, TransportMessage message) {
        String base = node.getAddress().toString();
        if (!base.endsWith("/")) {
            base += "/";
        }
        String path = switch (message.type()) {
            case PROBE -> "health";
            case DISPATCH -> "tasks/execute";
            case ABORT -> "tasks/" + message.target() + "/abort";
            case CALL -> "services/" + message.target();
            case REGISTER -> "nodes";
            case HEARTBEAT -> "nodes/" + message.target() + "/heartbeat";
        };
        return URI.create(base + path);
    }

    private Map<String, Object> parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException e) {
            return Map.of("raw", body);
        }
    }

    private TransientNetworkException classify(Node node, TransportMessage message, Throwable ex) {
        Throwable cause = Transport.unwrap(ex);
        boolean timedOut = cause instanceof TimeoutException
                || cause instanceof java.net.http.HttpTimeoutException;
        if (timedOut) {
            log.warn("Message timed out: nodeId={}, type={}", node.getId(), message.type());
        } else {
            log.warn("Node unreachable: nodeId={}, type={}, errorType={}, error={}",
                    node.getId(), message.type(), cause.getClass().getSimpleName(), cause.getMessage());
        }
        return new TransientNetworkException(node.getId(),
                (timedOut ? "Timeout talking to " : "Cannot reach ") + node.getId() + ": " + cause.getMessage(),
                timedOut, cause);
    }
}
