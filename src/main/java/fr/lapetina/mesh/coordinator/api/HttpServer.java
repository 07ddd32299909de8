package fr.lapetina.mesh.coordinator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.mesh.coordinator.CoordinatorFactory;
import fr.lapetina.mesh.coordinator.api.dto.HeartbeatRequest;
import fr.lapetina.mesh.coordinator.api.dto.NodeRequest;
import fr.lapetina.mesh.coordinator.api.dto.OfflineWriteRequest;
import fr.lapetina.mesh.coordinator.api.dto.ReviewDecisionRequest;
import fr.lapetina.mesh.coordinator.api.dto.TaskRequest;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeEvent;
import fr.lapetina.mesh.coordinator.domain.model.PendingReview;
import fr.lapetina.mesh.coordinator.domain.model.Route;
import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;
import fr.lapetina.mesh.coordinator.domain.model.RoutingPolicyType;
import fr.lapetina.mesh.coordinator.domain.model.TaskView;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.registry.DuplicateNodeException;
import fr.lapetina.mesh.coordinator.infrastructure.registry.UnknownNodeException;
import fr.lapetina.mesh.coordinator.infrastructure.transport.CircuitBreaker;
import fr.lapetina.mesh.coordinator.routing.UnknownRouteException;
import fr.lapetina.mesh.coordinator.scheduler.exception.BackpressureException;
import fr.lapetina.mesh.coordinator.sync.ConflictUnresolvedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /tasks - Submit a task
 * - GET /tasks/{id} - Task status
 * - POST /tasks/{id}/cancel - Cancel a task
 * - GET /tasks/dead-letter - Tasks that exhausted their retries
 * - GET /routes/{service}?policy= - Ordered endpoints for a service
 * - POST /offline/operations - Enqueue an offline write
 * - GET /offline/status - Drain status
 * - POST /offline/drain - Request a drain
 * - GET /sync/reviews - Open pending reviews
 * - POST /sync/reviews/{id}/resolve - Settle a review
 * - GET /nodes, POST /nodes, DELETE /nodes/{id} - Node registry
 * - POST /nodes/{id}/heartbeat, POST /nodes/{id}/disconnect, GET /nodes/{id}/events
 * - GET /nodes/{id}/metrics - Reported metric history
 * - GET /health - Health snapshot
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 * - POST /admin/recover - Re-run offline log recovery
 * - POST /admin/breakers/{nodeId}/reset - Close a node's circuit breaker
 *
 * Errors map to: backpressure 503, validation 400, unknown id 404,
 * conflicting state 409.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final CoordinatorFactory coordinator;

    public HttpServer(CoordinatorFactory coordinator) throws IOException {
        this(coordinator, coordinator.getConfig().getServer());
    }

    public HttpServer(CoordinatorFactory coordinator, CoordinatorConfig.ServerConfig serverConfig) throws IOException {
        this.coordinator = coordinator;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/tasks", new TaskHandler());
        server.createContext("/routes", new RouteHandler());
        server.createContext("/offline", new OfflineHandler());
        server.createContext("/sync", new SyncHandler());
        server.createContext("/nodes", new NodeHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured: host={}, port={}, workerThreads={}",
                serverConfig.getHost(), serverConfig.getPort(), serverConfig.getWorkerThreads());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== ROUTING BASE ====================

    /**
     * Dispatches on path and method and maps exceptions to status codes.
     */
    private abstract class RoutedHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod().toUpperCase();
            try {
                route(exchange, segments(path), method);
            } catch (BackpressureException e) {
                log.warn("Backpressure: path={}, reason={}", path, e.getReason());
                sendError(exchange, 503, e.getMessage());
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (UnknownNodeException | UnknownRouteException e) {
                sendError(exchange, 404, e.getMessage());
            } catch (DuplicateNodeException | ConflictUnresolvedException | IllegalStateException e) {
                sendError(exchange, 409, e.getMessage());
            } catch (Exception e) {
                log.error("Error handling request: method={}, path={}", method, path, e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        abstract void route(HttpExchange exchange, List<String> segments, String method) throws IOException;
    }

    // ==================== TASK HANDLER ====================

    private class TaskHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (segments.size() == 1 && "POST".equals(method)) {
                TaskRequest request = readBody(exchange, TaskRequest.class);
                String taskId = coordinator.getTaskDistributor().submit(request.toSubmission());
                sendJson(exchange, 202, Map.of("taskId", taskId));
            } else if (segments.size() == 2 && segments.get(1).equals("dead-letter") && "GET".equals(method)) {
                sendJson(exchange, 200, coordinator.getTaskDistributor().deadLetters());
            } else if (segments.size() == 2 && "GET".equals(method)) {
                sendOptional(exchange, coordinator.getTaskDistributor().getStatus(segments.get(1)),
                        "Task not found: " + segments.get(1));
            } else if (segments.size() == 3 && segments.get(2).equals("cancel") && "POST".equals(method)) {
                Optional<TaskView> cancelled = coordinator.getTaskDistributor().cancel(segments.get(1));
                sendOptional(exchange, cancelled, "Task not found: " + segments.get(1));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== ROUTE HANDLER ====================

    private class RouteHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (segments.size() != 2 || !"GET".equals(method)) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            String service = segments.get(1);
            String policyTag = queryParam(exchange, "policy");
            List<RouteCandidate> candidates = policyTag == null
                    ? coordinator.getRouter().resolve(service)
                    : coordinator.getRouter().resolve(service, RoutingPolicyType.fromTag(policyTag));

            RoutingPolicyType policy = policyTag == null
                    ? coordinator.getRouter().getRoute(service).map(Route::policy).orElse(RoutingPolicyType.LOCAL_FIRST)
                    : RoutingPolicyType.fromTag(policyTag);

            List<Map<String, Object>> endpoints = new ArrayList<>();
            for (RouteCandidate candidate : candidates) {
                Map<String, Object> endpoint = new LinkedHashMap<>();
                endpoint.put("nodeId", candidate.nodeId());
                endpoint.put("tier", candidate.tier().name());
                endpoint.put("cost", candidate.cost());
                coordinator.getRegistry().getNode(candidate.nodeId()).ifPresent(node -> {
                    endpoint.put("address", node.getAddress().toString());
                    endpoint.put("status", node.getStatus().name());
                });
                endpoints.add(endpoint);
            }
            sendJson(exchange, 200, Map.of(
                    "service", service,
                    "policy", policy.tag(),
                    "endpoints", endpoints
            ));
        }
    }

    // ==================== OFFLINE HANDLER ====================

    private class OfflineHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            String action = segments.size() == 2 ? segments.get(1) : "";
            if (action.equals("operations") && "POST".equals(method)) {
                OfflineWriteRequest request = readBody(exchange, OfflineWriteRequest.class);
                String operationId = coordinator.getOfflineQueue().enqueue(request.toWrite());
                sendJson(exchange, 202, Map.of("operationId", operationId));
            } else if (action.equals("status") && "GET".equals(method)) {
                sendJson(exchange, 200, coordinator.getOfflineQueue().drainStatus());
            } else if (action.equals("drain") && "POST".equals(method)) {
                coordinator.getOfflineQueue().requestDrain();
                sendJson(exchange, 202, Map.of("message", "Drain requested"));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== SYNC HANDLER ====================

    private class SyncHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (segments.size() == 2 && segments.get(1).equals("reviews") && "GET".equals(method)) {
                sendJson(exchange, 200, coordinator.getSyncEngine().pendingReviews());
            } else if (segments.size() == 4 && segments.get(1).equals("reviews")
                    && segments.get(3).equals("resolve") && "POST".equals(method)) {
                ReviewDecisionRequest request = readBody(exchange, ReviewDecisionRequest.class);
                Optional<PendingReview> settled = coordinator.getSyncEngine()
                        .resolveReview(segments.get(2), request.toDecision());
                sendOptional(exchange, settled, "Review not found: " + segments.get(2));
            } else if (segments.size() == 3 && segments.get(1).equals("entities") && "GET".equals(method)) {
                sendOptional(exchange, coordinator.getSyncEngine().getEntity(segments.get(2)),
                        "Entity not found: " + segments.get(2));
            } else if (segments.size() == 2 && segments.get(1).equals("resolutions") && "GET".equals(method)) {
                sendJson(exchange, 200, coordinator.getSyncEngine().recentResolutions());
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== NODE HANDLER ====================

    private class NodeHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (segments.size() == 1 && "GET".equals(method)) {
                List<Map<String, Object>> nodes = coordinator.getRegistry().getAllNodes().stream()
                        .map(HttpServer.this::nodeView)
                        .toList();
                sendJson(exchange, 200, nodes);
            } else if (segments.size() == 1 && "POST".equals(method)) {
                NodeRequest request = readBody(exchange, NodeRequest.class);
                Node node = coordinator.registerNode(request.toNode(coordinator.getRegistry().now()));
                sendJson(exchange, 201, nodeView(node));
            } else if (segments.size() == 2 && "DELETE".equals(method)) {
                Optional<Node> removed = coordinator.getRegistry().deregister(segments.get(1));
                sendOptional(exchange, removed.map(HttpServer.this::nodeView), "Node not found: " + segments.get(1));
            } else if (segments.size() == 3 && segments.get(2).equals("heartbeat") && "POST".equals(method)) {
                HeartbeatRequest request = readOptionalBody(exchange, HeartbeatRequest.class, new HeartbeatRequest());
                Node node = coordinator.getRegistry().heartbeat(segments.get(1), request.toMetrics());
                sendJson(exchange, 200, nodeView(node));
            } else if (segments.size() == 3 && segments.get(2).equals("disconnect") && "POST".equals(method)) {
                Node node = coordinator.getRegistry().hardDisconnect(segments.get(1));
                sendJson(exchange, 200, nodeView(node));
            } else if (segments.size() == 3 && segments.get(2).equals("events") && "GET".equals(method)) {
                String nodeId = segments.get(1);
                List<NodeEvent> events = coordinator.getRegistry().getEvents(nodeId);
                if (events.isEmpty() && coordinator.getRegistry().getNode(nodeId).isEmpty()) {
                    sendError(exchange, 404, "Node not found: " + nodeId);
                    return;
                }
                sendJson(exchange, 200, events);
            } else if (segments.size() == 3 && segments.get(2).equals("metrics") && "GET".equals(method)) {
                String nodeId = segments.get(1);
                if (coordinator.getRegistry().getNode(nodeId).isEmpty()) {
                    sendError(exchange, 404, "Node not found: " + nodeId);
                    return;
                }
                sendJson(exchange, 200, coordinator.getRegistry().getMetricHistory(nodeId));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Map<String, Object> health = coordinator.healthSnapshot();
            int statusCode = "DOWN".equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            // Refresh real-time gauges
            coordinator.getMetricsRegistry().setQueueDepth(coordinator.getTaskDistributor().queueSize());
            coordinator.getMetricsRegistry().setRingBufferRemaining(
                    (int) coordinator.getTaskDistributor().getRemainingDispatchCapacity());
            coordinator.getMetricsRegistry().setOfflinePending(coordinator.getOfflineQueue().pendingCount());

            String metrics = coordinator.getMetricsRegistry().scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler extends RoutedHandler {
        @Override
        void route(HttpExchange exchange, List<String> segments, String method) throws IOException {
            if (segments.size() == 2 && segments.get(1).equals("reload") && "POST".equals(method)) {
                CoordinatorConfig newConfig = coordinator.getConfigLoader().reload();
                sendJson(exchange, 200, Map.of(
                        "message", "Configuration reloaded",
                        "nodes", newConfig.getNodes().size(),
                        "routes", newConfig.getRoutes().size()
                ));
            } else if (segments.size() == 2 && segments.get(1).equals("recover") && "POST".equals(method)) {
                boolean recovered = coordinator.getOfflineQueue().recover();
                sendJson(exchange, recovered ? 200 : 409, coordinator.getOfflineQueue().drainStatus());
            } else if (segments.size() == 4 && segments.get(1).equals("breakers")
                    && segments.get(3).equals("reset") && "POST".equals(method)) {
                String nodeId = segments.get(2);
                if (coordinator.getRouter().resetBreaker(nodeId)) {
                    sendJson(exchange, 200, Map.of("nodeId", nodeId, "state", CircuitBreaker.State.CLOSED.name()));
                } else {
                    sendError(exchange, 404, "No circuit breaker for node: " + nodeId);
                }
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private Map<String, Object> nodeView(Node node) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", node.getId());
        info.put("role", node.getRole().name());
        info.put("address", node.getAddress().toString());
        info.put("capabilities", node.getCapabilities());
        info.put("status", node.getStatus().name());
        info.put("activeTasks", node.getActiveTasks());
        info.put("maxConcurrency", node.getMaxConcurrency());
        info.put("cost", node.getCost());
        info.put("consecutiveMisses", node.getConsecutiveMisses());
        info.put("lastHeartbeat", node.getLastHeartbeat());
        return info;
    }

    private static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                segments.add(URLDecoder.decode(part, StandardCharsets.UTF_8));
            }
        }
        return segments;
    }

    private static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (key.equals(name)) {
                return eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            if (bytes.length == 0) {
                throw new IllegalArgumentException("Request body is required");
            }
            return objectMapper.readValue(bytes, type);
        }
    }

    private <T> T readOptionalBody(HttpExchange exchange, Class<T> type, T fallback) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            return bytes.length == 0 ? fallback : objectMapper.readValue(bytes, type);
        }
    }

    private void sendOptional(HttpExchange exchange, Optional<?> body, String notFoundMessage) throws IOException {
        if (body.isPresent()) {
            sendJson(exchange, 200, body.get());
        } else {
            sendError(exchange, 404, notFoundMessage);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
