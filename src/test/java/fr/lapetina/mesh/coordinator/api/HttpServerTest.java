package fr.lapetina.mesh.coordinator.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.mesh.coordinator.domain.model.NodeRole;
import fr.lapetina.mesh.coordinator.domain.model.OfflineWrite;
import fr.lapetina.mesh.coordinator.domain.model.Route;
import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;
import fr.lapetina.mesh.coordinator.domain.model.RouteTier;
import fr.lapetina.mesh.coordinator.domain.model.RoutingPolicyType;
import fr.lapetina.mesh.coordinator.integration.TestCoordinatorFactory;
import fr.lapetina.mesh.coordinator.support.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> JSON_ARRAY = new TypeReference<>() {
    };

    @TempDir
    Path workDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    private TestCoordinatorFactory factory;
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        factory = TestCoordinatorFactory.create(workDir);
        server = new HttpServer(factory);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        return send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(publisher));
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE());
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws Exception {
        return client.send(builder.timeout(Duration.ofSeconds(5)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private Map<String, Object> object(HttpResponse<String> response) throws IOException {
        return mapper.readValue(response.body(), JSON_OBJECT);
    }

    private List<Map<String, Object>> array(HttpResponse<String> response) throws IOException {
        return mapper.readValue(response.body(), JSON_ARRAY);
    }

    @Nested
    @DisplayName("Tasks")
    class Tasks {

        @Test
        @DisplayName("should accept a task and expose its status")
        void shouldSubmitAndReadTask() throws Exception {
            HttpResponse<String> submitted = post("/tasks",
                    "{\"idempotencyKey\":\"k-1\",\"type\":\"index\",\"requiredCapabilities\":[\"cpu\"],\"priority\":3}");

            assertThat(submitted.statusCode()).isEqualTo(202);
            String taskId = (String) object(submitted).get("taskId");

            HttpResponse<String> status = get("/tasks/" + taskId);
            assertThat(status.statusCode()).isEqualTo(200);
            Map<String, Object> view = object(status);
            assertThat(view).containsEntry("taskId", taskId);
            assertThat(view).containsEntry("status", "QUEUED");
            assertThat(view).containsEntry("priority", 3);
        }

        @Test
        @DisplayName("should reject a task without a type")
        void shouldRejectMissingType() throws Exception {
            HttpResponse<String> response = post("/tasks", "{\"idempotencyKey\":\"k-2\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(object(response).get("error")).asString().contains("type");
        }

        @Test
        @DisplayName("should accept null payload values and reject a null capability")
        void shouldHandleJsonNulls() throws Exception {
            HttpResponse<String> accepted = post("/tasks",
                    "{\"idempotencyKey\":\"k-nulls\",\"type\":\"index\",\"payload\":{\"note\":null}}");
            HttpResponse<String> rejected = post("/tasks",
                    "{\"idempotencyKey\":\"k-null-cap\",\"type\":\"index\",\"requiredCapabilities\":[null]}");

            assertThat(accepted.statusCode()).isEqualTo(202);
            assertThat(rejected.statusCode()).isEqualTo(400);
            assertThat(object(rejected).get("error")).asString().contains("capabilities");
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            assertThat(post("/tasks", "{not json").statusCode()).isEqualTo(400);
            assertThat(post("/tasks", null).statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should cancel a queued task")
        void shouldCancelTask() throws Exception {
            String taskId = (String) object(post("/tasks",
                    "{\"idempotencyKey\":\"k-3\",\"type\":\"index\",\"requiredCapabilities\":[\"gpu\"]}")).get("taskId");

            HttpResponse<String> cancelled = post("/tasks/" + taskId + "/cancel", null);

            assertThat(cancelled.statusCode()).isEqualTo(200);
            assertThat(object(cancelled)).containsEntry("status", "CANCELLED");
        }

        @Test
        @DisplayName("should return 404 for an unknown task")
        void shouldReturnNotFoundForUnknownTask() throws Exception {
            assertThat(get("/tasks/missing").statusCode()).isEqualTo(404);
            assertThat(post("/tasks/missing/cancel", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should list dead-lettered tasks")
        void shouldListDeadLetters() throws Exception {
            HttpResponse<String> response = get("/tasks/dead-letter");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(array(response)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Nodes")
    class Nodes {

        @Test
        @DisplayName("should register, list and remove a node")
        void shouldManageNodes() throws Exception {
            HttpResponse<String> created = post("/nodes",
                    "{\"id\":\"edge-1\",\"url\":\"http://edge-1:9000\",\"capabilities\":[\"cpu\"],\"cost\":2}");

            assertThat(created.statusCode()).isEqualTo(201);
            assertThat(object(created)).containsEntry("id", "edge-1").containsEntry("status", "ONLINE")
                    .containsEntry("role", "EDGE").containsEntry("maxConcurrency", 4);

            assertThat(array(get("/nodes"))).extracting(node -> node.get("id")).containsExactly("edge-1");

            assertThat(delete("/nodes/edge-1").statusCode()).isEqualTo(200);
            assertThat(delete("/nodes/edge-1").statusCode()).isEqualTo(404);
            assertThat(array(get("/nodes"))).isEmpty();
        }

        @Test
        @DisplayName("should refuse a duplicate node id")
        void shouldRejectDuplicateNode() throws Exception {
            String body = "{\"id\":\"edge-1\",\"url\":\"http://edge-1:9000\"}";
            post("/nodes", body);

            assertThat(post("/nodes", body).statusCode()).isEqualTo(409);
        }

        @Test
        @DisplayName("should accept heartbeats with or without metrics")
        void shouldAcceptHeartbeat() throws Exception {
            factory.addNode("edge-1", NodeRole.EDGE);

            assertThat(post("/nodes/edge-1/heartbeat", null).statusCode()).isEqualTo(200);
            assertThat(post("/nodes/edge-1/heartbeat", "{\"cpuPercent\":42.5}").statusCode()).isEqualTo(200);
            assertThat(post("/nodes/ghost/heartbeat", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should list the metrics a node reported")
        void shouldListMetricHistory() throws Exception {
            factory.addNode("edge-1", NodeRole.EDGE);
            post("/nodes/edge-1/heartbeat", "{\"cpuPercent\":10.0}");
            post("/nodes/edge-1/heartbeat", "{\"cpuPercent\":42.5}");

            HttpResponse<String> response = get("/nodes/edge-1/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            List<Map<String, Object>> samples = array(response);
            assertThat(samples).hasSize(2);
            assertThat(samples.get(1)).containsEntry("nodeId", "edge-1");
            assertThat(get("/nodes/ghost/metrics").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should disconnect a node and record the transition")
        void shouldDisconnectNode() throws Exception {
            factory.addNode("edge-1", NodeRole.EDGE);

            HttpResponse<String> response = post("/nodes/edge-1/disconnect", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(object(response)).containsEntry("status", "OFFLINE");
            assertThat(array(get("/nodes/edge-1/events"))).isNotEmpty();
            assertThat(get("/nodes/ghost/events").statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("Routes")
    class Routes {

        @BeforeEach
        void addRoute() {
            factory.addNode("local-1", NodeRole.EDGE);
            factory.addNode("cloud-1", NodeRole.CLOUD);
            factory.getRouter().replaceRoutes(Map.of("search", new Route("search", List.of(
                    new RouteCandidate("local-1", RouteTier.LOCAL, 0),
                    new RouteCandidate("cloud-1", RouteTier.CLOUD, 5)
            ), RoutingPolicyType.LOCAL_FIRST)));
        }

        @Test
        @DisplayName("should list endpoints in policy order")
        void shouldResolveRoute() throws Exception {
            HttpResponse<String> response = get("/routes/search");

            assertThat(response.statusCode()).isEqualTo(200);
            Map<String, Object> body = object(response);
            assertThat(body).containsEntry("service", "search").containsEntry("policy", "local-first");
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> endpoints = (List<Map<String, Object>>) body.get("endpoints");
            assertThat(endpoints).extracting(e -> e.get("nodeId")).containsExactly("local-1", "cloud-1");
            assertThat(endpoints.get(0)).containsEntry("address", "http://local-1:9000");
        }

        @Test
        @DisplayName("should honour a policy override")
        void shouldOverridePolicy() throws Exception {
            Map<String, Object> body = object(get("/routes/search?policy=cost-optimized"));

            assertThat(body).containsEntry("policy", "cost-optimized");
        }

        @Test
        @DisplayName("should return 404 for an unknown service and 400 for an unknown policy")
        void shouldRejectBadRouteRequests() throws Exception {
            assertThat(get("/routes/billing").statusCode()).isEqualTo(404);
            assertThat(get("/routes/search?policy=cheapest").statusCode()).isEqualTo(400);
        }
    }

    @Nested
    @DisplayName("Offline queue and sync")
    class OfflineAndSync {

        @Test
        @DisplayName("should enqueue a write and expose the merged entity")
        void shouldEnqueueAndDrain() throws Exception {
            HttpResponse<String> accepted = post("/offline/operations",
                    "{\"entityId\":\"doc-1\",\"entityType\":\"document\",\"kind\":\"create\","
                            + "\"delta\":{\"title\":\"draft\"}}");

            assertThat(accepted.statusCode()).isEqualTo(202);
            assertThat(object(accepted)).containsEntry("operationId", "coordinator-test:1");

            Await.until(() -> factory.getSyncEngine().getEntity("doc-1").isPresent());
            HttpResponse<String> entity = get("/sync/entities/doc-1");
            assertThat(entity.statusCode()).isEqualTo(200);
            assertThat(object(entity)).containsEntry("id", "doc-1");

            assertThat(array(get("/sync/resolutions"))).isNotEmpty();
            assertThat(get("/sync/entities/doc-404").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should reject a forwarded write that skips a sequence")
        void shouldRejectSequenceGap() throws Exception {
            HttpResponse<String> response = post("/offline/operations",
                    "{\"originNode\":\"edge-1\",\"sequence\":3,\"entityId\":\"doc-1\",\"kind\":\"UPDATE\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(object(response).get("error")).asString().contains("expected 1 but got 3");
        }

        @Test
        @DisplayName("should reject a forwarded write with a negative timestamp")
        void shouldRejectNegativeLamport() throws Exception {
            HttpResponse<String> response = post("/offline/operations",
                    "{\"originNode\":\"edge-1\",\"sequence\":1,\"entityId\":\"doc-1\",\"kind\":\"UPDATE\","
                            + "\"lamport\":-1}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(object(response).get("error")).asString().contains("negative");
            assertThat(object(get("/offline/status"))).containsEntry("pending", 0);
        }

        @Test
        @DisplayName("should report drain status and accept drain requests")
        void shouldReportStatus() throws Exception {
            HttpResponse<String> status = get("/offline/status");

            assertThat(status.statusCode()).isEqualTo(200);
            assertThat(object(status)).containsEntry("pending", 0).containsEntry("halted", false);
            assertThat(post("/offline/drain", null).statusCode()).isEqualTo(202);
        }

        @Test
        @DisplayName("should open a review for a delete racing an update and settle it")
        void shouldResolveReview() throws Exception {
            factory.getOfflineQueue().enqueue(OfflineWrite.create("doc-1", "document", Map.of("title", "local")));
            Await.until(() -> factory.getSyncEngine().getEntity("doc-1").isPresent());

            post("/offline/operations",
                    "{\"originNode\":\"edge-1\",\"sequence\":1,\"entityId\":\"doc-1\",\"kind\":\"delete\"}");
            Await.until(() -> !factory.getSyncEngine().pendingReviews().isEmpty());

            List<Map<String, Object>> reviews = array(get("/sync/reviews"));
            assertThat(reviews).hasSize(1);
            assertThat(reviews.get(0)).containsEntry("id", "edge-1:1")
                    .containsEntry("reason", "DELETE_UPDATE_CONFLICT");

            HttpResponse<String> settled = post("/sync/reviews/edge-1:1/resolve", "{\"decision\":\"keep-canonical\"}");
            assertThat(settled.statusCode()).isEqualTo(200);
            assertThat(object(settled)).containsEntry("decision", "KEEP_CANONICAL");

            assertThat(post("/sync/reviews/edge-1:1/resolve", "{\"decision\":\"apply-incoming\"}").statusCode())
                    .isEqualTo(409);
            assertThat(post("/sync/reviews/unknown:1/resolve", "{\"decision\":\"keep-canonical\"}").statusCode())
                    .isEqualTo(404);
            assertThat(array(get("/sync/reviews"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Operations")
    class Operations {

        @Test
        @DisplayName("should report DOWN with 503 until a node is online")
        void shouldReportHealth() throws Exception {
            assertThat(get("/health").statusCode()).isEqualTo(503);

            factory.addNode("edge-1", NodeRole.EDGE);
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(object(response)).containsEntry("status", "UP").containsEntry("nodeId", "coordinator-test");
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/plain"));
            assertThat(response.body()).contains("_queue_depth");
        }

        @Test
        @DisplayName("should reload configuration and re-run recovery")
        void shouldRunAdminActions() throws Exception {
            HttpResponse<String> reloaded = post("/admin/reload", null);
            assertThat(reloaded.statusCode()).isEqualTo(200);
            assertThat(object(reloaded)).containsEntry("message", "Configuration reloaded");

            HttpResponse<String> recovered = post("/admin/recover", null);
            assertThat(recovered.statusCode()).isEqualTo(200);
            assertThat(object(recovered)).containsEntry("halted", false);
        }

        @Test
        @DisplayName("should close a circuit breaker on operator request")
        void shouldResetBreaker() throws Exception {
            factory.addNode("edge-1", NodeRole.EDGE);
            factory.getRouter().breakerFor("edge-1").recordFailure();

            HttpResponse<String> health = get("/health");
            assertThat((List<?>) object(health).get("circuitBreakers")).hasSize(1);

            HttpResponse<String> reset = post("/admin/breakers/edge-1/reset", null);

            assertThat(reset.statusCode()).isEqualTo(200);
            assertThat(object(reset)).containsEntry("state", "CLOSED");
            assertThat(factory.getRouter().breakerFor("edge-1").getConsecutiveFailures()).isZero();
            assertThat(post("/admin/breakers/edge-9/reset", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should return 404 for unknown paths")
        void shouldReturnNotFound() throws Exception {
            assertThat(get("/tasks/a/b/c").statusCode()).isEqualTo(404);
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }
    }
}
