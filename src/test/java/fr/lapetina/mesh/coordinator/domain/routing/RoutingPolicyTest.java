package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.HealthRecord;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;
import fr.lapetina.mesh.coordinator.domain.model.RouteTier;
import fr.lapetina.mesh.coordinator.domain.model.RoutingPolicyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingPolicyTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private List<RouteCandidate> template;
    private FakeHealth health;

    @BeforeEach
    void setUp() {
        template = List.of(
                new RouteCandidate("local", RouteTier.LOCAL, 0),
                new RouteCandidate("edge", RouteTier.EDGE, 1),
                new RouteCandidate("cloud", RouteTier.CLOUD, 5)
        );
        health = new FakeHealth();
        template.forEach(c -> health.set(c.nodeId(), NodeStatus.ONLINE, HealthRecord.initial(c.nodeId())));
    }

    private static List<String> ids(List<RouteCandidate> candidates) {
        return candidates.stream().map(RouteCandidate::nodeId).toList();
    }

    @Nested
    @DisplayName("LocalFirstPolicy")
    class LocalFirst {

        private final RoutingPolicy policy = new LocalFirstPolicy();

        @Test
        @DisplayName("should keep template order when everything is healthy")
        void shouldKeepTemplateOrder() {
            assertThat(ids(policy.order(template, health))).containsExactly("local", "edge", "cloud");
        }

        @Test
        @DisplayName("should move an unhealthy local candidate behind healthy ones")
        void shouldDemoteUnhealthyLocal() {
            health.set("local", NodeStatus.DEGRADED, HealthRecord.initial("local"));

            assertThat(ids(policy.order(template, health))).containsExactly("edge", "local", "cloud");
        }

        @Test
        @DisplayName("should not mutate the input list")
        void shouldReturnNewList() {
            List<RouteCandidate> ordered = policy.order(template, health);

            assertThat(ordered).isNotSameAs(template);
        }
    }

    @Nested
    @DisplayName("PerformanceBasedPolicy")
    class PerformanceBased {

        private final RoutingPolicy policy = new PerformanceBasedPolicy();

        @Test
        @DisplayName("should prefer the lowest observed latency")
        void shouldPreferLowestLatency() {
            health.set("local", NodeStatus.ONLINE, HealthRecord.initial("local").withSuccess(80, NOW));
            health.set("edge", NodeStatus.ONLINE, HealthRecord.initial("edge").withSuccess(40, NOW));
            health.set("cloud", NodeStatus.ONLINE, HealthRecord.initial("cloud").withSuccess(10, NOW));

            assertThat(ids(policy.order(template, health))).containsExactly("cloud", "edge", "local");
        }

        @Test
        @DisplayName("should put candidates without samples last")
        void shouldPutUnsampledLast() {
            health.set("cloud", NodeStatus.ONLINE, HealthRecord.initial("cloud").withSuccess(500, NOW));

            assertThat(ids(policy.order(template, health))).containsExactly("cloud", "local", "edge");
        }
    }

    @Nested
    @DisplayName("CostOptimizedPolicy")
    class CostOptimized {

        @Test
        @DisplayName("should order by cost and keep template order for ties")
        void shouldOrderByCost() {
            List<RouteCandidate> candidates = List.of(
                    new RouteCandidate("cloud", RouteTier.CLOUD, 5),
                    new RouteCandidate("edge-b", RouteTier.EDGE, 1),
                    new RouteCandidate("edge-a", RouteTier.EDGE, 1)
            );

            assertThat(ids(new CostOptimizedPolicy().order(candidates, health)))
                    .containsExactly("edge-b", "edge-a", "cloud");
        }
    }

    @Nested
    @DisplayName("PolicyFactory")
    class Factory {

        @Test
        @DisplayName("should create policies by tag or enum name")
        void shouldCreateByName() {
            assertThat(PolicyFactory.create("local-first")).get().isInstanceOf(LocalFirstPolicy.class);
            assertThat(PolicyFactory.create("PERFORMANCE_BASED")).get().isInstanceOf(PerformanceBasedPolicy.class);
            assertThat(PolicyFactory.create(RoutingPolicyType.COST_OPTIMIZED)).isInstanceOf(CostOptimizedPolicy.class);
        }

        @Test
        @DisplayName("should return empty for unknown names")
        void shouldReturnEmptyForUnknown() {
            assertThat(PolicyFactory.create("random")).isEmpty();
            assertThat(PolicyFactory.create((String) null)).isEmpty();
        }
    }

    private static final class FakeHealth implements HealthView {

        private final Map<String, NodeStatus> statuses = new HashMap<>();
        private final Map<String, HealthRecord> records = new HashMap<>();

        void set(String nodeId, NodeStatus status, HealthRecord record) {
            statuses.put(nodeId, status);
            records.put(nodeId, record);
        }

        @Override
        public Optional<NodeStatus> status(String nodeId) {
            return Optional.ofNullable(statuses.get(nodeId));
        }

        @Override
        public HealthRecord health(String nodeId) {
            return records.getOrDefault(nodeId, HealthRecord.initial(nodeId));
        }

        @Override
        public boolean isHealthy(String nodeId) {
            return statuses.get(nodeId) == NodeStatus.ONLINE && health(nodeId).successRate() >= 0.8;
        }
    }
}
