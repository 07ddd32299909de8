package fr.lapetina.mesh.coordinator.infrastructure.registry;

import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeEvent;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetrics;
import fr.lapetina.mesh.coordinator.domain.model.NodeRole;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerRegistryTest {

    private MutableClock clock;
    private WorkerRegistry registry;
    private List<WorkerRegistry.RegistryEvent> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new WorkerRegistry(clock, 3, 5, 0.8);
        events = new ArrayList<>();
        registry.addListener(events::add);
    }

    private Node node(String id, int maxConcurrency, String... capabilities) {
        return Node.builder()
                .id(id)
                .address("http://" + id + ":8080")
                .role(NodeRole.EDGE)
                .capabilities(Set.of(capabilities))
                .maxConcurrency(maxConcurrency)
                .registeredAt(clock.instant())
                .build();
    }

    @Test
    @DisplayName("should reject an offline threshold not above the degraded threshold")
    void shouldValidateThresholds() {
        assertThatThrownBy(() -> new WorkerRegistry(clock, 3, 3, 0.8))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should register a node as ONLINE and notify listeners")
        void shouldRegisterOnline() {
            registry.register(node("edge-1", 2));

            assertThat(registry.status("edge-1")).contains(NodeStatus.ONLINE);
            assertThat(events).singleElement()
                    .satisfies(e -> assertThat(e.type()).isEqualTo(NodeEvent.Type.REGISTERED));
            assertThat(registry.getEvents("edge-1")).extracting(NodeEvent::type)
                    .containsExactly(NodeEvent.Type.REGISTERED);
        }

        @Test
        @DisplayName("should refuse a duplicate id")
        void shouldRefuseDuplicate() {
            registry.register(node("edge-1", 2));

            assertThatThrownBy(() -> registry.register(node("edge-1", 4)))
                    .isInstanceOf(DuplicateNodeException.class);
            assertThat(registry.getNode("edge-1").get().getMaxConcurrency()).isEqualTo(2);
        }

        @Test
        @DisplayName("should throw for heartbeats of unknown nodes")
        void shouldThrowForUnknownHeartbeat() {
            assertThatThrownBy(() -> registry.heartbeat("ghost", NodeMetrics.empty()))
                    .isInstanceOf(UnknownNodeException.class);
        }

        @Test
        @DisplayName("should deregister and record the event")
        void shouldDeregister() {
            registry.register(node("edge-1", 2));

            assertThat(registry.deregister("edge-1")).isPresent();
            assertThat(registry.getNode("edge-1")).isEmpty();
            assertThat(registry.deregister("edge-1")).isEmpty();
            assertThat(events).extracting(WorkerRegistry.RegistryEvent::type)
                    .containsExactly(NodeEvent.Type.REGISTERED, NodeEvent.Type.DEREGISTERED);
        }
    }

    @Nested
    @DisplayName("Health transitions")
    class HealthTransitions {

        @BeforeEach
        void register() {
            registry.register(node("edge-1", 2));
            events.clear();
        }

        @Test
        @DisplayName("should go DEGRADED after 3 misses and OFFLINE after 5")
        void shouldFollowMissThresholds() {
            registry.recordMiss("edge-1");
            registry.recordMiss("edge-1");
            assertThat(registry.status("edge-1")).contains(NodeStatus.ONLINE);

            registry.recordMiss("edge-1");
            assertThat(registry.status("edge-1")).contains(NodeStatus.DEGRADED);

            registry.recordMiss("edge-1");
            registry.recordMiss("edge-1");
            assertThat(registry.status("edge-1")).contains(NodeStatus.OFFLINE);

            assertThat(events).extracting(WorkerRegistry.RegistryEvent::to)
                    .containsExactly(NodeStatus.DEGRADED, NodeStatus.OFFLINE);
            assertThat(events.get(1).wentOffline()).isTrue();
        }

        @Test
        @DisplayName("should emit RECONNECTED when an offline node heartbeats")
        void shouldEmitReconnected() {
            registry.hardDisconnect("edge-1");
            events.clear();

            registry.heartbeat("edge-1", new NodeMetrics(5, 10, 0));

            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.isReconnect()).isTrue();
                assertThat(e.type()).isEqualTo(NodeEvent.Type.RECONNECTED);
            });
            assertThat(registry.getEvents("edge-1")).extracting(NodeEvent::type)
                    .contains(NodeEvent.Type.RECONNECTED);
        }

        @Test
        @DisplayName("should restore ONLINE from DEGRADED on a heartbeat without reconnect")
        void shouldRestoreFromDegraded() {
            registry.markDegraded("edge-1");
            events.clear();

            registry.heartbeat("edge-1", null);

            assertThat(registry.status("edge-1")).contains(NodeStatus.ONLINE);
            assertThat(events).singleElement().satisfies(e -> assertThat(e.isReconnect()).isFalse());
        }

        @Test
        @DisplayName("should skip DEGRADED only on an explicit hard disconnect")
        void shouldHardDisconnect() {
            registry.hardDisconnect("edge-1");

            assertThat(registry.status("edge-1")).contains(NodeStatus.OFFLINE);
            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.from()).isEqualTo(NodeStatus.ONLINE);
                assertThat(e.to()).isEqualTo(NodeStatus.OFFLINE);
            });
        }

        @Test
        @DisplayName("should fold probe outcomes into the health record")
        void shouldTrackHealthRecord() {
            registry.recordProbeSuccess("edge-1", 40, null);
            assertThat(registry.health("edge-1").latencyMs()).isEqualTo(40.0);
            assertThat(registry.isHealthy("edge-1")).isTrue();

            registry.recordProbeFailure("edge-1");
            assertThat(registry.health("edge-1").successRate()).isLessThan(0.8);
            assertThat(registry.isHealthy("edge-1")).isFalse();
            assertThat(registry.getNode("edge-1").get().getConsecutiveMisses()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("should list eligible nodes least loaded first")
        void shouldOrderByLoad() {
            Node busy = registry.register(node("busy", 2, "gpu"));
            registry.register(node("idle", 4, "gpu"));
            registry.register(node("cpu-only", 4));
            busy.tryReserve(Set.of());

            assertThat(registry.getEligibleNodes(Set.of("gpu"))).extracting(Node::getId)
                    .containsExactly("idle", "busy");
            assertThat(registry.hasCapableNode(Set.of("tpu"))).isFalse();
        }

        @Test
        @DisplayName("should exclude non-ONLINE nodes")
        void shouldExcludeDegraded() {
            registry.register(node("edge-1", 2));
            registry.markDegraded("edge-1");

            assertThat(registry.getEligibleNodes(Set.of())).isEmpty();
            assertThat(registry.hasCapableNode(Set.of())).isTrue();
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("should expire nodes offline past the TTL")
        void shouldExpireOfflineNodes() {
            registry.register(node("edge-1", 2));
            registry.register(node("edge-2", 2));
            registry.hardDisconnect("edge-1");

            clock.advance(Duration.ofMinutes(11));

            assertThat(registry.expireOffline(Duration.ofMinutes(10))).containsExactly("edge-1");
            assertThat(registry.getNode("edge-1")).isEmpty();
            assertThat(registry.getNode("edge-2")).isPresent();
            assertThat(events).extracting(WorkerRegistry.RegistryEvent::type).contains(NodeEvent.Type.EXPIRED);
        }

        @Test
        @DisplayName("should prune events older than the retention")
        void shouldPruneEvents() {
            registry.register(node("edge-1", 2));
            clock.advance(Duration.ofHours(2));
            registry.hardDisconnect("edge-1");

            int removed = registry.pruneEvents(Duration.ofHours(1));

            assertThat(removed).isEqualTo(1);
            assertThat(registry.getEvents("edge-1")).extracting(NodeEvent::type)
                    .containsExactly(NodeEvent.Type.STATUS_CHANGED);
        }
    }

    @Nested
    @DisplayName("Heartbeat staleness")
    class Staleness {

        @Test
        @DisplayName("should step a node whose last heartbeat is too old down to offline, one status per sweep")
        void shouldMarkStaleNodeOffline() {
            registry.register(node("edge-1", 2));
            registry.register(node("edge-2", 2));
            clock.advance(Duration.ofMinutes(4));
            registry.heartbeat("edge-2", null);
            clock.advance(Duration.ofMinutes(2));

            assertThat(registry.markStale(Duration.ofMinutes(5))).containsExactly("edge-1");
            assertThat(registry.status("edge-1")).contains(NodeStatus.DEGRADED);

            assertThat(registry.markStale(Duration.ofMinutes(5))).containsExactly("edge-1");

            assertThat(registry.status("edge-1")).contains(NodeStatus.OFFLINE);
            assertThat(registry.status("edge-2")).contains(NodeStatus.ONLINE);
            assertThat(registry.getNode("edge-1").get().getOfflineSince()).isEqualTo(clock.instant());
            assertThat(events).filteredOn(WorkerRegistry.RegistryEvent::wentOffline)
                    .extracting(event -> event.node().getId())
                    .containsExactly("edge-1");
        }

        @Test
        @DisplayName("should judge a node that never sent a heartbeat by its registration time")
        void shouldUseRegistrationTime() {
            clock.advance(Duration.ofMinutes(3));
            registry.register(node("edge-1", 2));
            clock.advance(Duration.ofMinutes(4));

            assertThat(registry.markStale(Duration.ofMinutes(5))).isEmpty();

            clock.advance(Duration.ofMinutes(2));

            assertThat(registry.markStale(Duration.ofMinutes(5))).containsExactly("edge-1");
        }

        @Test
        @DisplayName("should leave nodes that are already offline alone")
        void shouldIgnoreOfflineNodes() {
            registry.register(node("edge-1", 2));
            registry.hardDisconnect("edge-1");
            Instant offlineSince = registry.getNode("edge-1").get().getOfflineSince();
            clock.advance(Duration.ofMinutes(10));

            assertThat(registry.markStale(Duration.ofMinutes(5))).isEmpty();
            assertThat(registry.getNode("edge-1").get().getOfflineSince()).isEqualTo(offlineSince);
        }

        @Test
        @DisplayName("should bring a stale node back with its next heartbeat")
        void shouldReconnectOnHeartbeat() {
            registry.register(node("edge-1", 2));
            clock.advance(Duration.ofMinutes(6));
            registry.markStale(Duration.ofMinutes(5));
            registry.markStale(Duration.ofMinutes(5));

            registry.heartbeat("edge-1", NodeMetrics.empty());

            assertThat(registry.status("edge-1")).contains(NodeStatus.ONLINE);
            assertThat(events).extracting(WorkerRegistry.RegistryEvent::type).contains(NodeEvent.Type.RECONNECTED);
        }
    }

    @Nested
    @DisplayName("Metric history")
    class MetricHistory {

        @Test
        @DisplayName("should keep every reported sample in order")
        void shouldRecordSamples() {
            registry.register(node("edge-1", 2));
            registry.heartbeat("edge-1", new NodeMetrics(10.0, 20.0, 1));
            clock.advance(Duration.ofSeconds(30));
            registry.heartbeat("edge-1", new NodeMetrics(30.0, 40.0, 2));
            registry.heartbeat("edge-1", null);

            assertThat(registry.getMetricHistory("edge-1"))
                    .extracting(sample -> sample.metrics().cpuPercent())
                    .containsExactly(10.0, 30.0);
            assertThat(registry.getMetricHistory("edge-1").get(1).recordedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should prune samples older than the retention")
        void shouldPruneMetrics() {
            registry.register(node("edge-1", 2));
            registry.heartbeat("edge-1", new NodeMetrics(10.0, 20.0, 1));
            clock.advance(Duration.ofDays(8));
            registry.heartbeat("edge-1", new NodeMetrics(30.0, 40.0, 2));

            int removed = registry.pruneMetrics(Duration.ofDays(7));

            assertThat(removed).isEqualTo(1);
            assertThat(registry.getMetricHistory("edge-1"))
                    .extracting(sample -> sample.metrics().cpuPercent())
                    .containsExactly(30.0);
        }

        @Test
        @DisplayName("should drop the oldest samples past the per-node cap")
        void shouldCapHistory() {
            registry.register(node("edge-1", 2));
            for (int i = 0; i <= WorkerRegistry.MAX_METRIC_SAMPLES; i++) {
                registry.heartbeat("edge-1", new NodeMetrics(i, 0.0, 0));
            }

            assertThat(registry.getMetricHistory("edge-1")).hasSize(WorkerRegistry.MAX_METRIC_SAMPLES);
            assertThat(registry.getMetricHistory("edge-1").get(0).metrics().cpuPercent()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should forget the history of a removed node")
        void shouldDropHistoryOnRemoval() {
            registry.register(node("edge-1", 2));
            registry.heartbeat("edge-1", NodeMetrics.empty());

            registry.deregister("edge-1");

            assertThat(registry.getMetricHistory("edge-1")).isEmpty();
        }
    }
}
