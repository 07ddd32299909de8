package fr.lapetina.mesh.coordinator.infrastructure.registry;

import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetrics;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportMessage;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health monitor for registered nodes.
 *
 * Each cycle probes every node, OFFLINE ones included so reconnection is
 * noticed, then sweeps: nodes without a heartbeat within the heartbeat timeout
 * step one status down, nodes that stayed OFFLINE past the TTL are expired, and old node
 * events and metric samples are pruned. A probe that fails or misses its
 * deadline counts as one miss.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final WorkerRegistry registry;
    private final Transport transport;
    private final ScheduledExecutorService scheduler;
    private final Duration probeInterval;
    private final Duration probeTimeout;
    private final Duration nodeTtl;
    private final Duration heartbeatTimeout;
    private final Duration eventRetention;
    private final Duration metricRetention;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthMonitor(
            WorkerRegistry registry,
            Transport transport,
            Duration probeInterval,
            Duration probeTimeout,
            Duration nodeTtl,
            Duration heartbeatTimeout,
            Duration eventRetention,
            Duration metricRetention
    ) {
        this.registry = registry;
        this.transport = transport;
        this.probeInterval = probeInterval;
        this.probeTimeout = probeTimeout;
        this.nodeTtl = nodeTtl;
        this.heartbeatTimeout = heartbeatTimeout;
        this.eventRetention = eventRetention;
        this.metricRetention = metricRetention;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic probe cycle.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    probeInterval.toMillis(),
                    probeInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started: interval={}, timeout={}, heartbeatTimeout={}, ttl={}",
                    probeInterval, probeTimeout, heartbeatTimeout, nodeTtl);
        }
    }

    private void runCycle() {
        try {
            probeAll().join();
            sweep();
        } catch (Exception e) {
            log.error("Health monitor cycle failed", e);
        }
    }

    /**
     * Probes every registered node once.
     *
     * @return completes when every probe has been recorded
     */
    public CompletableFuture<Void> probeAll() {
        List<Node> nodes = registry.getAllNodes();
        log.debug("Starting probe cycle: nodeCount={}", nodes.size());
        CompletableFuture<?>[] probes = nodes.stream()
                .map(this::probe)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(probes);
    }

    /**
     * Probes a single node. Never completes exceptionally.
     */
    public CompletableFuture<Void> probe(Node node) {
        CompletableFuture<TransportReply> reply;
        try {
            reply = transport.send(node, TransportMessage.probe(), probeTimeout);
        } catch (Exception e) {
            reply = CompletableFuture.failedFuture(e);
        }
        return reply
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, ex) -> {
                    record(node, response, ex);
                    return null;
                });
    }

    private void record(Node node, TransportReply reply, Throwable ex) {
        try {
            if (ex == null && reply.isSuccess()) {
                log.debug("Probe passed: nodeId={}, latencyMs={}", node.getId(), reply.latencyMs());
                registry.recordProbeSuccess(node.getId(), reply.latencyMs(), metricsFrom(reply.body()));
            } else {
                String reason = ex != null ? Transport.unwrap(ex).toString() : "HTTP " + reply.status();
                log.warn("Probe failed: nodeId={}, consecutiveMisses={}, status={}, reason={}",
                        node.getId(), node.getConsecutiveMisses() + 1, node.getStatus(), reason);
                registry.recordProbeFailure(node.getId());
            }
        } catch (UnknownNodeException e) {
            log.debug("Probe result dropped, node no longer registered: nodeId={}", node.getId());
        }
    }

    /**
     * Steps stale nodes one status down, expires nodes that have been OFFLINE past the
     * TTL, then prunes old node events and metric samples.
     *
     * @return ids of expired nodes
     */
    public List<String> sweep() {
        registry.markStale(heartbeatTimeout);
        List<String> expired = registry.expireOffline(nodeTtl);
        registry.pruneEvents(eventRetention);
        registry.pruneMetrics(metricRetention);
        return expired;
    }

    static NodeMetrics metricsFrom(Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        return new NodeMetrics(
                number(body.get("cpuPercent")),
                number(body.get("memoryPercent")),
                (int) number(body.get("activeTasks"))
        );
    }

    private static double number(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health monitor stopped");
        }
    }
}
