package fr.lapetina.mesh.coordinator.infrastructure.registry;

import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetrics;
import fr.lapetina.mesh.coordinator.domain.model.NodeRole;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportMessage;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Keeps this coordinator registered with a central registry.
 *
 * Registers on start, then sends a heartbeat with the local load every
 * interval. A heartbeat answered with 404 means the central registry has
 * forgotten this node; the next attempt registers again. A 409 on register
 * means it is already known and counts as registered. Failures are logged and
 * retried on the next cycle.
 */
public final class CentralRegistrar implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CentralRegistrar.class);

    static final String CENTRAL_NODE_ID = "central";

    private final Transport transport;
    private final Node central;
    private final Registration registration;
    private final Supplier<NodeMetrics> localMetrics;
    private final Duration heartbeatInterval;
    private final Duration requestTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean registered = new AtomicBoolean(false);

    /**
     * What the central registry is told about this node.
     */
    public record Registration(String nodeId, String url, NodeRole role, Set<String> capabilities,
                               int maxConcurrency, int cost) {

        Map<String, Object> toBody() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("id", nodeId);
            body.put("url", url);
            body.put("role", role.name());
            body.put("capabilities", new ArrayList<>(capabilities));
            body.put("maxConcurrency", maxConcurrency);
            body.put("cost", cost);
            return body;
        }
    }

    public CentralRegistrar(
            Transport transport,
            String centralUrl,
            Registration registration,
            Supplier<NodeMetrics> localMetrics,
            Duration heartbeatInterval,
            Duration requestTimeout
    ) {
        this.transport = transport;
        this.central = Node.builder()
                .id(CENTRAL_NODE_ID)
                .role(NodeRole.CLOUD)
                .address(centralUrl)
                .build();
        this.registration = registration;
        this.localMetrics = localMetrics;
        this.heartbeatInterval = heartbeatInterval;
        this.requestTimeout = requestTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "central-registrar");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers right away, then sends heartbeats every interval.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    heartbeatInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Central registration started: central={}, nodeId={}, interval={}",
                    central.getAddress(), registration.nodeId(), heartbeatInterval);
        }
    }

    private void runCycle() {
        try {
            beat().join();
        } catch (Exception e) {
            log.error("Central registration cycle failed", e);
        }
    }

    /**
     * One cycle: registers if not yet registered, otherwise sends a heartbeat.
     *
     * @return true if the central registry acknowledged this node
     */
    public CompletableFuture<Boolean> beat() {
        return registered.get() ? heartbeat() : register();
    }

    /**
     * Announces this node to the central registry. Never completes exceptionally.
     */
    public CompletableFuture<Boolean> register() {
        return send(TransportMessage.register(registration.toBody()))
                .thenApply(reply -> {
                    if (reply != null && (reply.isSuccess() || reply.status() == 409)) {
                        registered.set(true);
                        log.info("Registered with central registry: central={}, nodeId={}, status={}",
                                central.getAddress(), registration.nodeId(), reply.status());
                        return true;
                    }
                    log.warn("Central registration refused: central={}, nodeId={}, status={}",
                            central.getAddress(), registration.nodeId(), reply != null ? reply.status() : "unreachable");
                    return false;
                });
    }

    private CompletableFuture<Boolean> heartbeat() {
        NodeMetrics metrics = localMetrics.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cpuPercent", metrics.cpuPercent());
        body.put("memoryPercent", metrics.memoryPercent());
        body.put("activeTasks", metrics.reportedActiveTasks());
        return send(TransportMessage.heartbeat(registration.nodeId(), body))
                .thenApply(reply -> {
                    if (reply != null && reply.isSuccess()) {
                        log.debug("Heartbeat sent to central registry: nodeId={}", registration.nodeId());
                        return true;
                    }
                    if (reply != null && reply.status() == 404) {
                        registered.set(false);
                        log.warn("Central registry no longer knows this node, registering again: nodeId={}",
                                registration.nodeId());
                    } else {
                        log.warn("Heartbeat to central registry failed: nodeId={}, status={}",
                                registration.nodeId(), reply != null ? reply.status() : "unreachable");
                    }
                    return false;
                });
    }

    /**
     * Sends one message; an unreachable central registry completes with null.
     */
    private CompletableFuture<TransportReply> send(TransportMessage message) {
        CompletableFuture<TransportReply> reply;
        try {
            reply = transport.send(central, message, requestTimeout);
        } catch (Exception e) {
            reply = CompletableFuture.failedFuture(e);
        }
        return reply
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, ex) -> {
                    if (ex != null) {
                        log.warn("Central registry unreachable: central={}, type={}, reason={}",
                                central.getAddress(), message.type(), Transport.unwrap(ex).toString());
                        return null;
                    }
                    return response;
                });
    }

    public boolean isRegistered() {
        return registered.get();
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
            log.info("Central registration stopped");
        }
    }
}
