package fr.lapetina.mesh.coordinator.infrastructure.metrics;

import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.ResolutionStrategy;
import fr.lapetina.mesh.coordinator.domain.model.TaskStatus;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Task throughput by type and terminal status
 * - Dispatch latency histograms per node
 * - Routing attempt counters per service and node
 * - Conflict resolution counters by strategy
 * - Queue, ring buffer and offline log gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> dispatchTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> taskCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> routeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> resolutionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> nodeGauges = new ConcurrentHashMap<>();

    private final AtomicInteger queueDepth = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final AtomicInteger onlineNodes = new AtomicInteger(0);
    private final AtomicInteger offlinePending = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_task_queue_depth", queueDepth, AtomicInteger::get)
                .description("Tasks waiting in the scheduler queue")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the dispatch ring buffer")
                .register(registry);

        Gauge.builder(prefix + "_online_nodes", onlineNodes, AtomicInteger::get)
                .description("Number of ONLINE nodes")
                .register(registry);

        Gauge.builder(prefix + "_offline_pending_operations", offlinePending, AtomicInteger::get)
                .description("Offline operations waiting to be synchronized")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}", prefix);
    }

    public MetricsRegistry() {
        this("mesh");
    }

    /**
     * Counts a task reaching a status.
     */
    public void incrementTaskCount(String taskType, TaskStatus status) {
        String key = taskType + ":" + status.name();
        taskCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_tasks_total")
                        .description("Tasks by type and status")
                        .tag("type", taskType)
                        .tag("status", status.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records round-trip time of a dispatch to a node.
     */
    public void recordDispatchLatency(String nodeId, Duration latency) {
        dispatchTimers.computeIfAbsent(nodeId, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("Task dispatch latency")
                        .tag("node", nodeId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records stage-specific latency (dispatch, completion, drain, ...).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(String component, ErrorType errorType) {
        String key = component + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("component", component)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a routing attempt against one candidate.
     */
    public void incrementRouteAttempt(String service, String nodeId, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = service + ":" + nodeId + ":" + outcome;
        routeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_route_attempts_total")
                        .description("Routing attempts by service, node and outcome")
                        .tag("service", service)
                        .tag("node", nodeId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementResolution(ResolutionStrategy strategy) {
        resolutionCounters.computeIfAbsent(strategy.name(), k ->
                Counter.builder(prefix + "_sync_resolutions_total")
                        .description("Applied offline operations by resolution strategy")
                        .tag("strategy", strategy.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers per-node gauges once per node id.
     */
    public void registerNode(String nodeId, Supplier<Number> activeTasks, Supplier<Number> status) {
        if (nodeGauges.putIfAbsent(nodeId, Boolean.TRUE) != null) {
            return;
        }
        Gauge.builder(prefix + "_node_active_tasks", activeTasks, s -> s.get().doubleValue())
                .description("Active tasks per node")
                .tag("node", nodeId)
                .register(registry);
        Gauge.builder(prefix + "_node_status", status, s -> s.get().doubleValue())
                .description("Node status (0=OFFLINE, 1=DEGRADED, 2=ONLINE)")
                .tag("node", nodeId)
                .register(registry);
    }

    public void setQueueDepth(int value) {
        queueDepth.set(value);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public void setOnlineNodes(int value) {
        onlineNodes.set(value);
    }

    public void setOfflinePending(int value) {
        offlinePending.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
