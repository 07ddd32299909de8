package fr.lapetina.mesh.coordinator.routing;

import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.domain.model.Route;
import fr.lapetina.mesh.coordinator.domain.model.RouteCandidate;
import fr.lapetina.mesh.coordinator.domain.model.RouteTier;
import fr.lapetina.mesh.coordinator.domain.model.RoutingPolicyType;
import fr.lapetina.mesh.coordinator.domain.routing.PolicyFactory;
import fr.lapetina.mesh.coordinator.domain.routing.RoutingPolicy;
import fr.lapetina.mesh.coordinator.infrastructure.config.ConfigChangeListener;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.registry.WorkerRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.transport.CircuitBreaker;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransientNetworkException;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportMessage;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Resolves a logical service to an ordered list of candidate nodes and runs
 * calls against that list with failover.
 *
 * <p>Resolution starts from the configured route template, drops candidates
 * that are unknown, OFFLINE or behind an open circuit breaker, and lets the
 * route's policy order the rest. Health data is read without locking and may
 * be slightly stale.
 *
 * <p>A call tries each resolved candidate at most once. A failed attempt marks
 * the node DEGRADED, counts against its breaker and moves to the next
 * candidate until the list or the request window runs out.
 */
public final class ConnectionRouter implements ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRouter.class);

    private final WorkerRegistry registry;
    private final Transport transport;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final Duration requestWindow;
    private final Duration attemptTimeout;
    private final int breakerFailureThreshold;
    private final Duration breakerCoolDown;
    private final int breakerHalfOpenSuccesses;

    private final AtomicReference<Map<String, Route>> routes = new AtomicReference<>(Map.of());
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private ConnectionRouter(Builder builder) {
        this.registry = builder.registry;
        this.transport = builder.transport;
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;
        this.requestWindow = builder.requestWindow;
        this.attemptTimeout = builder.attemptTimeout;
        this.breakerFailureThreshold = builder.breakerFailureThreshold;
        this.breakerCoolDown = builder.breakerCoolDown;
        this.breakerHalfOpenSuccesses = builder.breakerHalfOpenSuccesses;
        replaceRoutes(builder.routes);
    }

    /**
     * Resolves with the policy declared on the route.
     *
     * @throws UnknownRouteException if no route is configured for the service
     */
    public List<RouteCandidate> resolve(String service) {
        return resolve(service, requireRoute(service).policy());
    }

    /**
     * Resolves with an explicit policy, overriding the route's own.
     *
     * @throws UnknownRouteException if no route is configured for the service
     */
    public List<RouteCandidate> resolve(String service, RoutingPolicyType policyType) {
        Route route = requireRoute(service);
        List<RouteCandidate> reachable = new ArrayList<>();
        for (RouteCandidate candidate : route.candidates()) {
            Optional<NodeStatus> status = registry.status(candidate.nodeId());
            if (status.isEmpty() || status.get() == NodeStatus.OFFLINE) {
                continue;
            }
            if (!breakerFor(candidate.nodeId()).allowRequest()) {
                continue;
            }
            reachable.add(candidate);
        }
        RoutingPolicy policy = PolicyFactory.create(policyType);
        List<RouteCandidate> ordered = policy.order(reachable, registry);
        log.debug("Route resolved: service={}, policy={}, candidates={}",
                service, policy.getName(), ordered.stream().map(RouteCandidate::nodeId).toList());
        return ordered;
    }

    /**
     * Sends a service call through the route, failing over on transport errors
     * and 5xx replies. 4xx replies are returned to the caller as they are.
     */
    public CompletableFuture<TransportReply> call(String service, Map<String, Object> body) {
        String correlationId = UUID.randomUUID().toString();
        return execute(service, node -> transport
                .send(node, TransportMessage.call(service, correlationId, body), attemptTimeout)
                .thenApply(reply -> {
                    if (reply.status() >= 500) {
                        throw new TransientNetworkException(node.getId(), "HTTP " + reply.status() + ": " + reply.errorMessage());
                    }
                    return reply;
                }));
    }

    /**
     * Runs {@code call} against the resolved candidates in order until one
     * succeeds. Completes exceptionally with {@link RouteExhaustedException}
     * once every candidate failed or the request window elapsed, and with
     * {@link UnknownRouteException} if the service has no route.
     */
    public <T> CompletableFuture<T> execute(String service, Function<Node, CompletableFuture<T>> call) {
        List<RouteCandidate> candidates;
        try {
            candidates = resolve(service);
        } catch (UnknownRouteException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (candidates.isEmpty()) {
            log.warn("No reachable candidate: service={}", service);
            return CompletableFuture.failedFuture(new RouteExhaustedException(service, List.of()));
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(service, candidates, 0, call, clock.instant().plus(requestWindow), new ArrayList<>(), result);
        return result;
    }

    private <T> void attempt(
            String service,
            List<RouteCandidate> candidates,
            int index,
            Function<Node, CompletableFuture<T>> call,
            Instant deadline,
            List<String> failures,
            CompletableFuture<T> result
    ) {
        if (index >= candidates.size()) {
            log.warn("Route exhausted: service={}, attempts={}", service, failures);
            result.completeExceptionally(new RouteExhaustedException(service, failures));
            return;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            failures.add("request window of " + requestWindow.toMillis() + "ms elapsed");
            log.warn("Route exhausted: service={}, attempts={}", service, failures);
            result.completeExceptionally(new RouteExhaustedException(service, failures));
            return;
        }

        String nodeId = candidates.get(index).nodeId();
        Optional<Node> node = registry.getNode(nodeId);
        CircuitBreaker breaker = breakerFor(nodeId);
        // Re-checked here: earlier attempts may have changed the picture
        if (node.isEmpty() || node.get().getStatus() == NodeStatus.OFFLINE || !breaker.allowRequest()) {
            failures.add(nodeId + ": unavailable");
            attempt(service, candidates, index + 1, call, deadline, failures, result);
            return;
        }

        long timeoutMs = Math.min(attemptTimeout.toMillis(), remaining.toMillis());
        long start = System.nanoTime();
        CompletableFuture<T> future;
        try {
            future = call.apply(node.get());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((value, throwable) -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (throwable == null) {
                        breaker.recordSuccess();
                        registry.recordCallOutcome(nodeId, true, latencyMs);
                        metricsRegistry.incrementRouteAttempt(service, nodeId, true);
                        log.debug("Route attempt succeeded: service={}, nodeId={}, latencyMs={}", service, nodeId, latencyMs);
                        result.complete(value);
                        return;
                    }
                    Throwable cause = Transport.unwrap(throwable);
                    String reason = cause instanceof TimeoutException
                            ? "timed out after " + timeoutMs + "ms"
                            : cause.getMessage();
                    breaker.recordFailure();
                    registry.recordCallOutcome(nodeId, false, latencyMs);
                    registry.markDegraded(nodeId);
                    metricsRegistry.incrementRouteAttempt(service, nodeId, false);
                    log.warn("Route attempt failed, advancing: service={}, nodeId={}, attempt={}/{}, reason={}",
                            service, nodeId, index + 1, candidates.size(), reason);
                    failures.add(nodeId + ": " + reason);
                    attempt(service, candidates, index + 1, call, deadline, failures, result);
                });
    }

    /**
     * Replaces all route templates atomically.
     */
    public void replaceRoutes(Map<String, Route> newRoutes) {
        Map<String, Route> previous = routes.getAndSet(Map.copyOf(newRoutes));
        log.info("Routes updated: services={} (was {})", newRoutes.keySet(), previous.keySet());
    }

    @Override
    public void onConfigChanged(CoordinatorConfig oldConfig, CoordinatorConfig newConfig) {
        replaceRoutes(routesFrom(newConfig));
    }

    public Map<String, Route> getRoutes() {
        return routes.get();
    }

    public Optional<Route> getRoute(String service) {
        return Optional.ofNullable(routes.get().get(service));
    }

    /**
     * Breaker states of every endpoint seen so far.
     */
    public Map<String, CircuitBreaker.State> getBreakerStates() {
        Map<String, CircuitBreaker.State> states = new LinkedHashMap<>();
        breakers.forEach((nodeId, breaker) -> states.put(nodeId, breaker.getState()));
        return states;
    }

    /**
     * Breaker details of every endpoint seen so far, ordered by node id.
     */
    public List<CircuitBreaker.Snapshot> getBreakerSnapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreaker.Snapshot::nodeId))
                .toList();
    }

    /**
     * Closes the breaker of an endpoint, putting it back into rotation.
     *
     * @return false if no call ever went to that node
     */
    public boolean resetBreaker(String nodeId) {
        CircuitBreaker breaker = breakers.get(nodeId);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public CircuitBreaker breakerFor(String nodeId) {
        return breakers.computeIfAbsent(nodeId, id -> new CircuitBreaker(
                id, breakerFailureThreshold, breakerCoolDown, breakerHalfOpenSuccesses, clock));
    }

    private Route requireRoute(String service) {
        Route route = routes.get().get(service);
        if (route == null) {
            throw new UnknownRouteException(service);
        }
        return route;
    }

    /**
     * Builds route templates from configuration, keyed by service.
     */
    public static Map<String, Route> routesFrom(CoordinatorConfig config) {
        Map<String, Route> result = new LinkedHashMap<>();
        for (CoordinatorConfig.RouteConfig routeConfig : config.getRoutes()) {
            List<RouteCandidate> candidates = routeConfig.getCandidates().stream()
                    .map(c -> new RouteCandidate(
                            c.getNodeId(),
                            RouteTier.valueOf(c.getTier().trim().toUpperCase(Locale.ROOT)),
                            c.getCost()))
                    .toList();
            result.put(routeConfig.getService(), new Route(
                    routeConfig.getService(),
                    candidates,
                    RoutingPolicyType.fromTag(routeConfig.getPolicy())));
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ConnectionRouter.
     */
    public static final class Builder {
        private WorkerRegistry registry;
        private Transport transport;
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private Map<String, Route> routes = Map.of();
        private Duration requestWindow = Duration.ofSeconds(10);
        private Duration attemptTimeout = Duration.ofSeconds(3);
        private int breakerFailureThreshold = 5;
        private Duration breakerCoolDown = Duration.ofSeconds(30);
        private int breakerHalfOpenSuccesses = 2;

        public Builder registry(WorkerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder routes(Map<String, Route> routes) {
            this.routes = routes;
            return this;
        }

        public Builder route(Route route) {
            Map<String, Route> copy = new LinkedHashMap<>(routes);
            copy.put(route.service(), route);
            this.routes = copy;
            return this;
        }

        public Builder requestWindow(Duration requestWindow) {
            this.requestWindow = requestWindow;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder circuitBreaker(int failureThreshold, Duration coolDown, int halfOpenSuccesses) {
            this.breakerFailureThreshold = failureThreshold;
            this.breakerCoolDown = coolDown;
            this.breakerHalfOpenSuccesses = halfOpenSuccesses;
            return this;
        }

        public Builder fromConfig(CoordinatorConfig config) {
            CoordinatorConfig.HealthConfig health = config.getHealth();
            this.routes = routesFrom(config);
            this.requestWindow = Duration.ofMillis(config.getRouter().getRequestWindowMs());
            this.attemptTimeout = Duration.ofMillis(config.getRouter().getAttemptTimeoutMs());
            this.breakerFailureThreshold = health.getCircuitBreakerFailureThreshold();
            this.breakerCoolDown = Duration.ofMillis(health.getCircuitBreakerRecoveryMs());
            this.breakerHalfOpenSuccesses = health.getCircuitBreakerHalfOpenSuccesses();
            return this;
        }

        public ConnectionRouter build() {
            if (registry == null) {
                throw new IllegalStateException("WorkerRegistry is required");
            }
            if (transport == null) {
                throw new IllegalStateException("Transport is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new ConnectionRouter(this);
        }
    }
}
