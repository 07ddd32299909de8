package fr.lapetina.mesh.coordinator.domain.routing;

import fr.lapetina.mesh.coordinator.domain.model.RoutingPolicyType;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for routing policies.
 *
 * Supports runtime policy switching without service restart.
 */
public final class PolicyFactory {

    private static final Map<String, Supplier<RoutingPolicy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(RoutingPolicyType.LOCAL_FIRST.tag(), LocalFirstPolicy::new);
        register(RoutingPolicyType.PERFORMANCE_BASED.tag(), PerformanceBasedPolicy::new);
        register(RoutingPolicyType.COST_OPTIMIZED.tag(), CostOptimizedPolicy::new);
    }

    private PolicyFactory() {
        // Utility class
    }

    /**
     * Registers a custom policy.
     *
     * @param name Policy name (used in configuration)
     * @param supplier Factory for creating policy instances
     */
    public static void register(String name, Supplier<RoutingPolicy> supplier) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), supplier);
    }

    /**
     * Creates a policy by name.
     *
     * @param name Policy name from configuration
     * @return Policy instance, or empty if not found
     */
    public static Optional<RoutingPolicy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<RoutingPolicy> supplier = REGISTRY.get(name.toLowerCase(Locale.ROOT).replace('_', '-'));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static RoutingPolicy create(RoutingPolicyType type) {
        return create(type.tag()).orElseGet(LocalFirstPolicy::new);
    }

    /**
     * Returns all registered policy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
